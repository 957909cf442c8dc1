package dev.secondbrain.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.langchain4j.model.scoring.onnx.OnnxScoringModel;
import dev.secondbrain.document.DocumentStore;
import dev.secondbrain.document.InMemoryDocumentStore;
import dev.secondbrain.rerank.CrossEncoderReranker;
import dev.secondbrain.rerank.NoOpReranker;
import dev.secondbrain.rerank.Reranker;
import dev.secondbrain.rerank.RerankerProperties;
import dev.secondbrain.retrieval.EmbeddingUnavailableException;
import dev.secondbrain.vector.Embedder;
import dev.secondbrain.vector.EmbeddingProperties;
import dev.secondbrain.vector.LangChainEmbedder;
import dev.secondbrain.vector.NullEmbedder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the model-backed pipeline components, probing each configured backend once at startup.
 *
 * <p>A backend that is disabled, missing or failing to load is replaced by its stand-in ({@link
 * NullEmbedder}, {@link NoOpReranker}), so the rest of the pipeline only ever checks {@code
 * isAvailable()}.
 *
 * <ul>
 *   <li>Embedder: in-process ONNX bge-small-en-v1.5 quantized (384 dimensions), Ollama, or none
 *   <li>Reranker: in-process ONNX cross-encoder ms-marco-MiniLM-L-6-v2 from the configured files
 * </ul>
 */
@Configuration
public class ModelConfig {

  private static final Logger log = LoggerFactory.getLogger(ModelConfig.class);

  private static final String PROBE_TEXT = "ping";

  /** Default store when the composing application provides none. */
  @Bean
  @ConditionalOnMissingBean(DocumentStore.class)
  public InMemoryDocumentStore documentStore() {
    return new InMemoryDocumentStore();
  }

  @Bean
  public Embedder embedder(
      EmbeddingProperties properties,
      @Qualifier("modelCallExecutor") ExecutorService modelCallExecutor) {
    String modelId = properties.effectiveModelId();
    EmbeddingModel model;
    try {
      model =
          switch (properties.getProvider()) {
            case NONE -> null;
            case ONNX -> new BgeSmallEnV15QuantizedEmbeddingModel();
            case OLLAMA ->
                OllamaEmbeddingModel.builder()
                    .baseUrl(properties.getOllamaBaseUrl())
                    .modelName(modelId)
                    .timeout(properties.getTimeout())
                    .build();
          };
    } catch (RuntimeException | LinkageError e) {
      log.warn(
          "Embedding backend {} failed to load, semantic search disabled: {}",
          properties.getProvider(),
          e.toString());
      return new NullEmbedder();
    }
    if (model == null) {
      log.info("Embedding backend disabled, semantic search unavailable");
      return new NullEmbedder();
    }

    Embedder embedder =
        new LangChainEmbedder(model, modelId, modelCallExecutor, properties.getTimeout());
    try {
      int dimension = embedder.embed(PROBE_TEXT).length;
      log.info(
          "Embedding backend {} ready: model={}, dimension={}",
          properties.getProvider(),
          modelId,
          dimension);
      return embedder;
    } catch (EmbeddingUnavailableException e) {
      log.warn(
          "Embedding backend {} probe failed, semantic search disabled: {}",
          properties.getProvider(),
          e.getMessage());
      return new NullEmbedder();
    }
  }

  @Bean
  public Reranker reranker(
      RerankerProperties properties,
      @Qualifier("modelCallExecutor") ExecutorService modelCallExecutor) {
    if (!properties.isEnabled()) {
      log.info("Reranker disabled");
      return new NoOpReranker();
    }
    Path modelPath = Path.of(properties.getModelPath());
    Path tokenizerPath = Path.of(properties.getTokenizerPath());
    if (!Files.isReadable(modelPath) || !Files.isReadable(tokenizerPath)) {
      log.warn(
          "Reranker model files not found ({}, {}), reranking disabled", modelPath, tokenizerPath);
      return new NoOpReranker();
    }
    ScoringModel scoringModel;
    try {
      scoringModel = new OnnxScoringModel(modelPath.toString(), tokenizerPath.toString());
    } catch (RuntimeException | LinkageError e) {
      log.warn("Reranker model failed to load, reranking disabled: {}", e.toString());
      return new NoOpReranker();
    }
    log.info("Cross-encoder reranker ready: {}", modelPath);
    return new CrossEncoderReranker(
        scoringModel, modelCallExecutor, properties.getTimeout(), properties.getRerankTopK());
  }
}
