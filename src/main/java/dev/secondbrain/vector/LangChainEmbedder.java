package dev.secondbrain.vector;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.secondbrain.retrieval.BoundedModelCall;
import dev.secondbrain.retrieval.EmbeddingUnavailableException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * {@link Embedder} backed by a LangChain4j {@link EmbeddingModel}, either the in-process ONNX
 * bge-small-en-v1.5 model or an Ollama server.
 *
 * <p>Each call runs on the model worker pool and is abandoned after {@code timeout}.
 */
public class LangChainEmbedder implements Embedder {

  private final EmbeddingModel model;
  private final String modelId;
  private final ExecutorService executor;
  private final Duration timeout;

  public LangChainEmbedder(
      EmbeddingModel model, String modelId, ExecutorService executor, Duration timeout) {
    this.model = model;
    this.modelId = modelId;
    this.executor = executor;
    this.timeout = timeout;
  }

  @Override
  public float[] embed(String text) {
    return BoundedModelCall.call(
        executor,
        timeout,
        () -> model.embed(text).content().vector(),
        cause ->
            new EmbeddingUnavailableException(
                "Embedding with model " + modelId + " failed: " + cause.getMessage(), cause));
  }

  @Override
  public String modelId() {
    return modelId;
  }
}
