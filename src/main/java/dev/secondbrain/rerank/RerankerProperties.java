package dev.secondbrain.rerank;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the cross-encoder, bound from {@code secondbrain.reranker.*}.
 *
 * <ul>
 *   <li>{@code rerank-top-k} - fused candidates scored by the cross-encoder (default 20)
 *   <li>{@code final-top-k} - minimum number of reranked candidates kept for blending (default 8)
 *   <li>{@code timeout} - maximum wait for one scoring call (default 5s)
 * </ul>
 *
 * <p>When {@code enabled} is false or the model files are missing, a {@link NoOpReranker} is used.
 */
@Configuration
@ConfigurationProperties(prefix = "secondbrain.reranker")
public class RerankerProperties {

  private boolean enabled = true;
  private String modelPath = "models/ms-marco-MiniLM-L-6-v2/model.onnx";
  private String tokenizerPath = "models/ms-marco-MiniLM-L-6-v2/tokenizer.json";
  private int rerankTopK = 20;
  private int finalTopK = 8;
  private Duration timeout = Duration.ofSeconds(5);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  public void validate() {
    if (rerankTopK < 1) {
      throw new IllegalStateException(
          "secondbrain.reranker.rerank-top-k must be >= 1, got: " + rerankTopK);
    }
    if (finalTopK < 1) {
      throw new IllegalStateException(
          "secondbrain.reranker.final-top-k must be >= 1, got: " + finalTopK);
    }
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException(
          "secondbrain.reranker.timeout must be positive, got: " + timeout);
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getModelPath() {
    return modelPath;
  }

  public void setModelPath(String modelPath) {
    this.modelPath = modelPath;
  }

  public String getTokenizerPath() {
    return tokenizerPath;
  }

  public void setTokenizerPath(String tokenizerPath) {
    this.tokenizerPath = tokenizerPath;
  }

  public int getRerankTopK() {
    return rerankTopK;
  }

  public void setRerankTopK(int rerankTopK) {
    this.rerankTopK = rerankTopK;
  }

  public int getFinalTopK() {
    return finalTopK;
  }

  public void setFinalTopK(int finalTopK) {
    this.finalTopK = finalTopK;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }
}
