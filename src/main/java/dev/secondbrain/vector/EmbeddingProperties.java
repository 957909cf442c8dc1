package dev.secondbrain.vector;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the embedding backend, bound from {@code secondbrain.embedding.*}.
 *
 * <ul>
 *   <li>{@code provider} - {@code onnx} (in-process bge-small-en-v1.5, default), {@code ollama} or
 *       {@code none}
 *   <li>{@code model-id} - model name; blank selects the provider default
 *   <li>{@code ollama-base-url} - Ollama server (default http://localhost:11434)
 *   <li>{@code timeout} - per-call timeout (default 10s)
 *   <li>{@code min-similarity} - semantic hits below this cosine are dropped (default 0.1)
 *   <li>{@code max-attempts} / {@code retry-delay} - embedding job retries (default 3, 500ms)
 *   <li>{@code model-threads} - size of the model worker pool (default 4)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "secondbrain.embedding")
public class EmbeddingProperties {

  /** Embedding backends. */
  public enum Provider {
    ONNX("bge-small-en-v1.5"),
    OLLAMA("nomic-embed-text"),
    NONE("none");

    private final String defaultModelId;

    Provider(String defaultModelId) {
      this.defaultModelId = defaultModelId;
    }

    public String defaultModelId() {
      return defaultModelId;
    }
  }

  private Provider provider = Provider.ONNX;
  private String modelId = "";
  private String ollamaBaseUrl = "http://localhost:11434";
  private Duration timeout = Duration.ofSeconds(10);
  private double minSimilarity = 0.1;
  private int maxAttempts = 3;
  private Duration retryDelay = Duration.ofMillis(500);
  private int modelThreads = 4;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  public void validate() {
    if (timeout == null || timeout.isNegative() || timeout.isZero()) {
      throw new IllegalStateException(
          "secondbrain.embedding.timeout must be positive, got: " + timeout);
    }
    if (minSimilarity < -1.0 || minSimilarity > 1.0) {
      throw new IllegalStateException(
          "secondbrain.embedding.min-similarity must be in [-1.0, 1.0], got: " + minSimilarity);
    }
    if (maxAttempts < 1) {
      throw new IllegalStateException(
          "secondbrain.embedding.max-attempts must be >= 1, got: " + maxAttempts);
    }
    if (retryDelay == null || retryDelay.isNegative()) {
      throw new IllegalStateException(
          "secondbrain.embedding.retry-delay must be >= 0, got: " + retryDelay);
    }
    if (modelThreads < 1) {
      throw new IllegalStateException(
          "secondbrain.embedding.model-threads must be >= 1, got: " + modelThreads);
    }
  }

  /** The configured model id, or the provider default when blank. */
  public String effectiveModelId() {
    return modelId == null || modelId.isBlank() ? provider.defaultModelId() : modelId;
  }

  public Provider getProvider() {
    return provider;
  }

  public void setProvider(Provider provider) {
    this.provider = provider;
  }

  public String getModelId() {
    return modelId;
  }

  public void setModelId(String modelId) {
    this.modelId = modelId;
  }

  public String getOllamaBaseUrl() {
    return ollamaBaseUrl;
  }

  public void setOllamaBaseUrl(String ollamaBaseUrl) {
    this.ollamaBaseUrl = ollamaBaseUrl;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }

  public double getMinSimilarity() {
    return minSimilarity;
  }

  public void setMinSimilarity(double minSimilarity) {
    this.minSimilarity = minSimilarity;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Duration getRetryDelay() {
    return retryDelay;
  }

  public void setRetryDelay(Duration retryDelay) {
    this.retryDelay = retryDelay;
  }

  public int getModelThreads() {
    return modelThreads;
  }

  public void setModelThreads(int modelThreads) {
    this.modelThreads = modelThreads;
  }
}
