package dev.secondbrain.retrieval;

/**
 * Thrown when the embedding backend is unreachable, fails or exceeds its call timeout. Callers skip
 * the semantic signal.
 */
public class EmbeddingUnavailableException extends RetrievalException {

  public EmbeddingUnavailableException(String message) {
    super(message);
  }

  public EmbeddingUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
