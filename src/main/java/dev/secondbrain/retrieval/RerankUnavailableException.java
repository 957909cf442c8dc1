package dev.secondbrain.retrieval;

/** Thrown when the cross-encoder model fails or times out. */
public class RerankUnavailableException extends RetrievalException {

  public RerankUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
