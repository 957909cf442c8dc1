package dev.secondbrain.retrieval;

/** Thrown when sanitization leaves nothing usable for keyword matching. */
public class InvalidQueryException extends RetrievalException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
