package dev.secondbrain.retrieval;

/** Thrown when a sparse or vector index is queried before it has been initialized. */
public class IndexUnavailableException extends RetrievalException {

  public IndexUnavailableException(String message) {
    super(message);
  }
}
