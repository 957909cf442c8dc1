package dev.secondbrain.retrieval;

/**
 * Root of the retrieval pipeline's failure taxonomy.
 *
 * <p>Every subtype describes a degraded-but-recoverable condition. {@code SearchFacade} converts
 * them into partial results; none of them escape a search call.
 */
public abstract class RetrievalException extends RuntimeException {

  protected RetrievalException(String message) {
    super(message);
  }

  protected RetrievalException(String message, Throwable cause) {
    super(message, cause);
  }
}
