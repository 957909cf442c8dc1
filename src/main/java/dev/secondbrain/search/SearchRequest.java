package dev.secondbrain.search;

/**
 * A search call.
 *
 * @param query the raw user query (must not be null)
 * @param mode the requested retrieval mode (must not be null)
 * @param limit the maximum number of results (must be >= 0)
 */
public record SearchRequest(String query, SearchMode mode, int limit) {

  /** Default number of results when not specified. */
  private static final int DEFAULT_LIMIT = 10;

  /** Compact constructor validating input. */
  public SearchRequest {
    if (query == null) {
      throw new IllegalArgumentException("Query must not be null");
    }
    if (mode == null) {
      throw new IllegalArgumentException("Search mode must not be null");
    }
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative, got: " + limit);
    }
  }

  /** Convenience constructor for a hybrid search returning 10 results. */
  public SearchRequest(String query) {
    this(query, SearchMode.HYBRID, DEFAULT_LIMIT);
  }
}
