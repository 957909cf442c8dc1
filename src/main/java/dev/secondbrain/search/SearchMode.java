package dev.secondbrain.search;

import java.util.Locale;

/** Retrieval strategies offered by {@link SearchFacade}. */
public enum SearchMode {
  /** BM25 only. */
  KEYWORD,
  /** Cosine similarity over embeddings only. */
  SEMANTIC,
  /** BM25 and semantic rankings blended with RRF, no reranking. */
  HYBRID,
  /** Every signal: RRF followed by cross-encoder reranking of the head. */
  FUSED;

  /**
   * Parses a mode name case-insensitively.
   *
   * @throws IllegalArgumentException for a null or unknown name
   */
  public static SearchMode fromString(String value) {
    if (value == null) {
      throw new IllegalArgumentException("Search mode must not be null");
    }
    try {
      return valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Unknown search mode: '" + value + "'. Valid modes: keyword, semantic, hybrid, fused", e);
    }
  }
}
