package dev.secondbrain.rerank;

import java.util.List;

/** Pairwise (query, document) relevance scorer applied to the head of a fused ranking. */
public interface Reranker {

  /**
   * Rescores {@code candidates} against {@code query}. Never throws for model failures: an
   * unavailable model yields {@link Reranking#passThrough}.
   *
   * @param query the raw user query
   * @param candidates fused candidates, best first
   * @param topK maximum number of results
   */
  Reranking rerank(String query, List<RerankCandidate> candidates, int topK);

  boolean isAvailable();
}
