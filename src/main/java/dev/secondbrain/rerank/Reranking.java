package dev.secondbrain.rerank;

import java.util.List;

/**
 * Output of a {@link Reranker}.
 *
 * @param candidates reranked candidates in final order
 * @param applied false when the model was unavailable and {@code candidates} is the input order
 *     with zero scores
 */
public record Reranking(List<RerankedCandidate> candidates, boolean applied) {

  public Reranking {
    candidates = List.copyOf(candidates);
  }

  /** Input order unchanged, every score 0.0, capped at {@code topK}. */
  public static Reranking passThrough(List<RerankCandidate> candidates, int topK) {
    return new Reranking(
        candidates.stream()
            .limit(Math.max(topK, 0))
            .map(c -> new RerankedCandidate(c.documentId(), 0.0, 0.0))
            .toList(),
        false);
  }
}
