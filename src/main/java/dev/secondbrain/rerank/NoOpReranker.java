package dev.secondbrain.rerank;

import java.util.List;

/** Used when reranking is disabled or the cross-encoder could not be loaded. */
public final class NoOpReranker implements Reranker {

  @Override
  public Reranking rerank(String query, List<RerankCandidate> candidates, int topK) {
    return Reranking.passThrough(candidates, topK);
  }

  @Override
  public boolean isAvailable() {
    return false;
  }
}
