package dev.secondbrain.search.eval;

import dev.secondbrain.search.SearchMode;
import java.util.List;

/**
 * Metrics of one golden query in one search mode.
 *
 * @param query the golden query
 * @param mode the evaluated mode
 * @param hits the retrieved documents with their relevance grade
 * @param recallAt5 recall at depth 5
 * @param recallAt10 recall at depth 10
 * @param precisionAt5 precision at depth 5
 * @param precisionAt10 precision at depth 10
 * @param mrr reciprocal rank of the first relevant hit
 * @param ndcgAt5 normalized discounted cumulative gain at depth 5
 * @param ndcgAt10 normalized discounted cumulative gain at depth 10
 * @param averagePrecision average precision at depth 10
 * @param hitRateAt10 1.0 if any relevant document is in the top 10
 */
public record EvaluationResult(
    String query,
    SearchMode mode,
    List<Hit> hits,
    double recallAt5,
    double recallAt10,
    double precisionAt5,
    double precisionAt10,
    double mrr,
    double ndcgAt5,
    double ndcgAt10,
    double averagePrecision,
    double hitRateAt10) {

  /**
   * A retrieved document.
   *
   * @param documentId the document
   * @param score the facade's final score
   * @param rank 1-based rank
   * @param relevanceGrade ground-truth grade (0, 1 or 2)
   */
  public record Hit(long documentId, double score, int rank, int relevanceGrade) {}
}
