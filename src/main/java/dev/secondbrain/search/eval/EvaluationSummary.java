package dev.secondbrain.search.eval;

import dev.secondbrain.search.SearchMode;
import java.util.List;

/**
 * Averages of one search mode over a golden set, with pass/fail against the configured thresholds.
 *
 * @param mode the evaluated mode
 * @param queryCount number of golden queries
 * @param recallAt5 average Recall@5
 * @param recallAt10 average Recall@10
 * @param precisionAt10 average Precision@10
 * @param mrr average MRR
 * @param ndcgAt10 average NDCG@10
 * @param map mean average precision
 * @param hitRateAt10 average Hit Rate@10
 * @param passed true if Recall@10 and MRR meet their thresholds
 * @param failedQueries queries whose own Recall@10 or MRR fell below a threshold
 */
public record EvaluationSummary(
    SearchMode mode,
    int queryCount,
    double recallAt5,
    double recallAt10,
    double precisionAt10,
    double mrr,
    double ndcgAt10,
    double map,
    double hitRateAt10,
    boolean passed,
    List<String> failedQueries) {

  public EvaluationSummary {
    failedQueries = List.copyOf(failedQueries);
  }
}
