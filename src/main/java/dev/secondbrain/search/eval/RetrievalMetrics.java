package dev.secondbrain.search.eval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Standard Information Retrieval metrics over ranked document ids.
 *
 * <p>All methods are pure functions. A document is relevant when its judged grade is >= 1; an
 * unjudged document has grade 0.
 */
public final class RetrievalMetrics {

  private RetrievalMetrics() {}

  /** All metrics at one depth. */
  public record MetricsResult(
      double recallAtK,
      double precisionAtK,
      double mrr,
      double ndcgAtK,
      double averagePrecision,
      double hitRate) {}

  /** Recall@k: fraction of relevant documents found in the top k. */
  public static double recallAtK(List<Long> retrieved, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrieved, judgments, k).recallAtK();
  }

  /** Precision@k: fraction of the top k that is relevant. */
  public static double precisionAtK(
      List<Long> retrieved, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrieved, judgments, k).precisionAtK();
  }

  /** Reciprocal rank of the first relevant document within the top k. */
  public static double mrr(List<Long> retrieved, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrieved, judgments, k).mrr();
  }

  /** NDCG@k with graded relevance. */
  public static double ndcgAtK(List<Long> retrieved, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrieved, judgments, k).ndcgAtK();
  }

  /** Mean of precision at each relevant position, over all relevant documents. */
  public static double averagePrecision(
      List<Long> retrieved, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrieved, judgments, k).averagePrecision();
  }

  /** 1.0 if any relevant document is in the top k, else 0.0. */
  public static double hitRate(List<Long> retrieved, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrieved, judgments, k).hitRate();
  }

  /** Computes every metric at depth {@code k} in one pass over the top k. */
  public static MetricsResult computeAll(
      List<Long> retrieved, List<RelevanceJudgment> judgments, int k) {
    Map<Long, Integer> grades = toGradeMap(judgments);
    Set<Long> relevant =
        grades.entrySet().stream()
            .filter(e -> e.getValue() >= 1)
            .map(Map.Entry::getKey)
            .collect(Collectors.toSet());
    List<Long> topK = retrieved.subList(0, Math.min(Math.max(k, 0), retrieved.size()));

    int found = 0;
    double reciprocalRank = 0.0;
    double sumPrecision = 0.0;
    double dcg = 0.0;
    for (int i = 0; i < topK.size(); i++) {
      Long id = topK.get(i);
      dcg += grades.getOrDefault(id, 0) / log2(i + 2);
      if (relevant.contains(id)) {
        found++;
        sumPrecision += (double) found / (i + 1);
        if (reciprocalRank == 0.0) {
          reciprocalRank = 1.0 / (i + 1);
        }
      }
    }
    double idcg = idealDcg(grades, topK.size());

    double recall = relevant.isEmpty() ? 0.0 : (double) found / relevant.size();
    double precision = topK.isEmpty() ? 0.0 : (double) found / topK.size();
    double ndcg = idcg == 0.0 ? 0.0 : dcg / idcg;
    double averagePrecision = relevant.isEmpty() ? 0.0 : sumPrecision / relevant.size();
    double hitRate = found > 0 ? 1.0 : 0.0;
    return new MetricsResult(recall, precision, reciprocalRank, ndcg, averagePrecision, hitRate);
  }

  private static Map<Long, Integer> toGradeMap(List<RelevanceJudgment> judgments) {
    Map<Long, Integer> grades = new HashMap<>();
    for (RelevanceJudgment judgment : judgments) {
      grades.merge(judgment.documentId(), judgment.grade(), Math::max);
    }
    return grades;
  }

  private static double idealDcg(Map<Long, Integer> grades, int k) {
    List<Integer> sorted = new ArrayList<>(grades.values());
    sorted.sort(Comparator.reverseOrder());
    double idcg = 0.0;
    for (int i = 0; i < Math.min(k, sorted.size()); i++) {
      idcg += sorted.get(i) / log2(i + 2);
    }
    return idcg;
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2);
  }
}
