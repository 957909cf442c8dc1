package dev.secondbrain.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * One document in a single retriever's ranked list.
 *
 * @param documentId the opaque document identifier
 * @param rank the 1-based position in the retriever's list
 * @param score the retriever's raw score (BM25 score, cosine similarity, ...)
 */
public record RankedEntry(long documentId, int rank, double score) {

  /** Score descending, ties broken by ascending document id. */
  public static final Comparator<Map.Entry<Long, Double>> SCORE_ORDER =
      Map.Entry.<Long, Double>comparingByValue()
          .reversed()
          .thenComparing(Map.Entry.<Long, Double>comparingByKey());

  public RankedEntry {
    if (rank < 1) {
      throw new IllegalArgumentException("rank is 1-based, got: " + rank);
    }
  }

  /**
   * Sorts raw per-document scores into a ranked list.
   *
   * @param scores document id to raw score
   * @param limit maximum number of entries to return
   * @return entries ordered by score descending then id ascending, ranks starting at 1
   */
  public static List<RankedEntry> rank(Map<Long, Double> scores, int limit) {
    List<Map.Entry<Long, Double>> sorted = new ArrayList<>(scores.entrySet());
    sorted.sort(SCORE_ORDER);
    int size = Math.min(Math.max(limit, 0), sorted.size());
    List<RankedEntry> ranked = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      Map.Entry<Long, Double> entry = sorted.get(i);
      ranked.add(new RankedEntry(entry.getKey(), i + 1, entry.getValue()));
    }
    return List.copyOf(ranked);
  }
}
