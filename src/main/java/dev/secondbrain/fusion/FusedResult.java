package dev.secondbrain.fusion;

import dev.secondbrain.retrieval.Signal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * One document after Reciprocal Rank Fusion and optional rerank blending.
 *
 * @param documentId the document
 * @param signalScores raw score per contributing signal
 * @param signalRanks 1-based rank per contributing signal
 * @param rrfScore sum of {@code weight / (k + rank)} over the retrievers that returned it
 * @param rerankScore raw cross-encoder logit, 0 when not reranked
 * @param normalizedRerankScore sigmoid of {@code rerankScore}, 0 when not reranked
 * @param combinedScore the final ordering score
 * @param finalRank 1-based position in the fused output
 * @param fusionSources signals that contributed
 */
public record FusedResult(
    long documentId,
    Map<Signal, Double> signalScores,
    Map<Signal, Integer> signalRanks,
    double rrfScore,
    double rerankScore,
    double normalizedRerankScore,
    double combinedScore,
    int finalRank,
    Set<Signal> fusionSources) {

  public FusedResult {
    signalScores = enumMap(signalScores);
    signalRanks = enumMap(signalRanks);
    EnumSet<Signal> sources = EnumSet.noneOf(Signal.class);
    sources.addAll(fusionSources);
    fusionSources = Collections.unmodifiableSet(sources);
  }

  FusedResult withRank(int rank) {
    return new FusedResult(
        documentId,
        signalScores,
        signalRanks,
        rrfScore,
        rerankScore,
        normalizedRerankScore,
        combinedScore,
        rank,
        fusionSources);
  }

  private static <V> Map<Signal, V> enumMap(Map<Signal, V> source) {
    EnumMap<Signal, V> copy = new EnumMap<>(Signal.class);
    copy.putAll(source);
    return Collections.unmodifiableMap(copy);
  }
}
