package dev.secondbrain.fusion;

import dev.secondbrain.rerank.RerankedCandidate;
import dev.secondbrain.rerank.Reranking;
import dev.secondbrain.retrieval.RankedEntry;
import dev.secondbrain.retrieval.Signal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Reciprocal Rank Fusion of per-retriever rankings, with optional cross-encoder blending.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Each retriever r contributes {@code weight_r / (k + rank_r(d))} for every document d it
 *       returned; a retriever that omits d contributes 0
 *   <li>{@code rrf(d)} is the sum of the contributions
 *   <li>With reranking applied: {@code combined = (1 - blend) * rrf + blend * weight_rerank *
 *       sigmoid(raw)}; otherwise {@code combined = rrf}
 *   <li>Sort by combined score descending, ties by ascending document id
 * </ol>
 *
 * <p>Only ranks enter the formula, so raw scores on incompatible scales (BM25, cosine) never need
 * normalising.
 */
@Component
public class FusionEngine {

  static final Comparator<FusedResult> ORDER =
      Comparator.comparingDouble(FusedResult::combinedScore)
          .reversed()
          .thenComparingLong(FusedResult::documentId);

  private final FusionProperties properties;

  public FusionEngine(FusionProperties properties) {
    this.properties = properties;
  }

  /**
   * Fuses retriever rankings.
   *
   * @param rankings ranked list per retrieval signal; {@link Signal#RERANK} is not a retriever
   * @return fused results, best first; empty when every list is empty
   */
  public List<FusedResult> fuse(Map<Signal, List<RankedEntry>> rankings) {
    if (rankings.containsKey(Signal.RERANK)) {
      throw new IllegalArgumentException(
          "RERANK is applied after fusion, not fused as a retriever");
    }
    Map<Long, Accumulator> byDocument = new HashMap<>();
    for (Map.Entry<Signal, List<RankedEntry>> ranking : rankings.entrySet()) {
      Signal signal = ranking.getKey();
      double weight = properties.weight(signal);
      for (RankedEntry entry : ranking.getValue()) {
        Accumulator acc = byDocument.computeIfAbsent(entry.documentId(), Accumulator::new);
        acc.rrf += weight / (properties.getK() + entry.rank());
        acc.scores.put(signal, entry.score());
        acc.ranks.put(signal, entry.rank());
        acc.sources.add(signal);
      }
    }
    List<FusedResult> fused = new ArrayList<>(byDocument.size());
    for (Accumulator acc : byDocument.values()) {
      fused.add(
          new FusedResult(
              acc.documentId, acc.scores, acc.ranks, acc.rrf, 0.0, 0.0, acc.rrf, 0, acc.sources));
    }
    return ranked(fused);
  }

  /**
   * Blends cross-encoder scores into a fused ranking.
   *
   * <p>When {@code reranking} was not applied the input is returned unchanged. Otherwise only the
   * reranked documents are kept, each with its blended combined score.
   */
  public List<FusedResult> applyReranking(List<FusedResult> fused, Reranking reranking) {
    if (!reranking.applied()) {
      return fused;
    }
    Map<Long, FusedResult> byId = new HashMap<>();
    fused.forEach(r -> byId.put(r.documentId(), r));

    double blend = properties.getRerankBlend();
    double weight = properties.weight(Signal.RERANK);
    List<FusedResult> blended = new ArrayList<>(reranking.candidates().size());
    int rerankRank = 0;
    for (RerankedCandidate candidate : reranking.candidates()) {
      rerankRank++;
      FusedResult base = byId.get(candidate.documentId());
      if (base == null) {
        continue;
      }
      Map<Signal, Double> scores = new EnumMap<>(Signal.class);
      scores.putAll(base.signalScores());
      scores.put(Signal.RERANK, candidate.rawScore());
      Map<Signal, Integer> ranks = new EnumMap<>(Signal.class);
      ranks.putAll(base.signalRanks());
      ranks.put(Signal.RERANK, rerankRank);
      Set<Signal> sources = EnumSet.noneOf(Signal.class);
      sources.addAll(base.fusionSources());
      sources.add(Signal.RERANK);

      double combined =
          (1.0 - blend) * base.rrfScore() + blend * weight * candidate.normalizedScore();
      blended.add(
          new FusedResult(
              base.documentId(),
              scores,
              ranks,
              base.rrfScore(),
              candidate.rawScore(),
              candidate.normalizedScore(),
              combined,
              0,
              sources));
    }
    return ranked(blended);
  }

  private static List<FusedResult> ranked(List<FusedResult> results) {
    List<FusedResult> sorted = new ArrayList<>(results);
    sorted.sort(ORDER);
    List<FusedResult> out = new ArrayList<>(sorted.size());
    for (int i = 0; i < sorted.size(); i++) {
      out.add(sorted.get(i).withRank(i + 1));
    }
    return List.copyOf(out);
  }

  private static final class Accumulator {
    private final long documentId;
    private final Map<Signal, Double> scores = new EnumMap<>(Signal.class);
    private final Map<Signal, Integer> ranks = new EnumMap<>(Signal.class);
    private final Set<Signal> sources = EnumSet.noneOf(Signal.class);
    private double rrf;

    private Accumulator(long documentId) {
      this.documentId = documentId;
    }
  }
}
