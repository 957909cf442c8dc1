package dev.secondbrain.search;

import dev.secondbrain.retrieval.Signal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A search hit as returned to callers.
 *
 * @param id document id
 * @param title document title
 * @param snippet excerpt around the matched terms
 * @param signalScores raw score per contributing signal
 * @param signals signals that contributed to this hit
 * @param matchedTerms query terms found in the document
 * @param finalScore the score the hits are ordered by
 * @param rank 1-based position in the response
 */
public record ScoredDocument(
    long id,
    String title,
    String snippet,
    Map<Signal, Double> signalScores,
    Set<Signal> signals,
    List<String> matchedTerms,
    double finalScore,
    int rank) {

  public ScoredDocument {
    EnumMap<Signal, Double> scores = new EnumMap<>(Signal.class);
    scores.putAll(signalScores);
    signalScores = Collections.unmodifiableMap(scores);
    EnumSet<Signal> contributing = EnumSet.noneOf(Signal.class);
    contributing.addAll(signals);
    signals = Collections.unmodifiableSet(contributing);
    matchedTerms = List.copyOf(matchedTerms);
  }
}
