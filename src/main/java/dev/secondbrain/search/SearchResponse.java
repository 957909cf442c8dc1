package dev.secondbrain.search;

import dev.secondbrain.retrieval.Signal;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Result of {@link SearchFacade#search(SearchRequest)}.
 *
 * @param documents hits, best first
 * @param requestedMode the mode the caller asked for
 * @param effectiveMode the mode actually answered after degradation
 * @param signalsUsed signals that produced a ranking for this query
 */
public record SearchResponse(
    List<ScoredDocument> documents,
    SearchMode requestedMode,
    SearchMode effectiveMode,
    Set<Signal> signalsUsed) {

  public SearchResponse {
    documents = List.copyOf(documents);
    EnumSet<Signal> used = EnumSet.noneOf(Signal.class);
    used.addAll(signalsUsed);
    signalsUsed = Collections.unmodifiableSet(used);
  }

  static SearchResponse empty(SearchMode requested, SearchMode effective) {
    return new SearchResponse(List.of(), requested, effective, Set.of());
  }

  public boolean degraded() {
    return requestedMode != effectiveMode;
  }
}
