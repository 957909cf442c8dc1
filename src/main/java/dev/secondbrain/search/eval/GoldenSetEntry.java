package dev.secondbrain.search.eval;

import java.util.List;

/**
 * An annotated evaluation query.
 *
 * @param query the search query as a user would type it
 * @param judgments graded judgments; an absent document counts as grade 0
 */
public record GoldenSetEntry(String query, List<RelevanceJudgment> judgments) {
  public GoldenSetEntry {
    judgments = List.copyOf(judgments);
  }
}
