package dev.secondbrain.search.eval;

/**
 * A graded relevance judgment for one document.
 *
 * @param documentId the judged document
 * @param grade relevance grade: 0 = not relevant, 1 = partially relevant, 2 = highly relevant
 */
public record RelevanceJudgment(long documentId, int grade) {

  public RelevanceJudgment {
    if (grade < 0 || grade > 2) {
      throw new IllegalArgumentException("Grade must be 0, 1, or 2 but was " + grade);
    }
  }
}
