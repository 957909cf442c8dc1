package dev.secondbrain.rerank;

/**
 * A cross-encoder verdict for one candidate.
 *
 * @param documentId the candidate document
 * @param rawScore unbounded model logit
 * @param normalizedScore {@code sigmoid(rawScore)}, in [0, 1]
 */
public record RerankedCandidate(long documentId, double rawScore, double normalizedScore) {

  public static RerankedCandidate of(long documentId, double rawScore) {
    return new RerankedCandidate(documentId, rawScore, sigmoid(rawScore));
  }

  public static double sigmoid(double x) {
    return 1.0 / (1.0 + Math.exp(-x));
  }
}
