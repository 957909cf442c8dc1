package dev.secondbrain.sparse;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the BM25 index, bound from {@code secondbrain.sparse.*}.
 *
 * <ul>
 *   <li>{@code k1} - term frequency saturation (default 1.2)
 *   <li>{@code b} - document length normalisation, in [0, 1] (default 0.75)
 *   <li>{@code candidate-limit} - minimum number of hits fetched per query (default 50)
 *   <li>{@code min-score} - hits scoring below this are dropped (default 0.01)
 *   <li>{@code max-body-chars} - body characters indexed per document (default 2000)
 *   <li>{@code rebuild-interval} - period of the background full rebuild (default 10 minutes)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "secondbrain.sparse")
public class SparseProperties {

  private double k1 = 1.2;
  private double b = 0.75;
  private int candidateLimit = 50;
  private double minScore = 0.01;
  private int maxBodyChars = 2000;
  private Duration rebuildInterval = Duration.ofMinutes(10);

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  public void validate() {
    if (!(Double.isFinite(k1) && k1 >= 0.0)) {
      throw new IllegalStateException(
          "secondbrain.sparse.k1 must be finite and >= 0, got: " + k1);
    }
    if (!(b >= 0.0 && b <= 1.0)) {
      throw new IllegalStateException("secondbrain.sparse.b must be in [0.0, 1.0], got: " + b);
    }
    if (candidateLimit < 1) {
      throw new IllegalStateException(
          "secondbrain.sparse.candidate-limit must be >= 1, got: " + candidateLimit);
    }
    if (!(minScore >= 0.0)) {
      throw new IllegalStateException(
          "secondbrain.sparse.min-score must be >= 0, got: " + minScore);
    }
    if (maxBodyChars < 1) {
      throw new IllegalStateException(
          "secondbrain.sparse.max-body-chars must be >= 1, got: " + maxBodyChars);
    }
  }

  public double getK1() {
    return k1;
  }

  public void setK1(double k1) {
    this.k1 = k1;
  }

  public double getB() {
    return b;
  }

  public void setB(double b) {
    this.b = b;
  }

  public int getCandidateLimit() {
    return candidateLimit;
  }

  public void setCandidateLimit(int candidateLimit) {
    this.candidateLimit = candidateLimit;
  }

  public double getMinScore() {
    return minScore;
  }

  public void setMinScore(double minScore) {
    this.minScore = minScore;
  }

  public int getMaxBodyChars() {
    return maxBodyChars;
  }

  public void setMaxBodyChars(int maxBodyChars) {
    this.maxBodyChars = maxBodyChars;
  }

  public Duration getRebuildInterval() {
    return rebuildInterval;
  }

  public void setRebuildInterval(Duration rebuildInterval) {
    this.rebuildInterval = rebuildInterval;
  }
}
