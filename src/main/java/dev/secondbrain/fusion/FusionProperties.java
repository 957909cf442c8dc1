package dev.secondbrain.fusion;

import dev.secondbrain.retrieval.Signal;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for Reciprocal Rank Fusion, bound from {@code secondbrain.fusion.*}.
 *
 * <ul>
 *   <li>{@code k} - RRF rank constant (default 60)
 *   <li>{@code semantic-weight}, {@code bm25-weight}, {@code rerank-weight} - per-signal weights
 *       (defaults 0.4, 0.3, 0.3)
 *   <li>{@code rerank-blend} - share of the combined score taken by the reranker when it ran, in
 *       [0, 1] (default 0.5)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "secondbrain.fusion")
public class FusionProperties {

  private int k = 60;
  private double semanticWeight = 0.4;
  private double bm25Weight = 0.3;
  private double rerankWeight = 0.3;
  private double rerankBlend = 0.5;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  public void validate() {
    if (k <= 0) {
      throw new IllegalStateException("secondbrain.fusion.k must be > 0, got: " + k);
    }
    if (!isWeight(semanticWeight) || !isWeight(bm25Weight) || !isWeight(rerankWeight)) {
      throw new IllegalStateException(
          "secondbrain.fusion weights must be finite and >= 0, got: semantic="
              + semanticWeight
              + ", bm25="
              + bm25Weight
              + ", rerank="
              + rerankWeight);
    }
    if (!(rerankBlend >= 0.0 && rerankBlend <= 1.0)) {
      throw new IllegalStateException(
          "secondbrain.fusion.rerank-blend must be in [0.0, 1.0], got: " + rerankBlend);
    }
  }

  private static boolean isWeight(double value) {
    return Double.isFinite(value) && value >= 0.0;
  }

  public double weight(Signal signal) {
    return switch (signal) {
      case BM25 -> bm25Weight;
      case SEMANTIC -> semanticWeight;
      case RERANK -> rerankWeight;
    };
  }

  public int getK() {
    return k;
  }

  public void setK(int k) {
    this.k = k;
  }

  public double getSemanticWeight() {
    return semanticWeight;
  }

  public void setSemanticWeight(double semanticWeight) {
    this.semanticWeight = semanticWeight;
  }

  public double getBm25Weight() {
    return bm25Weight;
  }

  public void setBm25Weight(double bm25Weight) {
    this.bm25Weight = bm25Weight;
  }

  public double getRerankWeight() {
    return rerankWeight;
  }

  public void setRerankWeight(double rerankWeight) {
    this.rerankWeight = rerankWeight;
  }

  public double getRerankBlend() {
    return rerankBlend;
  }

  public void setRerankBlend(double rerankBlend) {
    this.rerankBlend = rerankBlend;
  }
}
