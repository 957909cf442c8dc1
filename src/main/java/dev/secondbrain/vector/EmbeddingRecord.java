package dev.secondbrain.vector;

import java.time.Instant;
import java.util.Objects;

/**
 * The stored embedding of one document for one model.
 *
 * @param documentId the embedded document
 * @param modelId the producing model
 * @param vector the embedding; never mutated after construction
 * @param updatedAt when the record was last upserted
 */
public record EmbeddingRecord(long documentId, String modelId, float[] vector, Instant updatedAt) {

  public EmbeddingRecord {
    Objects.requireNonNull(modelId, "modelId must not be null");
    Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    if (vector == null || vector.length == 0) {
      throw new IllegalArgumentException("vector must not be empty");
    }
    vector = vector.clone();
  }

  public int dimension() {
    return vector.length;
  }

  /** Cosine similarity between {@code query} and this record's vector. */
  public double similarity(float[] query) {
    return VectorIndex.cosine(query, vector);
  }

  @Override
  public float[] vector() {
    return vector.clone();
  }
}
