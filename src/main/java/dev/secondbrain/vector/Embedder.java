package dev.secondbrain.vector;

import dev.secondbrain.retrieval.EmbeddingUnavailableException;

/** Maps text to a fixed-dimension vector. Deterministic for a given model and text. */
public interface Embedder {

  /**
   * Embeds {@code text}.
   *
   * @throws EmbeddingUnavailableException if the backend is unreachable, fails or times out
   */
  float[] embed(String text);

  /** Identifier of the model producing the vectors; embeddings are stored per model. */
  String modelId();

  /** False when no real backend is configured and every {@link #embed} call fails. */
  default boolean isAvailable() {
    return true;
  }
}
