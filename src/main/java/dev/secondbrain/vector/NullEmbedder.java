package dev.secondbrain.vector;

import dev.secondbrain.retrieval.EmbeddingUnavailableException;

/** Stand-in used when no embedding backend is configured or the configured one failed to load. */
public final class NullEmbedder implements Embedder {

  public static final String MODEL_ID = "none";

  @Override
  public float[] embed(String text) {
    throw new EmbeddingUnavailableException("No embedding backend configured");
  }

  @Override
  public String modelId() {
    return MODEL_ID;
  }

  @Override
  public boolean isAvailable() {
    return false;
  }
}
