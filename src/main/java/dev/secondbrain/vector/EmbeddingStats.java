package dev.secondbrain.vector;

/**
 * Embedding coverage of the document store for the active model.
 *
 * @param modelId the active embedding model
 * @param totalDocuments documents in the store
 * @param documentsWithEmbeddings documents that have an embedding for {@code modelId}
 * @param pendingJobs jobs waiting or running
 * @param failedJobs jobs that exhausted their attempts
 */
public record EmbeddingStats(
    String modelId,
    int totalDocuments,
    int documentsWithEmbeddings,
    int pendingJobs,
    int failedJobs) {

  /** Percentage of documents with an embedding, 0 for an empty store. */
  public double coveragePercent() {
    if (totalDocuments == 0) {
      return 0.0;
    }
    return 100.0 * documentsWithEmbeddings / totalDocuments;
  }
}
