package dev.secondbrain.vector;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * State of one document's (re-)embedding. At most one job is tracked per document.
 *
 * @param documentId the document to embed
 * @param modelId the model the job embeds with
 * @param status lifecycle state
 * @param attempts embedding attempts made so far
 * @param lastError message of the last failure, if any
 * @param updatedAt time of the last state change
 */
public record EmbeddingJob(
    long documentId,
    String modelId,
    Status status,
    int attempts,
    @Nullable String lastError,
    Instant updatedAt) {

  /** Job lifecycle. */
  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }

  static EmbeddingJob pending(long documentId, String modelId, Instant now) {
    return new EmbeddingJob(documentId, modelId, Status.PENDING, 0, null, now);
  }

  EmbeddingJob processing(Instant now) {
    return new EmbeddingJob(documentId, modelId, Status.PROCESSING, attempts, lastError, now);
  }

  EmbeddingJob completed(int attempts, Instant now) {
    return new EmbeddingJob(documentId, modelId, Status.COMPLETED, attempts, null, now);
  }

  EmbeddingJob failed(int attempts, String error, Instant now) {
    return new EmbeddingJob(documentId, modelId, Status.FAILED, attempts, error, now);
  }

  /** Pending or processing. */
  public boolean isLive() {
    return status == Status.PENDING || status == Status.PROCESSING;
  }
}
