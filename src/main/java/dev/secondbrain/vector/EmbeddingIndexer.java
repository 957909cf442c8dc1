package dev.secondbrain.vector;

import dev.secondbrain.document.Document;
import dev.secondbrain.document.DocumentStore;
import dev.secondbrain.retrieval.EmbeddingUnavailableException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Keeps the {@link VectorIndex} in sync with the document store for the active {@link Embedder}.
 *
 * <p>Jobs run asynchronously on the indexing executor. A failing embedding is retried up to {@code
 * secondbrain.embedding.max-attempts} times with a fixed delay, then the job is recorded as {@link
 * EmbeddingJob.Status#FAILED} with the last error. Semantic search lags keyword search until a
 * document's job completes.
 *
 * <p>A vector is only stored while its job is still the document's tracked job and the document's
 * text is unchanged. A job overtaken by a newer job, by {@link #remove(long)} or by an edit
 * discards its vector.
 */
@Service
public class EmbeddingIndexer {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingIndexer.class);

  private final DocumentStore documentStore;
  private final Embedder embedder;
  private final VectorIndex vectorIndex;
  private final Executor executor;
  private final Clock clock;
  private final RetryTemplate retryTemplate;
  private final ConcurrentMap<Long, EmbeddingJob> jobs = new ConcurrentHashMap<>();

  public EmbeddingIndexer(
      DocumentStore documentStore,
      Embedder embedder,
      VectorIndex vectorIndex,
      EmbeddingProperties properties,
      @Qualifier("indexingExecutor") Executor executor,
      Clock clock) {
    this.documentStore = documentStore;
    this.embedder = embedder;
    this.vectorIndex = vectorIndex;
    this.executor = executor;
    this.clock = clock;
    this.retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(properties.getMaxAttempts())
            .fixedBackoff(Math.max(1L, properties.getRetryDelay().toMillis()))
            .retryOn(EmbeddingUnavailableException.class)
            .build();
  }

  /**
   * Schedules (re-)embedding of a document. A job already waiting for the document is reused.
   *
   * @return the live job, or empty when no embedding backend is available
   */
  public Optional<EmbeddingJob> enqueue(long documentId) {
    if (!embedder.isAvailable()) {
      log.debug("Embedding backend unavailable, not enqueuing document {}", documentId);
      return Optional.empty();
    }
    AtomicReference<EmbeddingJob> created = new AtomicReference<>();
    EmbeddingJob live =
        jobs.compute(
            documentId,
            (id, current) -> {
              if (current != null && current.status() == EmbeddingJob.Status.PENDING) {
                return current;
              }
              EmbeddingJob job = EmbeddingJob.pending(id, embedder.modelId(), clock.instant());
              created.set(job);
              return job;
            });
    EmbeddingJob fresh = created.get();
    if (fresh == null) {
      return Optional.of(live);
    }
    try {
      executor.execute(() -> process(documentId));
    } catch (RejectedExecutionException e) {
      log.warn("Embedding job for document {} rejected by executor", documentId, e);
      EmbeddingJob failed = fresh.failed(0, "Rejected by executor", clock.instant());
      jobs.replace(documentId, fresh, failed);
      return Optional.of(failed);
    }
    return Optional.of(fresh);
  }

  /**
   * Runs the pending job of a document on the calling thread.
   *
   * @return the job's resulting state, or empty when no job was pending
   */
  public Optional<EmbeddingJob> process(long documentId) {
    EmbeddingJob pending = jobs.get(documentId);
    if (pending == null || pending.status() != EmbeddingJob.Status.PENDING) {
      return Optional.empty();
    }
    EmbeddingJob processing = pending.processing(clock.instant());
    if (!jobs.replace(documentId, pending, processing)) {
      return Optional.empty();
    }
    EmbeddingJob outcome;
    try {
      outcome = run(processing);
    } catch (RuntimeException e) {
      log.error("Embedding job for document {} aborted", documentId, e);
      outcome = processing.failed(processing.attempts(), e.toString(), clock.instant());
    }
    // A newer job may have replaced this one while it ran; leave it alone.
    jobs.replace(documentId, processing, outcome);
    return Optional.of(outcome);
  }

  private EmbeddingJob run(EmbeddingJob job) {
    Optional<Document> document = documentStore.get(job.documentId());
    if (document.isEmpty()) {
      log.warn("Embedding job failed: document {} not found", job.documentId());
      return job.failed(0, "Document not found", clock.instant());
    }
    String text = EmbeddingText.canonicalText(document.get());
    if (text.isBlank()) {
      return job.failed(0, "No text content to embed", clock.instant());
    }

    AtomicInteger attempts = new AtomicInteger();
    try {
      float[] vector =
          retryTemplate.execute(
              context -> {
                attempts.incrementAndGet();
                return embedder.embed(text);
              });
      if (!store(job, text, vector)) {
        log.debug("Discarding stale embedding of document {}", job.documentId());
        return job.failed(attempts.get(), "Superseded while embedding", clock.instant());
      }
      log.debug(
          "Embedded document {} with {} after {} attempt(s)",
          job.documentId(),
          job.modelId(),
          attempts.get());
      return job.completed(attempts.get(), clock.instant());
    } catch (EmbeddingUnavailableException e) {
      log.warn(
          "Embedding document {} failed after {} attempt(s): {}",
          job.documentId(),
          attempts.get(),
          e.getMessage());
      return job.failed(attempts.get(), e.getMessage(), clock.instant());
    }
  }

  /** Upserts the vector only while {@code job} is tracked and the document text is unchanged. */
  private boolean store(EmbeddingJob job, String text, float[] vector) {
    AtomicBoolean stored = new AtomicBoolean();
    jobs.computeIfPresent(
        job.documentId(),
        (id, current) -> {
          boolean unchanged =
              documentStore
                  .get(id)
                  .map(d -> EmbeddingText.canonicalText(d).equals(text))
                  .orElse(false);
          if (current == job && unchanged) {
            vectorIndex.upsert(id, job.modelId(), vector);
            stored.set(true);
          }
          return current;
        });
    return stored.get();
  }

  /** Deletes the document's embeddings and forgets its job. */
  public void remove(long documentId) {
    jobs.remove(documentId);
    vectorIndex.delete(documentId);
  }

  /**
   * Enqueues every document lacking an embedding for the active model.
   *
   * @param force retire the active model's embeddings first so every document is re-embedded
   * @return number of documents enqueued
   */
  public int rebuild(boolean force) {
    if (!embedder.isAvailable()) {
      log.info("Embedding backend unavailable, skipping embedding rebuild");
      return 0;
    }
    String modelId = embedder.modelId();
    if (force) {
      vectorIndex.retireModel(modelId);
    }
    int enqueued = 0;
    for (Document document : documentStore.listAll()) {
      if (vectorIndex.get(document.id(), modelId).isEmpty()
          && enqueue(document.id()).isPresent()) {
        enqueued++;
      }
    }
    log.info("Embedding rebuild (force={}) enqueued {} documents for {}", force, enqueued, modelId);
    return enqueued;
  }

  public Optional<EmbeddingJob> job(long documentId) {
    return Optional.ofNullable(jobs.get(documentId));
  }

  public EmbeddingStats stats() {
    String modelId = embedder.modelId();
    List<Document> documents = documentStore.listAll();
    int withEmbeddings =
        (int) documents.stream().filter(d -> vectorIndex.get(d.id(), modelId).isPresent()).count();
    int pending = (int) jobs.values().stream().filter(EmbeddingJob::isLive).count();
    int failed =
        (int)
            jobs.values().stream().filter(j -> j.status() == EmbeddingJob.Status.FAILED).count();
    return new EmbeddingStats(modelId, documents.size(), withEmbeddings, pending, failed);
  }
}
