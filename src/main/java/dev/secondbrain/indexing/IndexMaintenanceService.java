package dev.secondbrain.indexing;

import dev.secondbrain.document.DocumentStore;
import dev.secondbrain.document.DocumentWriteListener;
import dev.secondbrain.sparse.CorpusStatistics;
import dev.secondbrain.sparse.SparseIndex;
import dev.secondbrain.vector.EmbeddingIndexer;
import jakarta.annotation.PostConstruct;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Keeps the BM25 and vector indexes in step with the document store.
 *
 * <p>Every write enqueues re-embedding of the document and requests a full BM25 rebuild. Rebuild
 * requests are coalesced: while one is queued, further requests are absorbed; a request arriving
 * during a running rebuild schedules exactly one more. The indexes are also rebuilt at startup and
 * every {@code secondbrain.sparse.rebuild-interval}.
 */
@Service
public class IndexMaintenanceService implements DocumentWriteListener, ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(IndexMaintenanceService.class);

  private final DocumentStore documentStore;
  private final SparseIndex sparseIndex;
  private final EmbeddingIndexer embeddingIndexer;
  private final Executor executor;
  private final AtomicBoolean rebuildQueued = new AtomicBoolean();

  public IndexMaintenanceService(
      DocumentStore documentStore,
      SparseIndex sparseIndex,
      EmbeddingIndexer embeddingIndexer,
      @Qualifier("indexingExecutor") Executor executor) {
    this.documentStore = documentStore;
    this.sparseIndex = sparseIndex;
    this.embeddingIndexer = embeddingIndexer;
    this.executor = executor;
  }

  @PostConstruct
  void register() {
    documentStore.addWriteListener(this);
  }

  @Override
  public void run(ApplicationArguments args) {
    rebuildNow();
  }

  @Override
  public void documentWritten(long documentId) {
    embeddingIndexer.enqueue(documentId);
    requestRebuild();
  }

  @Override
  public void documentDeleted(long documentId) {
    embeddingIndexer.remove(documentId);
    requestRebuild();
  }

  /**
   * Rebuilds the BM25 index from the whole store on the calling thread and enqueues embeddings for
   * documents that lack one.
   */
  public synchronized CorpusStatistics rebuildNow() {
    CorpusStatistics statistics = sparseIndex.rebuild(documentStore.listAll());
    embeddingIndexer.rebuild(false);
    return statistics;
  }

  /** Schedules an asynchronous BM25 rebuild unless one is already queued. */
  public void requestRebuild() {
    if (!rebuildQueued.compareAndSet(false, true)) {
      log.debug("BM25 rebuild already queued");
      return;
    }
    try {
      executor.execute(this::runQueuedRebuild);
    } catch (RejectedExecutionException e) {
      rebuildQueued.set(false);
      log.warn("BM25 rebuild request rejected; index refreshes on the next periodic rebuild", e);
    }
  }

  @Scheduled(
      fixedDelayString = "${secondbrain.sparse.rebuild-interval:PT10M}",
      initialDelayString = "${secondbrain.sparse.rebuild-interval:PT10M}")
  void periodicRebuild() {
    log.debug("Periodic index rebuild");
    rebuildNow();
  }

  private void runQueuedRebuild() {
    rebuildQueued.set(false);
    try {
      synchronized (this) {
        sparseIndex.rebuild(documentStore.listAll());
      }
    } catch (RuntimeException e) {
      log.error("BM25 rebuild failed; previous snapshot stays active", e);
    }
  }
}
