package dev.secondbrain.document;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-memory {@link DocumentStore}, registered when the composing application provides
 * no store of its own. Also used as the store in tests.
 *
 * <p>Listeners run synchronously on the writing thread after the map update. A failing listener is
 * logged and does not undo the write or prevent other listeners from running.
 */
public class InMemoryDocumentStore implements DocumentStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

  private final ConcurrentSkipListMap<Long, Document> documents = new ConcurrentSkipListMap<>();
  private final List<DocumentWriteListener> listeners = new CopyOnWriteArrayList<>();

  @Override
  public Optional<Document> get(long id) {
    return Optional.ofNullable(documents.get(id));
  }

  @Override
  public List<Document> listAll() {
    return List.copyOf(documents.values());
  }

  @Override
  public void addWriteListener(DocumentWriteListener listener) {
    listeners.add(listener);
  }

  /** Creates or replaces a document and notifies listeners. */
  public void save(Document document) {
    documents.put(document.id(), document);
    for (DocumentWriteListener listener : listeners) {
      try {
        listener.documentWritten(document.id());
      } catch (RuntimeException e) {
        log.warn("Write listener failed for document {}", document.id(), e);
      }
    }
  }

  /**
   * Removes a document and notifies listeners.
   *
   * @return true if the document existed
   */
  public boolean delete(long id) {
    boolean removed = documents.remove(id) != null;
    if (removed) {
      for (DocumentWriteListener listener : listeners) {
        try {
          listener.documentDeleted(id);
        } catch (RuntimeException e) {
          log.warn("Delete listener failed for document {}", id, e);
        }
      }
    }
    return removed;
  }

  public int size() {
    return documents.size();
  }
}
