package dev.secondbrain.document;

import java.util.List;
import java.util.Optional;

/**
 * Read-side contract of the external document store consumed by the retrieval core.
 *
 * <p>The store owns every {@link Document}. It notifies registered {@link DocumentWriteListener}s
 * after each committed write so that indexes can catch up.
 */
public interface DocumentStore {

  Optional<Document> get(long id);

  /** All documents, ordered by ascending id. Used for full index rebuilds. */
  List<Document> listAll();

  void addWriteListener(DocumentWriteListener listener);
}
