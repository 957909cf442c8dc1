package dev.secondbrain.document;

/** Post-write hook invoked by a {@link DocumentStore} after a document was created or changed. */
@FunctionalInterface
public interface DocumentWriteListener {

  void documentWritten(long documentId);

  default void documentDeleted(long documentId) {}
}
