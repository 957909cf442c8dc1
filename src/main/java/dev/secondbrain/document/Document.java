package dev.secondbrain.document;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A captured note as owned by the external document store. The retrieval pipeline only reads it.
 *
 * @param id opaque document identifier
 * @param title the note title (empty when absent)
 * @param body the main note text (empty when absent)
 * @param summary optional generated summary
 * @param tags ordered tags
 * @param timestamp capture or last-update time
 * @param extractedText optional auxiliary text extracted from an attachment (OCR, PDF text, audio
 *     transcript)
 */
public record Document(
    long id,
    String title,
    String body,
    @Nullable String summary,
    List<String> tags,
    Instant timestamp,
    @Nullable String extractedText) {

  public Document {
    title = Objects.requireNonNullElse(title, "");
    body = Objects.requireNonNullElse(body, "");
    tags = tags == null ? List.of() : List.copyOf(tags);
    timestamp = Objects.requireNonNullElse(timestamp, Instant.EPOCH);
  }

  /** Convenience constructor for a note with only a title and body. */
  public Document(long id, String title, String body) {
    this(id, title, body, null, List.of(), Instant.EPOCH, null);
  }
}
