package dev.secondbrain.fixture;

import dev.secondbrain.document.Document;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Test builder for {@link Document} with sensible defaults, so tests only set what they care about.
 *
 * <pre>{@code
 * Document doc = new DocumentBuilder().id(3).body("alpha beta").build();
 * }</pre>
 */
public final class DocumentBuilder {

  private long id = 1L;
  private String title = "";
  private String body = "";
  private @Nullable String summary;
  private List<String> tags = List.of();
  private Instant timestamp = Instant.parse("2026-01-15T10:00:00Z");
  private @Nullable String extractedText;

  public DocumentBuilder id(long id) {
    this.id = id;
    return this;
  }

  public DocumentBuilder title(String title) {
    this.title = title;
    return this;
  }

  public DocumentBuilder body(String body) {
    this.body = body;
    return this;
  }

  public DocumentBuilder summary(String summary) {
    this.summary = summary;
    return this;
  }

  public DocumentBuilder tags(String... tags) {
    this.tags = List.of(tags);
    return this;
  }

  public DocumentBuilder timestamp(Instant timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  public DocumentBuilder extractedText(String extractedText) {
    this.extractedText = extractedText;
    return this;
  }

  public Document build() {
    return new Document(id, title, body, summary, tags, timestamp, extractedText);
  }

  /** Shorthand for a document with only a body. */
  public static Document doc(long id, String body) {
    return new DocumentBuilder().id(id).body(body).build();
  }
}
