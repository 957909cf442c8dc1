package dev.secondbrain.vector;

import dev.secondbrain.document.Document;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Builds the canonical text embedded for a document. Reproducible from the source fields alone. */
public final class EmbeddingText {

  static final int MAX_CONTENT_CHARS = 1000;
  static final int MAX_FILE_CONTENT_CHARS = 800;
  private static final String SEPARATOR = " | ";

  private EmbeddingText() {}

  /**
   * Returns {@code Title: .. | Summary: .. | Content: .. | File Content: .. | Tags: ..}, skipping
   * empty parts. Empty when the document carries no text at all.
   */
  public static String canonicalText(Document document) {
    List<String> parts = new ArrayList<>();
    addPart(parts, "Title: ", document.title());
    addPart(parts, "Summary: ", document.summary());
    addPart(parts, "Content: ", bounded(document.body(), MAX_CONTENT_CHARS));
    addPart(parts, "File Content: ", bounded(document.extractedText(), MAX_FILE_CONTENT_CHARS));
    if (!document.tags().isEmpty()) {
      addPart(parts, "Tags: ", String.join(", ", document.tags()));
    }
    return String.join(SEPARATOR, parts);
  }

  private static void addPart(List<String> parts, String label, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      parts.add(label + value.strip());
    }
  }

  static String bounded(@Nullable String text, int maxChars) {
    if (text == null) {
      return "";
    }
    String collapsed = text.replaceAll("\\s+", " ").strip();
    return collapsed.length() > maxChars ? collapsed.substring(0, maxChars) : collapsed;
  }
}
