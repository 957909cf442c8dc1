package dev.secondbrain.rerank;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A fused candidate handed to the cross-encoder.
 *
 * @param documentId the candidate document
 * @param title document title
 * @param summary optional summary
 * @param excerpt snippet or body excerpt
 * @param tags document tags
 */
public record RerankCandidate(
    long documentId, String title, @Nullable String summary, String excerpt, List<String> tags) {

  static final int MAX_EXCERPT_CHARS = 500;

  public RerankCandidate {
    title = Objects.requireNonNullElse(title, "");
    excerpt = Objects.requireNonNullElse(excerpt, "");
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /** The bounded text scored against the query: {@code Title: .. | Summary: .. | .. | Tags: ..}. */
  public String representation() {
    List<String> parts = new ArrayList<>();
    if (!title.isBlank()) {
      parts.add("Title: " + title.strip());
    }
    if (summary != null && !summary.isBlank()) {
      parts.add("Summary: " + summary.strip());
    }
    String text = excerpt.replaceAll("\\s+", " ").strip();
    if (!text.isEmpty()) {
      parts.add(
          text.length() > MAX_EXCERPT_CHARS
              ? text.substring(0, MAX_EXCERPT_CHARS) + "..."
              : text);
    }
    if (!tags.isEmpty()) {
      parts.add("Tags: " + String.join(", ", tags));
    }
    return String.join(" | ", parts);
  }
}
