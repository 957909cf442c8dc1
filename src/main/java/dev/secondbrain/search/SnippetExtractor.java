package dev.secondbrain.search;

import dev.secondbrain.document.Document;
import java.util.List;
import java.util.Locale;

/**
 * Picks a short excerpt of a document for display.
 *
 * <p>The source text is the body, else the summary, else the title. With matched terms, the window
 * containing the most of them wins (earliest on ties); otherwise the leading window is used. Cut
 * sides are marked with {@code ...}.
 */
final class SnippetExtractor {

  static final int WINDOW = 200;
  private static final int STEP = 20;
  private static final String ELLIPSIS = "...";

  private SnippetExtractor() {}

  static String extract(Document document, List<String> matchedTerms) {
    String text = sourceText(document);
    if (text.length() <= WINDOW) {
      return text;
    }
    int start = matchedTerms.isEmpty() ? 0 : bestWindowStart(text, matchedTerms);
    int end = Math.min(text.length(), start + WINDOW);
    StringBuilder snippet = new StringBuilder();
    if (start > 0) {
      snippet.append(ELLIPSIS);
    }
    snippet.append(text, start, end);
    if (end < text.length()) {
      snippet.append(ELLIPSIS);
    }
    return snippet.toString();
  }

  private static int bestWindowStart(String text, List<String> terms) {
    String lower = text.toLowerCase(Locale.ROOT);
    int bestStart = 0;
    int bestHits = -1;
    int lastStart = text.length() - WINDOW;
    for (int start = 0; ; start = Math.min(start + STEP, lastStart)) {
      String window = lower.substring(start, start + WINDOW);
      int hits = 0;
      for (String term : terms) {
        if (window.contains(term)) {
          hits++;
        }
      }
      if (hits > bestHits) {
        bestHits = hits;
        bestStart = start;
      }
      if (start == lastStart) {
        return bestStart;
      }
    }
  }

  private static String sourceText(Document document) {
    String text = document.body();
    if (text.isBlank() && document.summary() != null) {
      text = document.summary();
    }
    if (text.isBlank()) {
      text = document.title();
    }
    return text.replaceAll("\\s+", " ").strip();
  }
}
