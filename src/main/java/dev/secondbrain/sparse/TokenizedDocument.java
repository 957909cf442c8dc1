package dev.secondbrain.sparse;

import dev.secondbrain.document.Document;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A document's normalized token stream and term frequencies. Derived on every rebuild, never
 * stored on its own.
 *
 * <p>The stream is built from: title, title, summary, body, tags, tags. Repeating title and tags
 * is the only field weighting the index applies. Each field copy is a separate segment, and
 * phrases only match inside one segment.
 *
 * @param documentId the source document id
 * @param tokens the token stream in indexing order
 * @param segmentEnds exclusive end offset in {@code tokens} of each field segment, ascending
 * @param termFrequencies occurrences of each distinct token in {@code tokens}
 */
public record TokenizedDocument(
    long documentId,
    List<String> tokens,
    List<Integer> segmentEnds,
    Map<String, Integer> termFrequencies) {

  private static final String TRUNCATION_MARKER = "...";

  public TokenizedDocument {
    tokens = List.copyOf(tokens);
    segmentEnds = List.copyOf(segmentEnds);
    termFrequencies = Map.copyOf(termFrequencies);
  }

  /**
   * Tokenizes a document for the sparse index.
   *
   * @param document the source document
   * @param maxBodyChars body characters kept after whitespace collapsing
   */
  public static TokenizedDocument of(Document document, int maxBodyChars) {
    List<String> titleTokens = Tokenizer.tokenize(document.title());
    List<String> tagTokens = Tokenizer.tokenize(String.join(" ", document.tags()));

    List<List<String>> segments =
        List.of(
            titleTokens,
            titleTokens,
            Tokenizer.tokenize(document.summary()),
            Tokenizer.tokenize(boundedBody(document.body(), maxBodyChars)),
            tagTokens,
            tagTokens);

    List<String> tokens = new ArrayList<>();
    List<Integer> segmentEnds = new ArrayList<>();
    for (List<String> segment : segments) {
      tokens.addAll(segment);
      segmentEnds.add(tokens.size());
    }

    Map<String, Integer> frequencies = new HashMap<>();
    for (String token : tokens) {
      frequencies.merge(token, 1, Integer::sum);
    }
    return new TokenizedDocument(document.id(), tokens, segmentEnds, frequencies);
  }

  /** Token stream length |d|. */
  public int length() {
    return tokens.size();
  }

  public int termFrequency(String term) {
    return termFrequencies.getOrDefault(term, 0);
  }

  /** True if {@code phrase} occurs as a contiguous run within a single field segment. */
  public boolean containsPhrase(List<String> phrase) {
    if (phrase.isEmpty()) {
      return true;
    }
    int start = 0;
    for (int end : segmentEnds) {
      if (end - start >= phrase.size()
          && Collections.indexOfSubList(tokens.subList(start, end), phrase) >= 0) {
        return true;
      }
      start = end;
    }
    return false;
  }

  static String boundedBody(String body, int maxBodyChars) {
    String collapsed = body.replaceAll("\\s+", " ").strip();
    if (collapsed.length() > maxBodyChars) {
      return collapsed.substring(0, maxBodyChars) + TRUNCATION_MARKER;
    }
    return collapsed;
  }
}
