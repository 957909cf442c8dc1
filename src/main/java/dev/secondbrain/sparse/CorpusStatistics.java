package dev.secondbrain.sparse;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Corpus-level BM25 statistics for one index snapshot.
 *
 * @param documentCount N, the number of indexed documents
 * @param totalLength sum of all token stream lengths
 * @param averageDocumentLength totalLength / N, or 0 for an empty corpus
 * @param documentFrequencies number of documents containing each term
 */
public record CorpusStatistics(
    int documentCount,
    long totalLength,
    double averageDocumentLength,
    Map<String, Integer> documentFrequencies) {

  public static final CorpusStatistics EMPTY = new CorpusStatistics(0, 0L, 0.0, Map.of());

  public CorpusStatistics {
    documentFrequencies = Map.copyOf(documentFrequencies);
  }

  static CorpusStatistics of(Collection<TokenizedDocument> documents) {
    if (documents.isEmpty()) {
      return EMPTY;
    }
    Map<String, Integer> frequencies = new HashMap<>();
    long totalLength = 0L;
    for (TokenizedDocument document : documents) {
      totalLength += document.length();
      for (String term : document.termFrequencies().keySet()) {
        frequencies.merge(term, 1, Integer::sum);
      }
    }
    return new CorpusStatistics(
        documents.size(), totalLength, (double) totalLength / documents.size(), frequencies);
  }

  public int documentFrequency(String term) {
    return documentFrequencies.getOrDefault(term, 0);
  }

  /** IDF(term) = ln(1 + (N - df + 0.5) / (df + 0.5)). Always positive. */
  public double idf(String term) {
    int df = documentFrequency(term);
    return Math.log(1.0 + (documentCount - df + 0.5) / (df + 0.5));
  }

  public int vocabularySize() {
    return documentFrequencies.size();
  }
}
