package dev.secondbrain.sparse;

import dev.secondbrain.document.Document;
import dev.secondbrain.retrieval.IndexUnavailableException;
import dev.secondbrain.retrieval.RankedEntry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * In-memory BM25 keyword index.
 *
 * <p>The index is rebuilt from the full corpus and published as an immutable snapshot through an
 * {@link AtomicReference}: a query always scores against one complete snapshot, old or new. There
 * are no incremental updates, so documents written after the last rebuild are invisible until the
 * next one.
 */
@Service
public class SparseIndex {

  private static final Logger log = LoggerFactory.getLogger(SparseIndex.class);

  private final SparseProperties properties;
  private final AtomicReference<@Nullable Snapshot> snapshot = new AtomicReference<>();

  public SparseIndex(SparseProperties properties) {
    this.properties = properties;
  }

  /**
   * Tokenizes {@code documents} and atomically replaces the current snapshot.
   *
   * @param documents the full corpus
   * @return statistics of the new snapshot
   */
  public CorpusStatistics rebuild(Collection<Document> documents) {
    long start = System.nanoTime();
    NavigableMap<Long, TokenizedDocument> tokenized = new TreeMap<>();
    for (Document document : documents) {
      tokenized.put(document.id(), TokenizedDocument.of(document, properties.getMaxBodyChars()));
    }
    Map<String, List<Long>> postings = new HashMap<>();
    for (TokenizedDocument document : tokenized.values()) {
      for (String term : document.termFrequencies().keySet()) {
        postings.computeIfAbsent(term, t -> new ArrayList<>()).add(document.documentId());
      }
    }
    CorpusStatistics statistics = CorpusStatistics.of(tokenized.values());
    snapshot.set(new Snapshot(tokenized, postings, statistics));
    log.info(
        "Rebuilt BM25 index: {} documents, {} terms, avgdl={} in {}ms",
        statistics.documentCount(),
        statistics.vocabularySize(),
        String.format("%.1f", statistics.averageDocumentLength()),
        (System.nanoTime() - start) / 1_000_000);
    return statistics;
  }

  public boolean isBuilt() {
    return snapshot.get() != null;
  }

  /** Statistics of the current snapshot. */
  public CorpusStatistics statistics() {
    return current().statistics();
  }

  /**
   * Scores {@code query} with the configured parameters.
   *
   * @param query the parsed query
   * @param limit maximum number of hits
   * @return hits ordered by BM25 score descending, ties by ascending document id
   * @throws IndexUnavailableException if the index has never been built
   */
  public List<RankedEntry> search(SparseQuery query, int limit) {
    return score(query, properties.getK1(), properties.getB(), limit, properties.getMinScore());
  }

  /**
   * Scores {@code query} with explicit BM25 parameters.
   *
   * @throws IndexUnavailableException if the index has never been built
   */
  public List<RankedEntry> score(
      SparseQuery query, double k1, double b, int limit, double minScore) {
    Snapshot current = current();
    CorpusStatistics statistics = current.statistics();
    if (statistics.documentCount() == 0 || limit <= 0) {
      return List.of();
    }

    Set<Long> candidates = new LinkedHashSet<>();
    for (String token : query.tokens()) {
      candidates.addAll(current.postings().getOrDefault(token, List.of()));
    }

    double avgdl = statistics.averageDocumentLength();
    Map<Long, Double> scores = new HashMap<>();
    for (Long documentId : candidates) {
      TokenizedDocument document = current.documents().get(documentId);
      if (query.phrase() && !document.containsPhrase(query.tokens())) {
        continue;
      }
      double norm = k1 * (1.0 - b + b * document.length() / avgdl);
      double score = 0.0;
      for (String token : query.tokens()) {
        int tf = document.termFrequency(token);
        if (tf > 0) {
          score += statistics.idf(token) * tf * (k1 + 1.0) / (tf + norm);
        }
      }
      if (score >= minScore) {
        scores.put(documentId, score);
      }
    }
    log.debug(
        "BM25 query {} matched {} of {} candidates",
        query.tokens(),
        scores.size(),
        candidates.size());
    return RankedEntry.rank(scores, limit);
  }

  /**
   * Query tokens present in the given document, in query order without repeats. Empty when the
   * document is not indexed.
   */
  public List<String> matchedTerms(SparseQuery query, long documentId) {
    Snapshot current = snapshot.get();
    if (current == null) {
      return List.of();
    }
    TokenizedDocument document = current.documents().get(documentId);
    if (document == null) {
      return List.of();
    }
    return query.tokens().stream().distinct().filter(t -> document.termFrequency(t) > 0).toList();
  }

  private Snapshot current() {
    Snapshot current = snapshot.get();
    if (current == null) {
      throw new IndexUnavailableException("BM25 index has not been built yet");
    }
    return current;
  }

  private record Snapshot(
      NavigableMap<Long, TokenizedDocument> documents,
      Map<String, List<Long>> postings,
      CorpusStatistics statistics) {}
}
