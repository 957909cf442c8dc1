package dev.secondbrain.vector;

import dev.secondbrain.retrieval.RankedEntry;
import java.time.Clock;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory table of document embeddings keyed by (model, document), ranked by cosine similarity.
 *
 * <p>Holds at most one record per (document, model) pair; {@link #upsert} replaces. Records whose
 * dimension differs from the query vector are skipped rather than failing the query.
 */
@Component
public class VectorIndex {

  private static final Logger log = LoggerFactory.getLogger(VectorIndex.class);

  private final ConcurrentMap<String, ConcurrentMap<Long, EmbeddingRecord>> byModel =
      new ConcurrentHashMap<>();
  private final Clock clock;

  public VectorIndex(Clock clock) {
    this.clock = clock;
  }

  /** Stores {@code vector} for the document, replacing any previous one for the same model. */
  public EmbeddingRecord upsert(long documentId, String modelId, float[] vector) {
    EmbeddingRecord record = new EmbeddingRecord(documentId, modelId, vector, clock.instant());
    byModel.computeIfAbsent(modelId, m -> new ConcurrentHashMap<>()).put(documentId, record);
    return record;
  }

  public Optional<EmbeddingRecord> get(long documentId, String modelId) {
    ConcurrentMap<Long, EmbeddingRecord> records = byModel.get(modelId);
    return records == null ? Optional.empty() : Optional.ofNullable(records.get(documentId));
  }

  /** All records of a model ordered by document id. */
  public List<EmbeddingRecord> getAll(String modelId) {
    ConcurrentMap<Long, EmbeddingRecord> records = byModel.get(modelId);
    if (records == null) {
      return List.of();
    }
    return records.values().stream()
        .sorted(Comparator.comparingLong(EmbeddingRecord::documentId))
        .toList();
  }

  /** Deletes the document's embeddings for every model. */
  public void delete(long documentId) {
    byModel.values().forEach(records -> records.remove(documentId));
  }

  /** Drops every embedding of {@code modelId}. Returns the number of records removed. */
  public int retireModel(String modelId) {
    ConcurrentMap<Long, EmbeddingRecord> removed = byModel.remove(modelId);
    int count = removed == null ? 0 : removed.size();
    log.info("Retired embedding model {}: {} records removed", modelId, count);
    return count;
  }

  public int count(String modelId) {
    ConcurrentMap<Long, EmbeddingRecord> records = byModel.get(modelId);
    return records == null ? 0 : records.size();
  }

  /**
   * Ranks {@code candidates} by cosine similarity to {@code query}.
   *
   * @return all comparable candidates, similarity descending, ties by ascending document id
   */
  public List<RankedEntry> score(float[] query, Collection<EmbeddingRecord> candidates) {
    Map<Long, Double> scores = new HashMap<>();
    int skipped = 0;
    for (EmbeddingRecord candidate : candidates) {
      if (candidate.dimension() != query.length) {
        skipped++;
        continue;
      }
      scores.put(candidate.documentId(), candidate.similarity(query));
    }
    if (skipped > 0) {
      log.debug("Skipped {} embeddings with dimension != {}", skipped, query.length);
    }
    return RankedEntry.rank(scores, scores.size());
  }

  /**
   * Top {@code limit} documents of {@code modelId} whose similarity to {@code query} is at least
   * {@code minSimilarity}.
   */
  public List<RankedEntry> search(float[] query, String modelId, int limit, double minSimilarity) {
    List<RankedEntry> hits =
        score(query, getAll(modelId)).stream().filter(e -> e.score() >= minSimilarity).toList();
    return hits.size() > limit ? List.copyOf(hits.subList(0, Math.max(limit, 0))) : hits;
  }

  /** dot(a, b) / (|a| * |b|); 0 when either vector has zero norm or the dimensions differ. */
  public static double cosine(float[] a, float[] b) {
    if (a.length != b.length) {
      return 0.0;
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
