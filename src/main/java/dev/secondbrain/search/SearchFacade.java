package dev.secondbrain.search;

import dev.secondbrain.document.Document;
import dev.secondbrain.document.DocumentStore;
import dev.secondbrain.fusion.FusedResult;
import dev.secondbrain.fusion.FusionEngine;
import dev.secondbrain.fusion.FusionProperties;
import dev.secondbrain.rerank.RerankCandidate;
import dev.secondbrain.rerank.Reranker;
import dev.secondbrain.rerank.RerankerProperties;
import dev.secondbrain.rerank.Reranking;
import dev.secondbrain.retrieval.EmbeddingUnavailableException;
import dev.secondbrain.retrieval.IndexUnavailableException;
import dev.secondbrain.retrieval.InvalidQueryException;
import dev.secondbrain.retrieval.RankedEntry;
import dev.secondbrain.retrieval.Signal;
import dev.secondbrain.sparse.SparseIndex;
import dev.secondbrain.sparse.SparseProperties;
import dev.secondbrain.sparse.SparseQuery;
import dev.secondbrain.vector.Embedder;
import dev.secondbrain.vector.EmbeddingProperties;
import dev.secondbrain.vector.VectorIndex;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single entry point for note search.
 *
 * <p>Modes:
 *
 * <ul>
 *   <li>{@code keyword} - BM25 over the sanitized query
 *   <li>{@code semantic} - cosine similarity of the raw query embedding
 *   <li>{@code hybrid} - BM25 and semantic rankings fused with RRF
 *   <li>{@code fused} - hybrid, then the head is reranked by the cross-encoder and blended
 * </ul>
 *
 * <p>Component failures never escape: a missing embedding backend turns every mode into keyword
 * search, an embedding failure drops the semantic signal, an unbuilt BM25 index drops the keyword
 * signal, and a failing reranker leaves the RRF score as final score. Only invalid arguments raise
 * {@link IllegalArgumentException}; an interrupted model call raises {@link CancellationException}.
 */
@Service
public class SearchFacade {

  private static final Logger log = LoggerFactory.getLogger(SearchFacade.class);

  /** Per-retriever candidate depth is at least this multiple of the requested limit. */
  static final int CANDIDATE_MULTIPLIER = 5;

  private final DocumentStore documentStore;
  private final SparseIndex sparseIndex;
  private final SparseProperties sparseProperties;
  private final Embedder embedder;
  private final VectorIndex vectorIndex;
  private final EmbeddingProperties embeddingProperties;
  private final Reranker reranker;
  private final RerankerProperties rerankerProperties;
  private final FusionEngine fusionEngine;
  private final FusionProperties fusionProperties;

  public SearchFacade(
      DocumentStore documentStore,
      SparseIndex sparseIndex,
      SparseProperties sparseProperties,
      Embedder embedder,
      VectorIndex vectorIndex,
      EmbeddingProperties embeddingProperties,
      Reranker reranker,
      RerankerProperties rerankerProperties,
      FusionEngine fusionEngine,
      FusionProperties fusionProperties) {
    this.documentStore = documentStore;
    this.sparseIndex = sparseIndex;
    this.sparseProperties = sparseProperties;
    this.embedder = embedder;
    this.vectorIndex = vectorIndex;
    this.embeddingProperties = embeddingProperties;
    this.reranker = reranker;
    this.rerankerProperties = rerankerProperties;
    this.fusionEngine = fusionEngine;
    this.fusionProperties = fusionProperties;
  }

  /**
   * Searches notes.
   *
   * @param query the raw user query
   * @param mode the retrieval mode
   * @param limit maximum number of results (0 yields none)
   * @return hits, best first
   * @throws IllegalArgumentException for a null query or mode, or a negative limit
   */
  public List<ScoredDocument> search(String query, SearchMode mode, int limit) {
    return search(new SearchRequest(query, mode, limit)).documents();
  }

  /**
   * Searches notes with the mode given by name ({@code keyword}, {@code semantic}, {@code hybrid}
   * or {@code fused}).
   *
   * @throws IllegalArgumentException for an unknown mode name
   */
  public List<ScoredDocument> search(String query, String mode, int limit) {
    return search(query, SearchMode.fromString(mode), limit);
  }

  /**
   * Searches notes, reporting the mode actually answered and the signals used.
   *
   * @param request the search request
   * @return the response; never null
   */
  public SearchResponse search(SearchRequest request) {
    SearchMode requested = request.mode();
    SearchMode mode = embedder.isAvailable() ? requested : SearchMode.KEYWORD;
    if (mode != requested) {
      log.debug("No embedding backend, answering {} search as keyword", requested);
    }
    if (request.query().isBlank() || request.limit() == 0) {
      return SearchResponse.empty(requested, mode);
    }

    long start = System.nanoTime();
    Query query = Query.of(request, candidateDepth(request.limit()));
    SearchResponse response =
        switch (mode) {
          case KEYWORD -> keyword(query, requested);
          case SEMANTIC -> semantic(query, requested);
          case HYBRID -> hybrid(query, requested);
          case FUSED -> fused(query, requested);
        };
    log.debug(
        "Search '{}' mode={} effective={} signals={} hits={} in {}ms",
        request.query(),
        requested,
        response.effectiveMode(),
        response.signalsUsed(),
        response.documents().size(),
        (System.nanoTime() - start) / 1_000_000);
    return response;
  }

  /** Reports which engines can currently serve queries. */
  public SearchCapabilities capabilities() {
    boolean built = sparseIndex.isBuilt();
    return new SearchCapabilities(
        built,
        built ? sparseIndex.statistics().documentCount() : 0,
        embedder.isAvailable(),
        embedder.modelId(),
        vectorIndex.count(embedder.modelId()),
        reranker.isAvailable(),
        fusionProperties.getK(),
        fusionProperties.getSemanticWeight(),
        fusionProperties.getBm25Weight(),
        fusionProperties.getRerankWeight(),
        fusionProperties.getRerankBlend());
  }

  private SearchResponse keyword(Query query, SearchMode requested) {
    if (query.sparse() == null) {
      return SearchResponse.empty(requested, SearchMode.KEYWORD);
    }
    Optional<List<RankedEntry>> hits = keywordRanking(query.sparse(), query.depth());
    if (hits.isEmpty()) {
      return SearchResponse.empty(requested, SearchMode.KEYWORD);
    }
    return new SearchResponse(
        toDocuments(single(Signal.BM25, hits.get()), query),
        requested,
        SearchMode.KEYWORD,
        Set.of(Signal.BM25));
  }

  private SearchResponse semantic(Query query, SearchMode requested) {
    Optional<List<RankedEntry>> hits = semanticRanking(query.raw(), query.depth());
    if (hits.isEmpty()) {
      return keyword(query, requested);
    }
    return new SearchResponse(
        toDocuments(single(Signal.SEMANTIC, hits.get()), query),
        requested,
        SearchMode.SEMANTIC,
        Set.of(Signal.SEMANTIC));
  }

  private SearchResponse hybrid(Query query, SearchMode requested) {
    if (query.sparse() == null) {
      // Nothing survives sanitization: score the raw query semantically only.
      Optional<List<RankedEntry>> hits = semanticRanking(query.raw(), query.depth());
      if (hits.isEmpty()) {
        return SearchResponse.empty(requested, SearchMode.SEMANTIC);
      }
      return new SearchResponse(
          toDocuments(single(Signal.SEMANTIC, hits.get()), query),
          requested,
          SearchMode.SEMANTIC,
          Set.of(Signal.SEMANTIC));
    }
    Map<Signal, List<RankedEntry>> rankings = retrieverRankings(query);
    List<FusedResult> fused = fusionEngine.fuse(rankings);
    return new SearchResponse(
        toDocuments(fused, query), requested, SearchMode.HYBRID, rankings.keySet());
  }

  private SearchResponse fused(Query query, SearchMode requested) {
    if (query.sparse() == null) {
      return SearchResponse.empty(requested, SearchMode.FUSED);
    }
    Map<Signal, List<RankedEntry>> rankings = retrieverRankings(query);
    List<FusedResult> fused = fusionEngine.fuse(rankings);

    List<RerankCandidate> candidates = new ArrayList<>();
    for (FusedResult result : fused) {
      if (candidates.size() >= rerankerProperties.getRerankTopK()) {
        break;
      }
      documentStore
          .get(result.documentId())
          .ifPresent(document -> candidates.add(rerankCandidate(document, query)));
    }
    int keep = Math.max(query.limit(), rerankerProperties.getFinalTopK());
    Reranking reranking = reranker.rerank(query.raw(), candidates, keep);
    List<FusedResult> blended = fusionEngine.applyReranking(fused, reranking);

    Set<Signal> used = EnumSet.noneOf(Signal.class);
    used.addAll(rankings.keySet());
    if (reranking.applied()) {
      used.add(Signal.RERANK);
    }
    return new SearchResponse(toDocuments(blended, query), requested, SearchMode.FUSED, used);
  }

  private Map<Signal, List<RankedEntry>> retrieverRankings(Query query) {
    Map<Signal, List<RankedEntry>> rankings = new EnumMap<>(Signal.class);
    if (query.sparse() != null) {
      keywordRanking(query.sparse(), query.depth())
          .ifPresent(hits -> rankings.put(Signal.BM25, hits));
    }
    semanticRanking(query.raw(), query.depth())
        .ifPresent(hits -> rankings.put(Signal.SEMANTIC, hits));
    return rankings;
  }

  private Optional<List<RankedEntry>> keywordRanking(SparseQuery query, int depth) {
    try {
      return Optional.of(sparseIndex.search(query, depth));
    } catch (IndexUnavailableException e) {
      log.warn("Keyword signal dropped: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<List<RankedEntry>> semanticRanking(String rawQuery, int depth) {
    if (!embedder.isAvailable()) {
      return Optional.empty();
    }
    try {
      float[] vector = embedder.embed(rawQuery);
      return Optional.of(
          vectorIndex.search(
              vector, embedder.modelId(), depth, embeddingProperties.getMinSimilarity()));
    } catch (EmbeddingUnavailableException e) {
      log.warn("Semantic signal dropped: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private RerankCandidate rerankCandidate(Document document, Query query) {
    List<String> matched = matchedTerms(query, document.id());
    return new RerankCandidate(
        document.id(),
        document.title(),
        document.summary(),
        SnippetExtractor.extract(document, matched),
        document.tags());
  }

  private List<ScoredDocument> toDocuments(List<FusedResult> results, Query query) {
    List<ScoredDocument> documents = new ArrayList<>(Math.min(results.size(), query.limit()));
    for (FusedResult result : results) {
      if (documents.size() >= query.limit()) {
        break;
      }
      Optional<Document> document = documentStore.get(result.documentId());
      if (document.isEmpty()) {
        log.debug("Skipping document {} deleted since indexing", result.documentId());
        continue;
      }
      List<String> matched = matchedTerms(query, result.documentId());
      documents.add(
          new ScoredDocument(
              result.documentId(),
              document.get().title(),
              SnippetExtractor.extract(document.get(), matched),
              result.signalScores(),
              result.fusionSources(),
              matched,
              result.combinedScore(),
              documents.size() + 1));
    }
    return documents;
  }

  private List<String> matchedTerms(Query query, long documentId) {
    SparseQuery sparse = query.sparse();
    return sparse == null ? List.of() : sparseIndex.matchedTerms(sparse, documentId);
  }

  /** Wraps a single retriever's ranking in fusion results scored by the raw retriever score. */
  private static List<FusedResult> single(Signal signal, List<RankedEntry> hits) {
    List<FusedResult> results = new ArrayList<>(hits.size());
    for (RankedEntry hit : hits) {
      results.add(
          new FusedResult(
              hit.documentId(),
              Map.of(signal, hit.score()),
              Map.of(signal, hit.rank()),
              0.0,
              0.0,
              0.0,
              hit.score(),
              hit.rank(),
              Set.of(signal)));
    }
    return results;
  }

  int candidateDepth(int limit) {
    int scaled = (int) Math.min(Integer.MAX_VALUE, (long) CANDIDATE_MULTIPLIER * limit);
    return Math.max(sparseProperties.getCandidateLimit(), scaled);
  }

  private record Query(String raw, @Nullable SparseQuery sparse, int limit, int depth) {

    static Query of(SearchRequest request, int depth) {
      String sanitized = QuerySanitizer.sanitize(request.query());
      SparseQuery sparse = null;
      if (!sanitized.isEmpty()) {
        try {
          sparse = SparseQuery.parse(sanitized);
        } catch (InvalidQueryException e) {
          log.debug("No keyword query for '{}': {}", request.query(), e.getMessage());
        }
      }
      return new Query(request.query(), sparse, request.limit(), depth);
    }
  }
}
