package dev.secondbrain.search;

import static dev.secondbrain.fixture.DocumentBuilder.doc;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import dev.secondbrain.document.Document;
import dev.secondbrain.document.InMemoryDocumentStore;
import dev.secondbrain.fixture.BagOfWordsEmbedder;
import dev.secondbrain.fixture.DocumentBuilder;
import dev.secondbrain.fusion.FusionEngine;
import dev.secondbrain.fusion.FusionProperties;
import dev.secondbrain.rerank.NoOpReranker;
import dev.secondbrain.rerank.RerankedCandidate;
import dev.secondbrain.rerank.Reranker;
import dev.secondbrain.rerank.RerankerProperties;
import dev.secondbrain.rerank.Reranking;
import dev.secondbrain.retrieval.Signal;
import dev.secondbrain.sparse.SparseIndex;
import dev.secondbrain.sparse.SparseProperties;
import dev.secondbrain.vector.Embedder;
import dev.secondbrain.vector.EmbeddingProperties;
import dev.secondbrain.vector.NullEmbedder;
import dev.secondbrain.vector.VectorIndex;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SearchFacadeTest {

  private final InMemoryDocumentStore store = new InMemoryDocumentStore();
  private final SparseIndex sparseIndex = new SparseIndex(new SparseProperties());
  private final VectorIndex vectorIndex =
      new VectorIndex(Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC));
  private final FusionProperties fusionProperties = new FusionProperties();
  private final BagOfWordsEmbedder bagOfWords = new BagOfWordsEmbedder();

  private SearchFacade facade(Embedder embedder, Reranker reranker) {
    return new SearchFacade(
        store,
        sparseIndex,
        new SparseProperties(),
        embedder,
        vectorIndex,
        new EmbeddingProperties(),
        reranker,
        new RerankerProperties(),
        new FusionEngine(fusionProperties),
        fusionProperties);
  }

  private SearchFacade facade() {
    return facade(bagOfWords, new NoOpReranker());
  }

  /** Saves the documents, rebuilds BM25 and embeds each body with the bag-of-words model. */
  private void index(Document... documents) {
    for (Document document : documents) {
      store.save(document);
      vectorIndex.upsert(document.id(), bagOfWords.modelId(), bagOfWords.embed(document.body()));
    }
    sparseIndex.rebuild(store.listAll());
  }

  private static List<Long> ids(List<ScoredDocument> hits) {
    return hits.stream().map(ScoredDocument::id).toList();
  }

  @Nested
  class Keyword {

    @Test
    void repeated_term_ranks_first() {
      index(doc(1, "alpha beta alpha"), doc(2, "beta gamma"));

      List<ScoredDocument> hits = facade().search("alpha", SearchMode.KEYWORD, 10);

      assertThat(ids(hits)).containsExactly(1L);
      ScoredDocument top = hits.get(0);
      assertThat(top.rank()).isEqualTo(1);
      assertThat(top.signals()).containsExactly(Signal.BM25);
      assertThat(top.matchedTerms()).containsExactly("alpha");
      assertThat(top.finalScore()).isEqualTo(top.signalScores().get(Signal.BM25));
      assertThat(top.snippet()).isEqualTo("alpha beta alpha");
    }

    @Test
    void shared_term_ranks_by_bm25() {
      index(doc(1, "alpha beta alpha"), doc(2, "beta gamma"));

      List<ScoredDocument> hits = facade().search("beta", SearchMode.KEYWORD, 10);

      assertThat(ids(hits)).containsExactlyInAnyOrder(1L, 2L);
      assertThat(hits.get(0).finalScore()).isGreaterThanOrEqualTo(hits.get(1).finalScore());
    }

    @Test
    void hyphenated_term_is_found() {
      index(doc(1, "notes on cross-validation for models"), doc(2, "validation across folds"));

      List<ScoredDocument> hits = facade().search("cross-validation", SearchMode.KEYWORD, 10);

      assertThat(ids(hits)).containsExactly(1L);
      assertThat(hits.get(0).matchedTerms()).containsExactly("cross-validation");
    }

    @Test
    void multi_word_query_matches_as_phrase() {
      index(doc(1, "spring retry template"), doc(2, "retry later in spring"));

      List<ScoredDocument> hits = facade().search("spring retry", SearchMode.KEYWORD, 10);

      assertThat(ids(hits)).containsExactly(1L);
    }

    @Test
    void limit_caps_results_and_ranks_are_dense() {
      index(doc(1, "note one"), doc(2, "note two"), doc(3, "note three"));

      List<ScoredDocument> hits = facade().search("note", SearchMode.KEYWORD, 2);

      assertThat(hits).hasSize(2);
      assertThat(hits).extracting(ScoredDocument::rank).containsExactly(1, 2);
    }

    @Test
    void query_without_searchable_terms_is_empty() {
      index(doc(1, "alpha"));

      assertThat(facade().search("the and", SearchMode.KEYWORD, 10)).isEmpty();
      assertThat(facade().search("#", SearchMode.KEYWORD, 10)).isEmpty();
    }

    @Test
    void documents_deleted_since_indexing_are_skipped() {
      index(doc(1, "alpha"), doc(2, "alpha alpha"));
      store.delete(2L);

      List<ScoredDocument> hits = facade().search("alpha", SearchMode.KEYWORD, 10);

      assertThat(ids(hits)).containsExactly(1L);
      assertThat(hits.get(0).rank()).isEqualTo(1);
    }
  }

  @Nested
  class Semantic {

    @Test
    void ranks_by_embedding_similarity() {
      index(doc(1, "kubernetes operator reconciliation"), doc(2, "sourdough bread starter"));

      SearchResponse response =
          facade().search(new SearchRequest("kubernetes operator", SearchMode.SEMANTIC, 10));

      assertThat(response.effectiveMode()).isEqualTo(SearchMode.SEMANTIC);
      assertThat(response.signalsUsed()).containsExactly(Signal.SEMANTIC);
      assertThat(ids(response.documents())).first().isEqualTo(1L);
    }

    @Test
    void embedding_failure_answers_with_keyword_search() {
      index(doc(1, "alpha beta alpha"), doc(2, "beta gamma"));
      bagOfWords.failing(true);

      SearchResponse response =
          facade().search(new SearchRequest("alpha", SearchMode.SEMANTIC, 10));

      assertThat(response.effectiveMode()).isEqualTo(SearchMode.KEYWORD);
      assertThat(response.degraded()).isTrue();
      assertThat(response.signalsUsed()).containsExactly(Signal.BM25);
      assertThat(ids(response.documents())).containsExactly(1L);
    }
  }

  @Nested
  class Hybrid {

    @Test
    void fuses_keyword_and_semantic_signals() {
      index(doc(1, "alpha beta alpha"), doc(2, "beta gamma"));

      SearchResponse response = facade().search(new SearchRequest("alpha", SearchMode.HYBRID, 10));

      assertThat(response.effectiveMode()).isEqualTo(SearchMode.HYBRID);
      assertThat(response.signalsUsed()).containsExactlyInAnyOrder(Signal.BM25, Signal.SEMANTIC);
      ScoredDocument top = response.documents().get(0);
      assertThat(top.id()).isEqualTo(1L);
      assertThat(top.signals()).containsExactlyInAnyOrder(Signal.BM25, Signal.SEMANTIC);
      double k = fusionProperties.getK();
      assertThat(top.finalScore())
          .isEqualTo(
              fusionProperties.getBm25Weight() / (k + 1)
                  + fusionProperties.getSemanticWeight() / (k + 1));
    }

    @Test
    void embedding_failure_keeps_the_keyword_signal() {
      index(doc(1, "alpha beta alpha"), doc(2, "beta gamma"));
      bagOfWords.failing(true);

      SearchResponse response = facade().search(new SearchRequest("alpha", SearchMode.HYBRID, 10));

      assertThat(response.signalsUsed()).containsExactly(Signal.BM25);
      assertThat(ids(response.documents())).containsExactly(1L);
    }

    @Test
    void query_with_no_keyword_terms_falls_back_to_semantic() {
      index(doc(1, "alpha"), doc(2, "gamma"));
      float[] alpha = bagOfWords.embed("alpha");
      Embedder fixed =
          new Embedder() {
            @Override
            public float[] embed(String text) {
              return alpha;
            }

            @Override
            public String modelId() {
              return BagOfWordsEmbedder.MODEL_ID;
            }
          };

      SearchResponse response = facade(fixed, new NoOpReranker())
          .search(new SearchRequest("?", SearchMode.HYBRID, 10));

      assertThat(response.effectiveMode()).isEqualTo(SearchMode.SEMANTIC);
      assertThat(response.signalsUsed()).containsExactly(Signal.SEMANTIC);
      assertThat(ids(response.documents())).first().isEqualTo(1L);
    }

    @Test
    void unbuilt_keyword_index_leaves_the_semantic_signal() {
      store.save(doc(1, "alpha"));
      vectorIndex.upsert(1L, bagOfWords.modelId(), bagOfWords.embed("alpha"));

      SearchResponse response = facade().search(new SearchRequest("alpha", SearchMode.HYBRID, 10));

      assertThat(response.signalsUsed()).containsExactly(Signal.SEMANTIC);
      assertThat(ids(response.documents())).containsExactly(1L);
    }
  }

  @Nested
  class Fused {

    @Test
    void without_reranker_matches_hybrid_order() {
      index(
          doc(1, "alpha beta alpha"),
          doc(2, "beta gamma"),
          doc(3, "gamma delta beta"),
          doc(4, "alpha"));

      List<ScoredDocument> hybrid = facade().search("beta", SearchMode.HYBRID, 10);
      List<ScoredDocument> fused = facade().search("beta", SearchMode.FUSED, 10);

      assertThat(ids(fused)).isEqualTo(ids(hybrid));
    }

    @Test
    void blends_reranker_scores_into_the_ranking() {
      index(doc(1, "alpha beta alpha"), doc(2, "alpha gamma"));
      Reranker reranker = mock(Reranker.class);
      given(reranker.rerank(anyString(), anyList(), anyInt()))
          .willReturn(
              new Reranking(
                  List.of(RerankedCandidate.of(2L, 6.0), RerankedCandidate.of(1L, -6.0)), true));

      SearchResponse response =
          facade(bagOfWords, reranker).search(new SearchRequest("alpha", SearchMode.FUSED, 10));

      assertThat(response.signalsUsed()).contains(Signal.RERANK);
      assertThat(ids(response.documents())).containsExactly(2L, 1L);
      assertThat(response.documents().get(0).signals()).contains(Signal.RERANK);
      assertThat(response.documents().get(0).signalScores()).containsEntry(Signal.RERANK, 6.0);
    }

    @Test
    void query_with_no_keyword_terms_is_empty() {
      index(doc(1, "alpha"));

      SearchResponse response = facade().search(new SearchRequest("#", SearchMode.FUSED, 10));

      assertThat(response.documents()).isEmpty();
    }
  }

  @Nested
  class Degradation {

    @BeforeEach
    void corpus() {
      index(
          doc(1, "alpha beta alpha"),
          doc(2, "beta gamma"),
          new DocumentBuilder().id(3).title("Beta notes").body("delta epsilon").build());
    }

    @ParameterizedTest
    @EnumSource(SearchMode.class)
    void without_embeddings_every_mode_equals_keyword(SearchMode mode) {
      SearchFacade keywordOnly = facade(new NullEmbedder(), new NoOpReranker());

      SearchResponse expected =
          keywordOnly.search(new SearchRequest("beta", SearchMode.KEYWORD, 10));
      SearchResponse actual = keywordOnly.search(new SearchRequest("beta", mode, 10));

      assertThat(actual.documents()).isEqualTo(expected.documents());
      assertThat(actual.effectiveMode()).isEqualTo(SearchMode.KEYWORD);
      assertThat(actual.requestedMode()).isEqualTo(mode);
    }

    @Test
    void capabilities_report_missing_backends() {
      SearchCapabilities capabilities =
          facade(new NullEmbedder(), new NoOpReranker()).capabilities();

      assertThat(capabilities.sparseIndexBuilt()).isTrue();
      assertThat(capabilities.indexedDocuments()).isEqualTo(3);
      assertThat(capabilities.embeddingAvailable()).isFalse();
      assertThat(capabilities.embeddingModel()).isEqualTo(NullEmbedder.MODEL_ID);
      assertThat(capabilities.rerankerAvailable()).isFalse();
      assertThat(capabilities.rrfK()).isEqualTo(60);
    }

    @Test
    void capabilities_count_embeddings_of_the_active_model() {
      SearchCapabilities capabilities = facade().capabilities();

      assertThat(capabilities.embeddingAvailable()).isTrue();
      assertThat(capabilities.embeddedDocuments()).isEqualTo(3);
    }
  }

  @Nested
  class EdgeCases {

    @ParameterizedTest
    @EnumSource(SearchMode.class)
    void empty_corpus_returns_nothing(SearchMode mode) {
      sparseIndex.rebuild(List.of());

      assertThat(facade().search("alpha", mode, 10)).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(SearchMode.class)
    void unbuilt_indexes_return_nothing(SearchMode mode) {
      assertThat(facade().search("alpha", mode, 10)).isEmpty();
    }

    @Test
    void candidate_depth_scales_with_limit_above_the_floor() {
      assertThat(facade().candidateDepth(3)).isEqualTo(50);
      assertThat(facade().candidateDepth(20)).isEqualTo(100);
    }

    @Test
    void candidate_depth_saturates_instead_of_overflowing() {
      assertThat(facade().candidateDepth(Integer.MAX_VALUE / 5 + 1)).isEqualTo(Integer.MAX_VALUE);
      assertThat(facade().candidateDepth(Integer.MAX_VALUE)).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void huge_limit_returns_every_hit() {
      index(doc(1, "alpha"), doc(2, "alpha beta"));

      assertThat(ids(facade().search("alpha", SearchMode.KEYWORD, Integer.MAX_VALUE)))
          .containsExactlyInAnyOrder(1L, 2L);
    }

    @ParameterizedTest
    @EnumSource(SearchMode.class)
    void blank_query_or_zero_limit_returns_nothing(SearchMode mode) {
      index(doc(1, "alpha"));

      assertThat(facade().search("   ", mode, 10)).isEmpty();
      assertThat(facade().search("alpha", mode, 0)).isEmpty();
    }

    @Test
    void negative_limit_is_rejected() {
      assertThatThrownBy(() -> facade().search("alpha", SearchMode.KEYWORD, -1))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknown_mode_name_is_rejected() {
      assertThatThrownBy(() -> facade().search("alpha", "vector", 10))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("vector");
    }

    @Test
    void mode_name_is_case_insensitive() {
      index(doc(1, "alpha"));

      assertThat(facade().search("alpha", "Keyword", 10)).extracting(ScoredDocument::id)
          .containsExactly(1L);
    }
  }
}
