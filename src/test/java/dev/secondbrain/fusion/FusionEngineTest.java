package dev.secondbrain.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.secondbrain.rerank.RerankedCandidate;
import dev.secondbrain.rerank.Reranking;
import dev.secondbrain.retrieval.RankedEntry;
import dev.secondbrain.retrieval.Signal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class FusionEngineTest {

  private static FusionEngine engine(double bm25, double semantic, double rerank, double blend) {
    FusionProperties properties = new FusionProperties();
    properties.setBm25Weight(bm25);
    properties.setSemanticWeight(semantic);
    properties.setRerankWeight(rerank);
    properties.setRerankBlend(blend);
    return new FusionEngine(properties);
  }

  private static List<RankedEntry> ranking(long... ids) {
    RankedEntry[] entries = new RankedEntry[ids.length];
    for (int i = 0; i < ids.length; i++) {
      entries[i] = new RankedEntry(ids[i], i + 1, 1.0 / (i + 1));
    }
    return List.of(entries);
  }

  private static Map<Signal, List<RankedEntry>> rankings(
      List<RankedEntry> bm25, List<RankedEntry> semantic) {
    Map<Signal, List<RankedEntry>> rankings = new EnumMap<>(Signal.class);
    rankings.put(Signal.BM25, bm25);
    rankings.put(Signal.SEMANTIC, semantic);
    return rankings;
  }

  @Nested
  class Fuse {

    @Test
    void crossed_ranks_with_equal_weights_tie_and_lower_id_wins() {
      FusionEngine engine = engine(1.0, 1.0, 1.0, 0.5);

      List<FusedResult> fused = engine.fuse(rankings(ranking(1, 2), ranking(2, 1)));

      assertThat(fused).extracting(FusedResult::documentId).containsExactly(1L, 2L);
      assertThat(fused.get(0).combinedScore()).isEqualTo(fused.get(1).combinedScore());
      assertThat(fused.get(0).rrfScore()).isCloseTo(1.0 / 61 + 1.0 / 62, within(1e-12));
      assertThat(fused).extracting(FusedResult::finalRank).containsExactly(1, 2);
    }

    @Test
    void every_input_document_appears_once() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);

      List<FusedResult> fused = engine.fuse(rankings(ranking(1, 2, 3), ranking(3, 4)));

      assertThat(fused)
          .extracting(FusedResult::documentId)
          .containsExactlyInAnyOrder(1L, 2L, 3L, 4L);
    }

    @Test
    void tracks_per_signal_ranks_scores_and_sources() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);

      List<FusedResult> fused = engine.fuse(rankings(ranking(1, 2), ranking(2)));

      FusedResult two = fused.stream().filter(r -> r.documentId() == 2L).findFirst().orElseThrow();
      assertThat(two.fusionSources()).containsExactlyInAnyOrder(Signal.BM25, Signal.SEMANTIC);
      assertThat(two.signalRanks()).containsEntry(Signal.BM25, 2).containsEntry(Signal.SEMANTIC, 1);
      assertThat(two.signalScores()).containsEntry(Signal.SEMANTIC, 1.0);
      assertThat(two.rrfScore()).isCloseTo(0.3 / 62 + 0.4 / 61, within(1e-12));

      FusedResult one = fused.stream().filter(r -> r.documentId() == 1L).findFirst().orElseThrow();
      assertThat(one.fusionSources()).containsExactly(Signal.BM25);
      assertThat(one.rerankScore()).isZero();
    }

    @Test
    void single_retriever_keeps_its_order() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);

      List<FusedResult> fused =
          engine.fuse(Map.of(Signal.BM25, ranking(7, 3, 9, 1)));

      assertThat(fused).extracting(FusedResult::documentId).containsExactly(7L, 3L, 9L, 1L);
      assertThat(fused).allSatisfy(r -> assertThat(r.combinedScore()).isEqualTo(r.rrfScore()));
    }

    @Test
    void empty_rankings_fuse_to_nothing() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);

      assertThat(engine.fuse(Map.of())).isEmpty();
      assertThat(engine.fuse(rankings(List.of(), List.of()))).isEmpty();
    }

    @Test
    void rerank_is_not_a_retriever() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);

      assertThatThrownBy(() -> engine.fuse(Map.of(Signal.RERANK, ranking(1))))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  class ApplyReranking {

    @Test
    void not_applied_returns_the_fused_list_unchanged() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);
      List<FusedResult> fused = engine.fuse(rankings(ranking(1, 2), ranking(2, 3)));

      List<FusedResult> result =
          engine.applyReranking(
              fused, new Reranking(List.of(new RerankedCandidate(3L, 0.0, 0.0)), false));

      assertThat(result).isSameAs(fused);
    }

    @Test
    void blends_rrf_with_normalized_rerank_score() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);
      List<FusedResult> fused = engine.fuse(rankings(ranking(1, 2), ranking(1, 2)));

      List<FusedResult> result =
          engine.applyReranking(
              fused,
              new Reranking(
                  List.of(RerankedCandidate.of(2L, 4.0), RerankedCandidate.of(1L, -4.0)), true));

      assertThat(result).extracting(FusedResult::documentId).containsExactly(2L, 1L);
      FusedResult two = result.get(0);
      double expected =
          0.5 * two.rrfScore() + 0.5 * 0.3 * RerankedCandidate.sigmoid(4.0);
      assertThat(two.combinedScore()).isCloseTo(expected, within(1e-12));
      assertThat(two.rerankScore()).isEqualTo(4.0);
      assertThat(two.fusionSources()).contains(Signal.RERANK);
      assertThat(two.signalRanks()).containsEntry(Signal.RERANK, 1);
      assertThat(two.finalRank()).isEqualTo(1);
    }

    @Test
    void documents_outside_the_reranked_head_are_dropped() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.5);
      List<FusedResult> fused = engine.fuse(rankings(ranking(1, 2, 3), ranking(1, 2, 3)));

      List<FusedResult> result =
          engine.applyReranking(
              fused, new Reranking(List.of(RerankedCandidate.of(1L, 0.0)), true));

      assertThat(result).extracting(FusedResult::documentId).containsExactly(1L);
    }

    @Test
    void zero_blend_keeps_the_rrf_order() {
      FusionEngine engine = engine(0.3, 0.4, 0.3, 0.0);
      List<FusedResult> fused = engine.fuse(rankings(ranking(1, 2), ranking(1, 2)));

      List<FusedResult> result =
          engine.applyReranking(
              fused,
              new Reranking(
                  List.of(RerankedCandidate.of(2L, 9.0), RerankedCandidate.of(1L, -9.0)), true));

      assertThat(result).extracting(FusedResult::documentId).containsExactly(1L, 2L);
    }
  }
}
