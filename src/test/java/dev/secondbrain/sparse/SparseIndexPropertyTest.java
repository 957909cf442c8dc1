package dev.secondbrain.sparse;

import static org.assertj.core.api.Assertions.assertThat;

import dev.secondbrain.document.Document;
import dev.secondbrain.retrieval.RankedEntry;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for the BM25 index: scoring is deterministic and rebuilding an unchanged
 * corpus is idempotent.
 */
class SparseIndexPropertyTest {

  private static final List<String> VOCABULARY =
      List.of("alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta");

  @Provide
  Arbitrary<List<String>> corpora() {
    Arbitrary<String> text =
        Arbitraries.of(VOCABULARY).list().ofMinSize(1).ofMaxSize(12).map(w -> String.join(" ", w));
    return text.list().ofMinSize(1).ofMaxSize(15);
  }

  @Provide
  Arbitrary<String> queryWords() {
    return Arbitraries.of(VOCABULARY);
  }

  private static List<Document> documents(List<String> bodies) {
    List<Document> documents = new ArrayList<>();
    for (int i = 0; i < bodies.size(); i++) {
      documents.add(new Document(i + 1, "", bodies.get(i)));
    }
    return documents;
  }

  @Property
  void identical_corpus_and_query_give_identical_rankings(
      @ForAll("corpora") List<String> bodies, @ForAll("queryWords") String word) {
    SparseIndex first = new SparseIndex(new SparseProperties());
    SparseIndex second = new SparseIndex(new SparseProperties());
    first.rebuild(documents(bodies));
    second.rebuild(documents(bodies));
    SparseQuery query = SparseQuery.parse(word);

    List<RankedEntry> a = first.search(query, 50);

    assertThat(a).isEqualTo(first.search(query, 50));
    assertThat(a).isEqualTo(second.search(query, 50));
  }

  @Property
  void rebuilding_unchanged_corpus_is_idempotent(
      @ForAll("corpora") List<String> bodies, @ForAll("queryWords") String word) {
    SparseIndex index = new SparseIndex(new SparseProperties());
    SparseQuery query = SparseQuery.parse(word);

    CorpusStatistics firstStatistics = index.rebuild(documents(bodies));
    List<RankedEntry> firstHits = index.search(query, 50);
    CorpusStatistics secondStatistics = index.rebuild(documents(bodies));

    assertThat(secondStatistics).isEqualTo(firstStatistics);
    assertThat(index.search(query, 50)).isEqualTo(firstHits);
  }

  @Property
  void hits_are_sorted_and_ranked_from_one(
      @ForAll("corpora") List<String> bodies, @ForAll("queryWords") String word) {
    SparseIndex index = new SparseIndex(new SparseProperties());
    index.rebuild(documents(bodies));

    List<RankedEntry> hits = index.search(SparseQuery.parse(word), 50);

    for (int i = 0; i < hits.size(); i++) {
      assertThat(hits.get(i).rank()).isEqualTo(i + 1);
      if (i > 0) {
        RankedEntry previous = hits.get(i - 1);
        assertThat(previous.score()).isGreaterThanOrEqualTo(hits.get(i).score());
        if (previous.score() == hits.get(i).score()) {
          assertThat(previous.documentId()).isLessThan(hits.get(i).documentId());
        }
      }
    }
  }
}
