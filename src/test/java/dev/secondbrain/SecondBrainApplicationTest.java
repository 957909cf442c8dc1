package dev.secondbrain;

import static org.assertj.core.api.Assertions.assertThat;

import dev.secondbrain.document.Document;
import dev.secondbrain.document.InMemoryDocumentStore;
import dev.secondbrain.indexing.IndexMaintenanceService;
import dev.secondbrain.rerank.NoOpReranker;
import dev.secondbrain.rerank.Reranker;
import dev.secondbrain.search.SearchCapabilities;
import dev.secondbrain.search.SearchFacade;
import dev.secondbrain.search.SearchMode;
import dev.secondbrain.search.SearchRequest;
import dev.secondbrain.search.SearchResponse;
import dev.secondbrain.vector.Embedder;
import dev.secondbrain.vector.NullEmbedder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class SecondBrainApplicationTest {

  @Autowired InMemoryDocumentStore documentStore;
  @Autowired IndexMaintenanceService indexMaintenanceService;
  @Autowired SearchFacade searchFacade;
  @Autowired Embedder embedder;
  @Autowired Reranker reranker;

  @Test
  void falls_back_to_null_backends_when_models_are_disabled() {
    assertThat(embedder).isInstanceOf(NullEmbedder.class);
    assertThat(reranker).isInstanceOf(NoOpReranker.class);

    SearchCapabilities capabilities = searchFacade.capabilities();
    assertThat(capabilities.sparseIndexBuilt()).isTrue();
    assertThat(capabilities.embeddingAvailable()).isFalse();
    assertThat(capabilities.rerankerAvailable()).isFalse();
  }

  @Test
  void saved_note_is_found_after_rebuild() {
    documentStore.save(
        new Document(101L, "Weekly review", "Checklist for the weekly review ritual"));
    indexMaintenanceService.rebuildNow();

    SearchResponse response =
        searchFacade.search(new SearchRequest("ritual", SearchMode.HYBRID, 5));

    assertThat(response.effectiveMode()).isEqualTo(SearchMode.KEYWORD);
    assertThat(response.documents()).extracting(d -> d.id()).contains(101L);
    assertThat(response.documents().get(0).title()).isEqualTo("Weekly review");
  }
}
