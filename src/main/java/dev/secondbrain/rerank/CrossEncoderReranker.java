package dev.secondbrain.rerank;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.scoring.ScoringModel;
import dev.secondbrain.retrieval.BoundedModelCall;
import dev.secondbrain.retrieval.RerankUnavailableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cross-encoder reranker backed by a LangChain4j {@link ScoringModel}, in practice the ONNX
 * ms-marco-MiniLM-L-6-v2 model.
 *
 * <p>Only the first {@code rerankTopK} candidates are scored; the rest are dropped. Raw logits are
 * normalized with a sigmoid for blending. On model failure or timeout the input order is passed
 * through with {@code applied = false}.
 *
 * @see dev.langchain4j.model.scoring.ScoringModel
 */
public class CrossEncoderReranker implements Reranker {

  private static final Logger log = LoggerFactory.getLogger(CrossEncoderReranker.class);

  private static final Comparator<RerankedCandidate> ORDER =
      Comparator.comparingDouble(RerankedCandidate::rawScore)
          .reversed()
          .thenComparingLong(RerankedCandidate::documentId);

  private final ScoringModel scoringModel;
  private final ExecutorService executor;
  private final Duration timeout;
  private final int rerankTopK;

  public CrossEncoderReranker(
      ScoringModel scoringModel, ExecutorService executor, Duration timeout, int rerankTopK) {
    this.scoringModel = scoringModel;
    this.executor = executor;
    this.timeout = timeout;
    this.rerankTopK = rerankTopK;
  }

  @Override
  public Reranking rerank(String query, List<RerankCandidate> candidates, int topK) {
    if (candidates.isEmpty() || topK <= 0) {
      return new Reranking(List.of(), true);
    }
    List<RerankCandidate> head = candidates.subList(0, Math.min(rerankTopK, candidates.size()));
    List<TextSegment> segments =
        head.stream().map(c -> TextSegment.from(c.representation())).toList();

    List<Double> scores;
    try {
      scores =
          BoundedModelCall.call(
              executor,
              timeout,
              () -> scoringModel.scoreAll(segments, query).content(),
              cause -> new RerankUnavailableException("Cross-encoder scoring failed", cause));
    } catch (RerankUnavailableException e) {
      log.warn("Reranking skipped: {}", String.valueOf(e.getCause()));
      return Reranking.passThrough(candidates, topK);
    }
    if (scores == null || scores.size() != head.size()) {
      log.warn(
          "Reranking skipped: model returned {} scores for {} candidates",
          scores == null ? 0 : scores.size(),
          head.size());
      return Reranking.passThrough(candidates, topK);
    }

    List<RerankedCandidate> reranked = new ArrayList<>(head.size());
    for (int i = 0; i < head.size(); i++) {
      reranked.add(RerankedCandidate.of(head.get(i).documentId(), scores.get(i)));
    }
    reranked.sort(ORDER);
    return new Reranking(reranked.subList(0, Math.min(topK, reranked.size())), true);
  }

  @Override
  public boolean isAvailable() {
    return true;
  }
}
