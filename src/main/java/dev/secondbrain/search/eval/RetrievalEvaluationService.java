package dev.secondbrain.search.eval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.secondbrain.search.ScoredDocument;
import dev.secondbrain.search.SearchFacade;
import dev.secondbrain.search.SearchMode;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

/**
 * Runs a golden set through {@link SearchFacade} in each requested mode and summarizes the IR
 * metrics per mode, so keyword, semantic, hybrid and fused retrieval can be compared on the same
 * queries.
 */
@Service
public class RetrievalEvaluationService {

  private static final Logger log = LoggerFactory.getLogger(RetrievalEvaluationService.class);

  /** Deepest metric computed. */
  private static final int SEARCH_DEPTH = 10;

  static final String GOLDEN_SET_PATH = "eval/golden-set.json";

  private final SearchFacade searchFacade;
  private final ObjectMapper objectMapper;
  private final double recallThreshold;
  private final double mrrThreshold;

  public RetrievalEvaluationService(
      SearchFacade searchFacade,
      ObjectMapper objectMapper,
      @Value("${secondbrain.eval.thresholds.recall-at-10:0.70}") double recallThreshold,
      @Value("${secondbrain.eval.thresholds.mrr:0.60}") double mrrThreshold) {
    this.searchFacade = searchFacade;
    this.objectMapper = objectMapper;
    this.recallThreshold = recallThreshold;
    this.mrrThreshold = mrrThreshold;
  }

  /**
   * Evaluates the classpath golden set ({@value #GOLDEN_SET_PATH}) in every mode.
   *
   * @throws IOException if the golden set cannot be read
   */
  public Map<SearchMode, EvaluationSummary> evaluate() throws IOException {
    return evaluate(loadGoldenSet(GOLDEN_SET_PATH), List.of(SearchMode.values()));
  }

  /**
   * Evaluates {@code goldenSet} in each of {@code modes}.
   *
   * @return one summary per mode, in mode order
   */
  public Map<SearchMode, EvaluationSummary> evaluate(
      List<GoldenSetEntry> goldenSet, Collection<SearchMode> modes) {
    Map<SearchMode, EvaluationSummary> summaries = new EnumMap<>(SearchMode.class);
    for (SearchMode mode : modes) {
      List<EvaluationResult> results = new ArrayList<>(goldenSet.size());
      for (GoldenSetEntry entry : goldenSet) {
        results.add(evaluateQuery(entry, mode));
      }
      summaries.put(mode, summarize(mode, results));
    }
    return summaries;
  }

  /**
   * Loads a golden set from the classpath.
   *
   * @throws IOException if the resource is missing or malformed
   */
  public List<GoldenSetEntry> loadGoldenSet(String classpathLocation) throws IOException {
    ClassPathResource resource = new ClassPathResource(classpathLocation);
    try (InputStream is = resource.getInputStream()) {
      List<GoldenSetEntry> entries =
          objectMapper.readValue(is, new TypeReference<List<GoldenSetEntry>>() {});
      log.info("Loaded golden set {} with {} queries", classpathLocation, entries.size());
      return entries;
    }
  }

  EvaluationResult evaluateQuery(GoldenSetEntry entry, SearchMode mode) {
    List<ScoredDocument> documents = searchFacade.search(entry.query(), mode, SEARCH_DEPTH);

    List<Long> retrieved = new ArrayList<>(documents.size());
    List<EvaluationResult.Hit> hits = new ArrayList<>(documents.size());
    for (ScoredDocument document : documents) {
      retrieved.add(document.id());
      hits.add(
          new EvaluationResult.Hit(
              document.id(),
              document.finalScore(),
              document.rank(),
              gradeOf(document.id(), entry.judgments())));
    }

    RetrievalMetrics.MetricsResult at5 =
        RetrievalMetrics.computeAll(retrieved, entry.judgments(), 5);
    RetrievalMetrics.MetricsResult at10 =
        RetrievalMetrics.computeAll(retrieved, entry.judgments(), 10);
    return new EvaluationResult(
        entry.query(),
        mode,
        hits,
        at5.recallAtK(),
        at10.recallAtK(),
        at5.precisionAtK(),
        at10.precisionAtK(),
        at10.mrr(),
        at5.ndcgAtK(),
        at10.ndcgAtK(),
        at10.averagePrecision(),
        at10.hitRate());
  }

  private static int gradeOf(long documentId, List<RelevanceJudgment> judgments) {
    return judgments.stream()
        .filter(j -> j.documentId() == documentId)
        .mapToInt(RelevanceJudgment::grade)
        .max()
        .orElse(0);
  }

  private EvaluationSummary summarize(SearchMode mode, List<EvaluationResult> results) {
    double recallAt10 = avg(results, EvaluationResult::recallAt10);
    double mrr = avg(results, EvaluationResult::mrr);

    List<String> failedQueries = new ArrayList<>();
    for (EvaluationResult result : results) {
      if (result.recallAt10() < recallThreshold || result.mrr() < mrrThreshold) {
        failedQueries.add(result.query());
      }
    }
    boolean passed = recallAt10 >= recallThreshold && mrr >= mrrThreshold;

    EvaluationSummary summary =
        new EvaluationSummary(
            mode,
            results.size(),
            avg(results, EvaluationResult::recallAt5),
            recallAt10,
            avg(results, EvaluationResult::precisionAt10),
            mrr,
            avg(results, EvaluationResult::ndcgAt10),
            avg(results, EvaluationResult::averagePrecision),
            avg(results, EvaluationResult::hitRateAt10),
            passed,
            failedQueries);
    log.info(
        "Evaluation {}: recall@10={}, mrr={}, ndcg@10={}, map={}, passed={}",
        mode,
        summary.recallAt10(),
        summary.mrr(),
        summary.ndcgAt10(),
        summary.map(),
        passed);
    return summary;
  }

  private static double avg(
      List<EvaluationResult> results, ToDoubleFunction<EvaluationResult> metric) {
    return results.stream().mapToDouble(metric).average().orElse(0.0);
  }
}
