package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.domain.detection.Detection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one {@link AnalysisPipeline} run.
 *
 * @param results final results map, including {@code signatures}
 * @param detections matched detections, ascending severity
 * @param reports reporting module executions in execution order
 * @since 0.1.0
 */
public record AnalysisResult(
    Map<String, Object> results,
    List<Detection> detections,
    List<ModuleExecution<Void>> reports) {

  /**
   * Validates members and freezes lists.
   */
  public AnalysisResult {
    Objects.requireNonNull(results, "results");
    detections = List.copyOf(detections);
    reports = List.copyOf(reports);
  }
}
