package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.application.port.context.ExecutionContext;
import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.AnalysisOverrides;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Stage-wide part of the execution context; combined with each module's options by the runner.
 *
 * @param task analysis task
 * @param analysisPath analysis storage directory
 * @param results results map visible to modules
 * @param overrides per-analysis overrides
 * @param cancellation cancellation token of the run
 * @since 0.1.0
 */
public record ModuleScope(
    AnalysisTask task,
    Path analysisPath,
    Map<String, Object> results,
    AnalysisOverrides overrides,
    CancellationToken cancellation) {

  /**
   * Validates members and applies defaults.
   */
  public ModuleScope {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(analysisPath, "analysisPath");
    Objects.requireNonNull(results, "results");
    overrides = Objects.requireNonNullElse(overrides, AnalysisOverrides.empty());
    cancellation = Objects.requireNonNullElse(cancellation, CancellationToken.NONE);
  }

  /**
   * Returns a copy exposing another results map.
   *
   * @param view results map handed to modules
   * @return updated scope
   */
  public ModuleScope withResults(Map<String, Object> view) {
    return new ModuleScope(task, analysisPath, view, overrides, cancellation);
  }

  ExecutionContext contextFor(ModuleOptions options) {
    return new ExecutionContext(task, analysisPath, options, results, overrides, cancellation);
  }
}
