package ca.gc.cra.kestrel.application.port.context;

import ca.gc.cra.kestrel.application.util.CancellationToken;
import ca.gc.cra.kestrel.config.AnalysisOverrides;
import ca.gc.cra.kestrel.config.ModuleOptions;
import ca.gc.cra.kestrel.domain.analysis.AnalysisTask;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Per-execution bundle injected into one module instance.
 * <p><strong>Why:</strong> Gives a module its task, storage path, options and the results gathered so far
 * without exposing the runner.</p>
 * <p><strong>Role:</strong> Owned by the module runner for the duration of one module execution; never
 * retained across modules.</p>
 * <p><strong>Thread-safety:</strong> The record is immutable; {@link #results()} is the shared results map
 * during sequential runs and a read-only snapshot during parallel processing groups.</p>
 *
 * @param task analysis task
 * @param analysisPath analysis storage directory
 * @param options resolved module options
 * @param results results map accumulated so far
 * @param overrides per-analysis overrides; empty for processing and auxiliary modules
 * @param cancellation cancellation token of the run
 * @since 0.1.0
 */
public record ExecutionContext(
    AnalysisTask task,
    Path analysisPath,
    ModuleOptions options,
    Map<String, Object> results,
    AnalysisOverrides overrides,
    CancellationToken cancellation) {

  /**
   * Validates required members.
   */
  public ExecutionContext {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(analysisPath, "analysisPath");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(results, "results");
    overrides = Objects.requireNonNullElse(overrides, AnalysisOverrides.empty());
    cancellation = Objects.requireNonNullElse(cancellation, CancellationToken.NONE);
  }
}
