package ca.gc.cra.kestrel.application.port;

import ca.gc.cra.kestrel.application.port.context.ExecutionContext;

/**
 * <strong>What:</strong> Reporting plugin that consumes the finalized results map.
 * <p><strong>Role:</strong> Plugin contract of the {@code reporting} group; side effects are opaque to the core.</p>
 * <p><strong>Thread-safety:</strong> A fresh instance is created per run.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.kestrel.application.pipeline.ReportingUseCase
 */
public interface ReportingModule {
  /**
   * Produces the report.
   *
   * <p>The results map should be treated as read-only; modules may add keys for peers that run later.</p>
   *
   * @param context execution context including the per-analysis overrides
   * @throws ModuleDependencyException when an external dependency is missing
   * @throws ReportException when the report cannot be produced
   */
  void run(ExecutionContext context) throws ModuleException;
}
