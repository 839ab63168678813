package ca.gc.cra.kestrel.application.port;

import ca.gc.cra.kestrel.application.port.context.ExecutionContext;

/**
 * <strong>What:</strong> Processing plugin that derives one section of the analysis results.
 * <p><strong>Why:</strong> Each module turns raw analysis artefacts into structured data that later modules,
 * signatures and reports consume.</p>
 * <p><strong>Role:</strong> Plugin contract of the {@code processing} group.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Name the results key its output is stored under.</li>
 *   <li>Produce that output from the execution context, reading earlier modules' results when needed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> A fresh instance is created per run; instances need not be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.kestrel.application.pipeline.ProcessingUseCase
 */
public interface ProcessingModule {
  /**
   * Returns the results key this module writes.
   *
   * @return results key; output is discarded when {@code null} or blank
   */
  String key();

  /**
   * Runs the module.
   *
   * @param context execution context; never {@code null}
   * @return module output; discarded when {@code null} or empty
   * @throws ModuleDependencyException when an external dependency is missing
   * @throws ProcessingException when the module cannot produce its output
   */
  Object run(ExecutionContext context) throws ModuleException;
}
