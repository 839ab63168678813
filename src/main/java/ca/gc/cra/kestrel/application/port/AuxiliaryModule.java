package ca.gc.cra.kestrel.application.port;

import ca.gc.cra.kestrel.application.port.context.ExecutionContext;

/**
 * Plugin running alongside the sandboxed execution (traffic capture, screenshots, human simulation).
 *
 * <p>Started before the guest executes the sample and stopped afterwards; it does not contribute to the
 * results map.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.kestrel.application.pipeline.AuxiliaryUseCase
 */
public interface AuxiliaryModule {
  /**
   * Starts the module.
   *
   * @param context execution context; {@code results} is empty at this stage
   * @param machine label of the analysis machine
   * @throws ModuleException when the module cannot start
   */
  void start(ExecutionContext context, String machine) throws ModuleException;

  /**
   * Stops the module. Defaults to a no-op.
   *
   * @throws ModuleException when the module cannot stop cleanly
   */
  default void stop() throws ModuleException {}
}
