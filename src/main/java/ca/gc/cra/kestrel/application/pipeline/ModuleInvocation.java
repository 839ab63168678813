package ca.gc.cra.kestrel.application.pipeline;

import ca.gc.cra.kestrel.application.port.context.ExecutionContext;

/**
 * Calls a module's entry point once its context is ready.
 *
 * @param <T> module contract
 * @param <R> produced value
 * @since 0.1.0
 */
@FunctionalInterface
public interface ModuleInvocation<T, R> {
  /**
   * Runs the module.
   *
   * @param module instantiated module
   * @param context execution context
   * @return produced value, possibly {@code null}
   * @throws Exception any module failure; classified by the runner
   */
  R invoke(T module, ExecutionContext context) throws Exception;
}
