package ca.gc.cra.kestrel.application.pipeline;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of running one module through the {@link ModuleRunner}.
 *
 * @param module canonical short name of the module
 * @param outcome execution classification
 * @param value value returned by the module; {@code null} unless {@link ModuleOutcome#SUCCEEDED}
 * @param <R> value type
 * @since 0.1.0
 */
public record ModuleExecution<R>(String module, ModuleOutcome outcome, R value) {

  /**
   * Validates members.
   */
  public ModuleExecution {
    Objects.requireNonNull(module, "module");
    Objects.requireNonNull(outcome, "outcome");
    if (outcome != ModuleOutcome.SUCCEEDED && value != null) {
      throw new IllegalArgumentException("only successful executions carry a value");
    }
  }

  static <R> ModuleExecution<R> of(String module, ModuleOutcome outcome) {
    return new ModuleExecution<>(module, outcome, null);
  }

  /**
   * Indicates whether the module ran successfully.
   *
   * @return {@code true} for {@link ModuleOutcome#SUCCEEDED}
   */
  public boolean succeeded() {
    return outcome == ModuleOutcome.SUCCEEDED;
  }

  /**
   * Returns the produced value.
   *
   * @return value when the module succeeded and returned one
   */
  public Optional<R> result() {
    return Optional.ofNullable(value);
  }
}
