package ca.gc.cra.kestrel.application.pipeline;

/**
 * Classification of one module execution.
 *
 * @since 0.1.0
 */
public enum ModuleOutcome {
  /** Module ran and returned normally. */
  SUCCEEDED,
  /** No configuration section exists for the module. */
  SKIPPED_UNCONFIGURED,
  /** The configuration section disables the module. */
  SKIPPED_DISABLED,
  /** The module could not be instantiated. */
  LOAD_FAILED,
  /** The module reported an unmet external dependency. */
  DEPENDENCY_MISSING,
  /** The module reported its own declared failure. */
  FAILED,
  /** The module failed in an undeclared way. */
  UNEXPECTED_FAILURE,
  /** The run was cancelled before the module started. */
  CANCELLED;

  /**
   * Indicates whether the module was never executed because of configuration.
   *
   * @return {@code true} for the skip outcomes
   */
  public boolean skipped() {
    return this == SKIPPED_UNCONFIGURED || this == SKIPPED_DISABLED;
  }

  /**
   * Indicates whether the module failed.
   *
   * @return {@code true} for load, dependency, declared and unexpected failures
   */
  public boolean failed() {
    return this == LOAD_FAILED || this == DEPENDENCY_MISSING || this == FAILED || this == UNEXPECTED_FAILURE;
  }
}
