package ca.gc.cra.kestrel.api;

/**
 * Process exit codes returned by the KESTREL commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments were missing or malformed. */
  INVALID_ARGS(2),
  /** A file could not be read. */
  IO_ERROR(3),
  /** Configuration or rule files were invalid. */
  CONFIG_ERROR(4),
  /** The analysis failed unexpectedly. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process exit status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
