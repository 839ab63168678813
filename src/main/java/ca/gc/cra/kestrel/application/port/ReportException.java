package ca.gc.cra.kestrel.application.port;

/**
 * Domain failure reported by a reporting module.
 *
 * @since 0.1.0
 */
public final class ReportException extends ModuleException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ReportException(String message) { super(message); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public ReportException(String message, Throwable cause) { super(message, cause); }
}
