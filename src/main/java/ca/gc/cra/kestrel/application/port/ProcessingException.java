package ca.gc.cra.kestrel.application.port;

/**
 * Domain failure reported by a processing module; the module contributes no results.
 *
 * @since 0.1.0
 */
public final class ProcessingException extends ModuleException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ProcessingException(String message) { super(message); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public ProcessingException(String message, Throwable cause) { super(message, cause); }
}
