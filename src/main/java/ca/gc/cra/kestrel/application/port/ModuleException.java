package ca.gc.cra.kestrel.application.port;

/**
 * Checked failure declared by an analysis module.
 *
 * <p>Runners log declared failures at WARN and continue with the next module. Anything else a module
 * throws is treated as unexpected and logged at ERROR.</p>
 *
 * @since 0.1.0
 */
public class ModuleException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public ModuleException(String message) { super(message); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public ModuleException(String message, Throwable cause) { super(message, cause); }
}
