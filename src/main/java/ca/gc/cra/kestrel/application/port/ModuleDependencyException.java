package ca.gc.cra.kestrel.application.port;

/**
 * Signals that a module cannot run because an external dependency (library, tool, service) is missing.
 *
 * @since 0.1.0
 */
public final class ModuleDependencyException extends ModuleException {
  /**
   * Creates an exception naming the missing dependency.
   *
   * @param message human-readable error
   */
  public ModuleDependencyException(String message) { super(message); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause, typically a {@link LinkageError} or lookup failure
   */
  public ModuleDependencyException(String message, Throwable cause) { super(message, cause); }
}
