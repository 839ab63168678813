package ca.gc.cra.kestrel.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to analysis modules.
 * <p><strong>Why:</strong> Keeps bundled modules deterministic under test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.kestrel.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
