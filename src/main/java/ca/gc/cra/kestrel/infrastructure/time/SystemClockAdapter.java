package ca.gc.cra.kestrel.infrastructure.time;

import ca.gc.cra.kestrel.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Shared instance; the adapter is stateless. */
  public static final SystemClockAdapter INSTANCE = new SystemClockAdapter();

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
