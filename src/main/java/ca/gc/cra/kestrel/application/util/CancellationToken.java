package ca.gc.cra.kestrel.application.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a running analysis.
 *
 * <p>Runners poll the token between modules and the signature engine polls it between calls; a
 * module already executing is never interrupted.</p>
 *
 * @since 0.2.0
 */
public final class CancellationToken {
  /** Token that is never cancelled. */
  public static final CancellationToken NONE = new CancellationToken(false);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final boolean cancellable;

  /**
   * Creates a token that has not been cancelled yet.
   */
  public CancellationToken() {
    this(true);
  }

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * Requests cancellation. Idempotent.
   *
   * @throws UnsupportedOperationException when invoked on {@link #NONE}
   */
  public void cancel() {
    if (!cancellable) {
      throw new UnsupportedOperationException("NONE token cannot be cancelled");
    }
    cancelled.set(true);
  }

  /**
   * Indicates whether cancellation was requested.
   *
   * @return {@code true} once {@link #cancel()} has been called
   */
  public boolean isCancelled() {
    return cancelled.get();
  }
}
