package ca.gc.cra.kestrel.config;

/**
 * Version of the running analysis engine, compared against signature compatibility bounds.
 *
 * @since 0.1.0
 */
public final class KestrelVersion {
  /** Engine version; development builds carry a {@code -dev} suffix that comparisons strip. */
  public static final String CURRENT = "2.0.0-dev";

  private KestrelVersion() {}
}
