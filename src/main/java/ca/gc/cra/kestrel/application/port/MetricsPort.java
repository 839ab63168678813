package ca.gc.cra.kestrel.application.port;

/**
 * <strong>What:</strong> Port abstracting KESTREL metrics emission.
 * <p><strong>Why:</strong> Lets the pipelines and the signature engine count module outcomes and matches
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like module failures or signature matches.</li>
 *   <li>Record numeric observations such as module latency.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate updates from parallel processing workers.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code processing.module.latencyNanos}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code signatures.matched}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   *
   * <p><strong>Observability:</strong> Drops all metrics; useful for tests.</p>
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
