package ca.gc.cra.kestrel.infrastructure.metrics;

import ca.gc.cra.kestrel.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter forwarding module outcomes and signature counters to OpenTelemetry.
 *
 * <p>Instruments are created lazily per metric key; each carries the original key as the
 * {@code kestrel.metric.key} attribute.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("kestrel.metric.key");
  private static final String FALLBACK_METRIC_NAME = "kestrel.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured exporter ({@code OTEL_METRICS_EXPORTER}).
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::createHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Flushes pending metrics to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Shuts the meter provider down, flushing pending metrics. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter createCounter(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized counter name '{}' -> '{}'", key, name);
    }
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("KESTREL counter for " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Histogram createHistogram(String key) {
    String name = sanitizeName(key);
    if (!name.equals(key)) {
      log.debug("Sanitized histogram name '{}' -> '{}'", key, name);
    }
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription("KESTREL observation for " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
