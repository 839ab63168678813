/**
 * OpenTelemetry implementation of {@link ca.gc.cra.kestrel.application.port.MetricsPort}.
 *
 * <p>Set {@code OTEL_METRICS_EXPORTER=none} to run without an exporter.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.kestrel.infrastructure.metrics;
