/**
 * OpenTelemetry bridge for the metrics port.
 * <p><strong>Role:</strong> Infrastructure adapter; the only package that imports the OpenTelemetry SDK.</p>
 * <p><strong>Configuration:</strong> {@code otel.metrics.exporter} ({@code otlp} or {@code none}),
 * {@code otel.exporter.otlp.endpoint}, and {@code otel.resource.attributes}, read from system properties first and
 * the matching {@code OTEL_*} environment variables second.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.metrics;
