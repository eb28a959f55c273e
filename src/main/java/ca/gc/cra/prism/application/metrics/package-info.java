/**
 * Metric aggregation, per-entity collectors, and the event-driven metrics collector.
 * <p><strong>Role:</strong> Application layer; mirrors writes to {@code MetricsPort} and renders the Prometheus
 * text format.</p>
 * <p><strong>Concurrency:</strong> One lock per shared table; no lock is held while calling out to ports.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.metrics;
