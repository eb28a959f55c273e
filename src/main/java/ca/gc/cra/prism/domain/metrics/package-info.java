/**
 * Metric identity, snapshot, and summary values.
 * <p><strong>Role:</strong> Domain layer shared by the aggregator, collectors, exporters, and dashboards.</p>
 * <p><strong>Concurrency:</strong> Every type is an immutable copy; snapshots never expose live aggregator
 * state.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.domain.metrics;
