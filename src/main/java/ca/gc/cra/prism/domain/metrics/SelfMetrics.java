package ca.gc.cra.prism.domain.metrics;

/**
 * Figures describing the observability layer itself.
 *
 * @param metricsCollected distinct series currently aggregated
 * @param tracesGenerated traces reported by the tracing backend
 * @param alertsTriggered alerts reported by the alerting backend
 * @param overheadMs mean bookkeeping cost per operation
 * @since 0.1.0
 */
public record SelfMetrics(long metricsCollected, long tracesGenerated, long alertsTriggered, double overheadMs) {}
