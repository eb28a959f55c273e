package ca.gc.cra.prism.domain.metrics;

/**
 * Operation totals for an extension or memory provider.
 *
 * @param entityId entity identifier
 * @param operationCount operations observed
 * @param errorCount failed operations
 * @param averageLatencyMs mean latency of operations that reported a duration
 * @since 0.1.0
 */
public record EntitySummary(String entityId, long operationCount, long errorCount, double averageLatencyMs) {
}
