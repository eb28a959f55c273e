package ca.gc.cra.prism.domain.metrics;

/**
 * Request, error, and token totals for one model behind a portal.
 *
 * @param requestCount requests issued
 * @param errorCount failed requests
 * @param tokenUsage tokens consumed
 * @since 0.1.0
 */
public record ModelUsage(long requestCount, long errorCount, long tokenUsage) {}
