package ca.gc.cra.prism.domain.metrics;

import java.util.Map;

/**
 * Aggregated figures for one portal.
 *
 * @param portalId portal identifier
 * @param requestCount requests issued
 * @param errorCount failed requests
 * @param averageLatencyMs mean request latency
 * @param tokenUsage tokens consumed across models
 * @param models per-model usage keyed by model name
 * @since 0.1.0
 */
public record PortalSummary(
    String portalId,
    long requestCount,
    long errorCount,
    double averageLatencyMs,
    long tokenUsage,
    Map<String, ModelUsage> models) {

  public PortalSummary {
    models = models == null ? Map.of() : Map.copyOf(models);
  }
}
