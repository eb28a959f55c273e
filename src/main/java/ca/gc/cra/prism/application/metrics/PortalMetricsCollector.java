package ca.gc.cra.prism.application.metrics;

import ca.gc.cra.prism.domain.metrics.ModelUsage;
import ca.gc.cra.prism.domain.metrics.PortalSummary;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-portal request figures, broken down by model for billing and latency analysis.
 *
 * @since 0.1.0
 */
public final class PortalMetricsCollector {
  private final Object lock = new Object();
  private final Map<String, PortalStats> portals = new HashMap<>();

  /**
   * Records one portal request.
   *
   * @param portalId portal identifier
   * @param model model name; may be {@code null}
   * @param latencyMs request latency
   * @param tokens tokens consumed
   * @param error whether the request failed
   */
  public void recordRequest(String portalId, String model, double latencyMs, long tokens, boolean error) {
    Objects.requireNonNull(portalId, "portalId");
    synchronized (lock) {
      PortalStats stats = portals.computeIfAbsent(portalId, ignored -> new PortalStats());
      stats.requests++;
      stats.totalLatencyMs += latencyMs;
      stats.tokens += tokens;
      if (error) {
        stats.errors++;
      }
      if (model != null && !model.isBlank()) {
        ModelStats modelStats = stats.models.computeIfAbsent(model, ignored -> new ModelStats());
        modelStats.requests++;
        modelStats.tokens += tokens;
        if (error) {
          modelStats.errors++;
        }
      }
    }
  }

  public Optional<PortalSummary> getPortalMetrics(String portalId) {
    synchronized (lock) {
      PortalStats stats = portals.get(portalId);
      return stats == null ? Optional.empty() : Optional.of(stats.summary(portalId));
    }
  }

  public Map<String, PortalSummary> getAllPortalMetrics() {
    Map<String, PortalSummary> all = new HashMap<>();
    synchronized (lock) {
      portals.forEach((portalId, stats) -> all.put(portalId, stats.summary(portalId)));
    }
    return Map.copyOf(all);
  }

  /**
   * Clears one portal, or every portal when {@code portalId} is {@code null}.
   *
   * @param portalId portal to clear; may be {@code null}
   */
  public void reset(String portalId) {
    synchronized (lock) {
      if (portalId == null) {
        portals.clear();
      } else {
        portals.remove(portalId);
      }
    }
  }

  private static final class PortalStats {
    private final Map<String, ModelStats> models = new HashMap<>();
    private long requests;
    private long errors;
    private double totalLatencyMs;
    private long tokens;

    PortalSummary summary(String portalId) {
      Map<String, ModelUsage> usage = new HashMap<>();
      models.forEach((model, stats) -> usage.put(model, new ModelUsage(stats.requests, stats.errors, stats.tokens)));
      double average = requests == 0 ? 0d : totalLatencyMs / requests;
      return new PortalSummary(portalId, requests, errors, average, tokens, usage);
    }
  }

  private static final class ModelStats {
    private long requests;
    private long errors;
    private long tokens;
  }
}
