package ca.gc.cra.prism.domain.dashboard;

import ca.gc.cra.prism.domain.alert.ActiveAlert;
import ca.gc.cra.prism.domain.health.HealthSummary;
import ca.gc.cra.prism.domain.metrics.ObservabilityMetrics;
import java.util.List;
import java.util.Objects;

/**
 * Read-only bundle handed to dashboard renderers.
 *
 * @param metrics consolidated metrics
 * @param activeAlerts alerts currently firing
 * @param health health summary
 * @param insights fixed-threshold observations
 * @since 0.1.0
 */
public record DashboardData(
    ObservabilityMetrics metrics, List<ActiveAlert> activeAlerts, HealthSummary health, List<Insight> insights) {

  public DashboardData {
    Objects.requireNonNull(metrics, "metrics");
    activeAlerts = activeAlerts == null ? List.of() : List.copyOf(activeAlerts);
    health = health == null ? HealthSummary.unknown() : health;
    insights = insights == null ? List.of() : List.copyOf(insights);
  }
}
