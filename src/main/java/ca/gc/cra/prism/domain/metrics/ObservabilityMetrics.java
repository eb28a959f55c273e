package ca.gc.cra.prism.domain.metrics;

import ca.gc.cra.prism.domain.health.HealthSummary;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Consolidated read-only view of everything the observability layer knows.
 *
 * @param timestamp when the view was assembled
 * @param system process readings
 * @param agents per-agent summaries
 * @param portals per-portal summaries
 * @param extensions per-extension summaries
 * @param memory per-memory-provider summaries
 * @param health health summary from the registry
 * @param observability self figures
 * @since 0.1.0
 */
public record ObservabilityMetrics(
    Instant timestamp,
    SystemMetrics system,
    Map<String, AgentSummary> agents,
    Map<String, PortalSummary> portals,
    Map<String, EntitySummary> extensions,
    Map<String, EntitySummary> memory,
    HealthSummary health,
    SelfMetrics observability) {

  public ObservabilityMetrics {
    Objects.requireNonNull(timestamp, "timestamp");
    system = system == null ? SystemMetrics.empty() : system;
    agents = agents == null ? Map.of() : Map.copyOf(agents);
    portals = portals == null ? Map.of() : Map.copyOf(portals);
    extensions = extensions == null ? Map.of() : Map.copyOf(extensions);
    memory = memory == null ? Map.of() : Map.copyOf(memory);
    health = health == null ? HealthSummary.unknown() : health;
    Objects.requireNonNull(observability, "observability");
  }

  /**
   * Sums the error counters of every agent.
   *
   * @return total agent errors
   */
  public double totalAgentErrors() {
    double total = 0d;
    for (AgentSummary agent : agents.values()) {
      total += agent.errorCount();
    }
    return total;
  }

  /**
   * Returns a copy with the self figures replaced.
   *
   * @param figures new self figures
   * @return updated copy
   */
  public ObservabilityMetrics withObservability(SelfMetrics figures) {
    return new ObservabilityMetrics(timestamp, system, agents, portals, extensions, memory, health, figures);
  }
}
