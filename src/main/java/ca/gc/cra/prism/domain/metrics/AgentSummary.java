package ca.gc.cra.prism.domain.metrics;

import java.util.Map;

/**
 * Per-agent counters plus the number of timers still open.
 *
 * @param agentId agent identifier
 * @param counters named counters such as {@code actions} and {@code errors}
 * @param activeOperations operations started but not yet ended
 * @since 0.1.0
 */
public record AgentSummary(String agentId, Map<String, Double> counters, int activeOperations) {
  public static final String ACTIONS = "actions";
  public static final String ERRORS = "errors";

  public AgentSummary {
    counters = counters == null ? Map.of() : Map.copyOf(counters);
  }

  public double counter(String name) {
    return counters.getOrDefault(name, 0d);
  }

  public double actionCount() {
    return counter(ACTIONS);
  }

  public double errorCount() {
    return counter(ERRORS);
  }
}
