package ca.gc.cra.prism.domain.health;

import java.util.Objects;

/**
 * Latest known health of one component.
 *
 * @param componentId component identifier
 * @param status latest verdict
 * @param responseTimeMs latency of the latest probe
 * @param uptimeSeconds component uptime reported by the registry
 * @since 0.1.0
 */
public record ComponentHealth(String componentId, HealthStatus status, double responseTimeMs, double uptimeSeconds) {

  public ComponentHealth {
    Objects.requireNonNull(componentId, "componentId");
    status = status == null ? HealthStatus.UNKNOWN : status;
  }
}
