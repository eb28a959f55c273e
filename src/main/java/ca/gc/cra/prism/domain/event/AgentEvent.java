package ca.gc.cra.prism.domain.event;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Activity reported by an agent.
 *
 * @param agentId agent identifier
 * @param operation operation name; {@code "think"} durations are tracked separately from responses
 * @param durationMs elapsed milliseconds; may be {@code null}
 * @param status outcome; {@code null} becomes {@link EventStatus#UNKNOWN}
 * @param metadata producer context; may be {@code null}
 * @since 0.1.0
 */
public record AgentEvent(
    String agentId,
    String operation,
    Double durationMs,
    EventStatus status,
    Map<String, Object> metadata) implements ObservabilityEvent {

  public AgentEvent {
    agentId = Events.requireId(agentId, "agentId");
    operation = Events.requireId(operation, "operation");
    durationMs = Events.finiteOrNull(durationMs, "durationMs");
    status = Events.status(status);
    metadata = Events.metadata(metadata);
  }

  public static AgentEvent of(String agentId, String operation, EventStatus status) {
    return new AgentEvent(agentId, operation, null, status, Map.of());
  }

  public static AgentEvent timed(String agentId, String operation, double durationMs, EventStatus status) {
    return new AgentEvent(agentId, operation, durationMs, status, Map.of());
  }

  @Override
  public EventKind kind() {
    return EventKind.AGENT;
  }

  @Override
  public String entityId() {
    return agentId;
  }

  @Override
  public OptionalDouble duration() {
    return Events.optional(durationMs);
  }
}
