package ca.gc.cra.prism.domain.event;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Result of a health check against one component.
 *
 * @param componentId component identifier
 * @param operation check name
 * @param responseTimeMs check latency; may be {@code null}
 * @param status health outcome; {@code null} becomes {@link EventStatus#UNKNOWN}
 * @param metadata producer context; may be {@code null}
 * @since 0.1.0
 */
public record HealthEvent(
    String componentId,
    String operation,
    Double responseTimeMs,
    EventStatus status,
    Map<String, Object> metadata) implements ObservabilityEvent {

  public HealthEvent {
    componentId = Events.requireId(componentId, "componentId");
    operation = Events.requireId(operation, "operation");
    responseTimeMs = Events.finiteOrNull(responseTimeMs, "responseTimeMs");
    status = Events.status(status);
    metadata = Events.metadata(metadata);
  }

  public static HealthEvent check(String componentId, double responseTimeMs, EventStatus status) {
    return new HealthEvent(componentId, "check", responseTimeMs, status, Map.of());
  }

  @Override
  public EventKind kind() {
    return EventKind.HEALTH;
  }

  @Override
  public String entityId() {
    return componentId;
  }

  @Override
  public OptionalDouble duration() {
    return Events.optional(responseTimeMs);
  }

  public boolean healthy() {
    return status() == EventStatus.HEALTHY;
  }
}
