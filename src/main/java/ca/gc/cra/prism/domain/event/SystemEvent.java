package ca.gc.cra.prism.domain.event;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Process-level measurement; the value becomes gauge {@code system_<operation>}.
 *
 * @param source component reporting the value; blank or {@code null} becomes {@code "system"}
 * @param operation measurement name
 * @param value measured value; may be {@code null}
 * @param status outcome; {@code null} becomes {@link EventStatus#UNKNOWN}
 * @param metadata producer context; may be {@code null}
 * @since 0.1.0
 */
public record SystemEvent(
    String source,
    String operation,
    Double value,
    EventStatus status,
    Map<String, Object> metadata) implements ObservabilityEvent {

  /** Source used when none is supplied. */
  public static final String DEFAULT_SOURCE = "system";

  public SystemEvent {
    source = source == null || source.isBlank() ? DEFAULT_SOURCE : source;
    operation = Events.requireId(operation, "operation");
    value = Events.finiteOrNull(value, "value");
    status = Events.status(status);
    metadata = Events.metadata(metadata);
  }

  public static SystemEvent value(String operation, double value) {
    return new SystemEvent(DEFAULT_SOURCE, operation, value, EventStatus.COMPLETED, Map.of());
  }

  @Override
  public EventKind kind() {
    return EventKind.SYSTEM;
  }

  @Override
  public String entityId() {
    return source;
  }

  @Override
  public OptionalDouble duration() {
    return Events.optional(value);
  }
}
