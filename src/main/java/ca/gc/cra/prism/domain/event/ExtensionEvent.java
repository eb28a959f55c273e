package ca.gc.cra.prism.domain.event;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Message handled by an extension.
 *
 * @param extensionId extension identifier
 * @param operation operation name
 * @param durationMs handling latency; may be {@code null}
 * @param status outcome; {@code null} becomes {@link EventStatus#UNKNOWN}
 * @param metadata producer context; may be {@code null}
 * @since 0.1.0
 */
public record ExtensionEvent(
    String extensionId,
    String operation,
    Double durationMs,
    EventStatus status,
    Map<String, Object> metadata) implements ObservabilityEvent {

  public ExtensionEvent {
    extensionId = Events.requireId(extensionId, "extensionId");
    operation = Events.requireId(operation, "operation");
    durationMs = Events.finiteOrNull(durationMs, "durationMs");
    status = Events.status(status);
    metadata = Events.metadata(metadata);
  }

  public static ExtensionEvent timed(String extensionId, String operation, double durationMs, EventStatus status) {
    return new ExtensionEvent(extensionId, operation, durationMs, status, Map.of());
  }

  @Override
  public EventKind kind() {
    return EventKind.EXTENSION;
  }

  @Override
  public String entityId() {
    return extensionId;
  }

  @Override
  public OptionalDouble duration() {
    return Events.optional(durationMs);
  }
}
