package ca.gc.cra.prism.domain.event;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Operation executed by a memory provider.
 *
 * @param providerId provider identifier
 * @param operation operation name
 * @param durationMs operation latency; may be {@code null}
 * @param recordCount records touched; may be {@code null}
 * @param status outcome; {@code null} becomes {@link EventStatus#UNKNOWN}
 * @param metadata producer context; may be {@code null}
 * @since 0.1.0
 */
public record MemoryEvent(
    String providerId,
    String operation,
    Double durationMs,
    Long recordCount,
    EventStatus status,
    Map<String, Object> metadata) implements ObservabilityEvent {

  public MemoryEvent {
    providerId = Events.requireId(providerId, "providerId");
    operation = Events.requireId(operation, "operation");
    durationMs = Events.finiteOrNull(durationMs, "durationMs");
    if (recordCount != null && recordCount < 0) {
      throw new IllegalArgumentException("recordCount must be >= 0");
    }
    status = Events.status(status);
    metadata = Events.metadata(metadata);
  }

  public static MemoryEvent timed(String providerId, String operation, double durationMs, EventStatus status) {
    return new MemoryEvent(providerId, operation, durationMs, null, status, Map.of());
  }

  @Override
  public EventKind kind() {
    return EventKind.MEMORY;
  }

  @Override
  public String entityId() {
    return providerId;
  }

  @Override
  public OptionalDouble duration() {
    return Events.optional(durationMs);
  }

  public OptionalLong records() {
    return recordCount == null ? OptionalLong.empty() : OptionalLong.of(recordCount);
  }
}
