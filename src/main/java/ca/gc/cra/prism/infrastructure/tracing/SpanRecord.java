package ca.gc.cra.prism.infrastructure.tracing;

import ca.gc.cra.prism.domain.trace.SpanStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Finished span retained by {@link InMemoryTracingSystem}.
 *
 * @param traceId trace id
 * @param spanId span id
 * @param parentSpanId parent span id; {@code null} for roots
 * @param operationName span name
 * @param startTime start instant
 * @param durationMs elapsed milliseconds
 * @param status final status
 * @param tags tags added while the span was active
 * @param events timestamped events added while the span was active
 * @since 0.1.0
 */
public record SpanRecord(
    String traceId,
    String spanId,
    String parentSpanId,
    String operationName,
    Instant startTime,
    double durationMs,
    SpanStatus status,
    Map<String, Object> tags,
    List<SpanEvent> events) {

  public SpanRecord {
    Objects.requireNonNull(traceId, "traceId");
    Objects.requireNonNull(spanId, "spanId");
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(startTime, "startTime");
    status = status == null ? SpanStatus.ok() : status;
    tags = tags == null ? Map.of() : Map.copyOf(tags);
    events = events == null ? List.of() : List.copyOf(events);
  }

  public boolean isRoot() {
    return parentSpanId == null;
  }

  /**
   * Timestamped annotation on a span.
   *
   * @param name event name
   * @param timestamp when the event was added
   * @param attributes event attributes
   */
  public record SpanEvent(String name, Instant timestamp, Map<String, Object> attributes) {
    public SpanEvent {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(timestamp, "timestamp");
      attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
  }
}
