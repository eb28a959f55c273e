package ca.gc.cra.prism.domain.event;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Call made through a portal to an external model provider.
 *
 * @param portalId portal identifier
 * @param operation operation name; {@code "error"} counts as a failure
 * @param model model name; may be {@code null}
 * @param durationMs request latency; may be {@code null}
 * @param tokensUsed tokens consumed; may be {@code null}
 * @param status outcome; {@code null} becomes {@link EventStatus#UNKNOWN}
 * @param metadata producer context; may be {@code null}
 * @since 0.1.0
 */
public record PortalEvent(
    String portalId,
    String operation,
    String model,
    Double durationMs,
    Long tokensUsed,
    EventStatus status,
    Map<String, Object> metadata) implements ObservabilityEvent {

  /** Operation name producers use to report a failed call. */
  public static final String ERROR_OPERATION = "error";

  public PortalEvent {
    portalId = Events.requireId(portalId, "portalId");
    operation = Events.requireId(operation, "operation");
    if (model != null && model.isBlank()) {
      model = null;
    }
    durationMs = Events.finiteOrNull(durationMs, "durationMs");
    if (tokensUsed != null && tokensUsed < 0) {
      throw new IllegalArgumentException("tokensUsed must be >= 0");
    }
    status = Events.status(status);
    metadata = Events.metadata(metadata);
  }

  public static PortalEvent request(
      String portalId, String model, double durationMs, long tokensUsed, EventStatus status) {
    return new PortalEvent(portalId, "request", model, durationMs, tokensUsed, status, Map.of());
  }

  @Override
  public EventKind kind() {
    return EventKind.PORTAL;
  }

  @Override
  public String entityId() {
    return portalId;
  }

  @Override
  public OptionalDouble duration() {
    return Events.optional(durationMs);
  }

  public OptionalLong tokens() {
    return tokensUsed == null ? OptionalLong.empty() : OptionalLong.of(tokensUsed);
  }

  /**
   * Indicates whether the call should be counted as an error.
   *
   * @return {@code true} for failed status or the {@code error} operation
   */
  public boolean isError() {
    return failed() || ERROR_OPERATION.equals(operation);
  }
}
