package ca.gc.cra.prism.domain.event;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> Sole ingress shape for domain activity reported to the observability layer.
 * <p><strong>Why:</strong> The variant set is fixed, so each kind is a record and consumers dispatch with an
 * exhaustive {@code switch} over {@link #kind()} instead of overriding behaviour per subtype.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface ObservabilityEvent
    permits AgentEvent, PortalEvent, ExtensionEvent, MemoryEvent, HealthEvent, SystemEvent {

  /**
   * Returns the discriminator used for dispatch.
   *
   * @return event kind; never {@code null}
   */
  EventKind kind();

  /**
   * Returns the id of the entity that produced the event.
   *
   * @return entity id; never {@code null}
   */
  String entityId();

  /**
   * Returns the operation name.
   *
   * @return operation; never {@code null}
   */
  String operation();

  /**
   * Returns the outcome.
   *
   * @return status; never {@code null}
   */
  EventStatus status();

  /**
   * Returns the measured duration or value carried by the event.
   *
   * @return duration in milliseconds (value for system events) when present
   */
  OptionalDouble duration();

  /**
   * Returns producer supplied context.
   *
   * @return immutable metadata; never {@code null}
   */
  Map<String, Object> metadata();

  /**
   * Indicates whether the event reports a failure.
   *
   * @return {@code true} when {@link #status()} is {@link EventStatus#FAILED}
   */
  default boolean failed() {
    return status() == EventStatus.FAILED;
  }
}
