package ca.gc.cra.prism.domain.event;

import java.util.Locale;

/**
 * Outcome attached to an {@link ObservabilityEvent}.
 *
 * <p>Lifecycle values apply to agent, portal, extension, and memory events; health values apply to
 * health events. {@link #UNKNOWN} is used when a producer supplies nothing.</p>
 *
 * @since 0.1.0
 */
public enum EventStatus {
  STARTED,
  COMPLETED,
  FAILED,
  HEALTHY,
  DEGRADED,
  UNHEALTHY,
  UNKNOWN;

  /**
   * Parses a status name, tolerating case differences and blanks.
   *
   * @param value status text; may be {@code null}
   * @return matching status, or {@link #UNKNOWN} when blank or unrecognised
   */
  public static EventStatus parse(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return UNKNOWN;
    }
  }

  /**
   * Returns the lower-case label used in span tags.
   *
   * @return wire name such as {@code "failed"}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
