package ca.gc.cra.prism.domain.event;

import java.util.Locale;

/**
 * Closed set of event kinds accepted by the observability ingress.
 *
 * @since 0.1.0
 */
public enum EventKind {
  AGENT,
  PORTAL,
  EXTENSION,
  MEMORY,
  HEALTH,
  SYSTEM;

  /**
   * Returns the lower-case label used in span names and metric labels.
   *
   * @return wire name such as {@code "agent"}
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
