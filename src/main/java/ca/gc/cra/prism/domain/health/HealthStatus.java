package ca.gc.cra.prism.domain.health;

import java.util.Locale;

/**
 * Health of a component or of the whole runtime.
 *
 * @since 0.1.0
 */
public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  UNHEALTHY,
  UNKNOWN;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
