package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;

/**
 * Health and alerting knobs.
 *
 * @param enableHealthChecks whether alert evaluation runs and the overhead probe is registered
 * @param checkIntervalMs interval requested for the overhead probe
 * @since 0.1.0
 */
public record HealthSettings(boolean enableHealthChecks, long checkIntervalMs) {

  public HealthSettings {
    Numbers.requireRange("health.checkIntervalMs", checkIntervalMs, 1_000L, 3_600_000L);
  }

  public static HealthSettings defaults() {
    return new HealthSettings(true, 30_000L);
  }
}
