package ca.gc.cra.prism.domain.health;

import java.util.Map;

/**
 * Overall verdict plus per-component health.
 *
 * @param overall runtime-wide verdict
 * @param components health keyed by component id
 * @since 0.1.0
 */
public record HealthSummary(HealthStatus overall, Map<String, ComponentHealth> components) {
  private static final HealthSummary UNKNOWN = new HealthSummary(HealthStatus.UNKNOWN, Map.of());

  public HealthSummary {
    overall = overall == null ? HealthStatus.UNKNOWN : overall;
    components = components == null ? Map.of() : Map.copyOf(components);
  }

  public static HealthSummary unknown() {
    return UNKNOWN;
  }
}
