package ca.gc.cra.prism.domain.health;

import java.util.Objects;

/**
 * Registration details for a health probe.
 *
 * @param id unique probe id
 * @param name display name
 * @param type probe category, for example {@code "performance"}
 * @param intervalMs how often the registry should run the probe
 * @param timeoutMs how long the registry should wait for a result
 * @param critical whether failure of this probe makes the runtime unhealthy
 * @since 0.1.0
 */
public record HealthCheckDescriptor(
    String id, String name, String type, long intervalMs, long timeoutMs, boolean critical) {

  public HealthCheckDescriptor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (intervalMs <= 0 || timeoutMs <= 0) {
      throw new IllegalArgumentException("intervalMs and timeoutMs must be > 0");
    }
  }
}
