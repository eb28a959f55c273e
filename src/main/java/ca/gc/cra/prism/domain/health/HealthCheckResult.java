package ca.gc.cra.prism.domain.health;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one probe run.
 *
 * @param status probe verdict
 * @param message human-readable summary
 * @param details structured figures behind the verdict
 * @param timestamp when the probe ran
 * @since 0.1.0
 */
public record HealthCheckResult(HealthStatus status, String message, Map<String, Object> details, Instant timestamp) {

  public HealthCheckResult {
    Objects.requireNonNull(status, "status");
    message = message == null ? "" : message;
    details = details == null ? Map.of() : Map.copyOf(details);
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
