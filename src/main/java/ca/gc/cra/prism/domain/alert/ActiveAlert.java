package ca.gc.cra.prism.domain.alert;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Alert currently firing in the alerting backend.
 *
 * @param id alert instance id
 * @param ruleName rule that fired
 * @param severity alert severity
 * @param message human-readable description
 * @param triggeredAt when the alert fired
 * @param labels labels copied from the offending series
 * @since 0.1.0
 */
public record ActiveAlert(
    String id,
    String ruleName,
    AlertSeverity severity,
    String message,
    Instant triggeredAt,
    Map<String, String> labels) {

  public ActiveAlert {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(ruleName, "ruleName");
    severity = severity == null ? AlertSeverity.WARNING : severity;
    message = message == null ? "" : message;
    Objects.requireNonNull(triggeredAt, "triggeredAt");
    labels = labels == null ? Map.of() : Map.copyOf(labels);
  }
}
