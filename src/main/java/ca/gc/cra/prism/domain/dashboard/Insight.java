package ca.gc.cra.prism.domain.dashboard;

import java.util.Map;
import java.util.Objects;

/**
 * Fixed-threshold observation derived from current metrics.
 *
 * @param type insight category
 * @param severity urgency
 * @param message what was observed
 * @param recommendation suggested follow-up
 * @param data figures that crossed the threshold
 * @since 0.1.0
 */
public record Insight(
    InsightType type, InsightSeverity severity, String message, String recommendation, Map<String, Object> data) {

  public Insight {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(message, "message");
    recommendation = recommendation == null ? "" : recommendation;
    data = data == null ? Map.of() : Map.copyOf(data);
  }
}
