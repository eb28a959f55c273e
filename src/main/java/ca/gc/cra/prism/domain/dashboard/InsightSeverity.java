package ca.gc.cra.prism.domain.dashboard;

/**
 * Urgency of a dashboard insight.
 *
 * @since 0.1.0
 */
public enum InsightSeverity {
  INFO,
  WARNING,
  ERROR
}
