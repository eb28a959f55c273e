package ca.gc.cra.prism.domain.alert;

/**
 * Severity assigned to an alert by the rule engine.
 *
 * @since 0.1.0
 */
public enum AlertSeverity {
  INFO,
  WARNING,
  ERROR,
  CRITICAL
}
