package ca.gc.cra.prism.domain.dashboard;

/**
 * Category of a dashboard insight.
 *
 * @since 0.1.0
 */
public enum InsightType {
  RESOURCE,
  ERROR,
  TREND,
  PERFORMANCE
}
