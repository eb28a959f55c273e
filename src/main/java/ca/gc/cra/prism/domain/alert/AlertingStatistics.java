package ca.gc.cra.prism.domain.alert;

/**
 * Counters reported by the alerting backend.
 *
 * @param totalRules rules loaded
 * @param activeAlerts alerts currently firing
 * @param triggeredTotal alerts fired since start
 * @param resolvedTotal alerts resolved since start
 * @since 0.1.0
 */
public record AlertingStatistics(int totalRules, int activeAlerts, long triggeredTotal, long resolvedTotal) {
  private static final AlertingStatistics EMPTY = new AlertingStatistics(0, 0, 0L, 0L);

  public static AlertingStatistics empty() {
    return EMPTY;
  }
}
