package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;

/**
 * Metric collection knobs.
 *
 * @param enableCollection whether the scheduled pull runs
 * @param collectionIntervalMs pull period in milliseconds
 * @param enableCustomMetrics whether source supplied and registered custom gauges are read
 * @since 0.1.0
 */
public record MetricsSettings(boolean enableCollection, long collectionIntervalMs, boolean enableCustomMetrics) {
  public static final long MIN_INTERVAL_MS = 100L;
  /** Upper bound for the pull period; self-throttling never exceeds it. */
  public static final long MAX_INTERVAL_MS = 30_000L;

  public MetricsSettings {
    Numbers.requireRange("metrics.collectionIntervalMs", collectionIntervalMs, MIN_INTERVAL_MS, MAX_INTERVAL_MS);
  }

  public static MetricsSettings defaults() {
    return new MetricsSettings(true, 5_000L, true);
  }

  public MetricsSettings withCollectionIntervalMs(long intervalMs) {
    return new MetricsSettings(enableCollection, intervalMs, enableCustomMetrics);
  }
}
