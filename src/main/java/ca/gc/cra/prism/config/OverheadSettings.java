package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;

/**
 * Overhead budget and throttling switch.
 *
 * @param maxOverheadMs p95 bookkeeping cost considered acceptable
 * @param throttlingEnabled whether excessive overhead lowers sampling and collection frequency
 * @since 0.1.0
 */
public record OverheadSettings(double maxOverheadMs, boolean throttlingEnabled) {
  public static final double DEFAULT_MAX_OVERHEAD_MS = 5.0d;

  public OverheadSettings {
    Numbers.requireRange("overhead.maxOverheadMs", maxOverheadMs, 0.001d, 60_000d);
  }

  public static OverheadSettings defaults() {
    return new OverheadSettings(DEFAULT_MAX_OVERHEAD_MS, true);
  }
}
