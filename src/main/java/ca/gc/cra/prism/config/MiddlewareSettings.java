package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Switches and thresholds for the built-in middlewares.
 *
 * @param performanceEnabled register the slow-operation middleware
 * @param slowOperationMs duration above which an operation is logged as slow
 * @param memoryWarningMb heap growth above which an operation is logged
 * @param securityEnabled register the security audit middleware
 * @param rateLimitEnabled register the rate-limit warning middleware
 * @param requestsPerMinute per-operation budget checked by the rate-limit middleware
 * @param loggingEnabled register the debug logging middleware
 * @since 0.1.0
 */
public record MiddlewareSettings(
    boolean performanceEnabled,
    long slowOperationMs,
    long memoryWarningMb,
    boolean securityEnabled,
    boolean rateLimitEnabled,
    int requestsPerMinute,
    boolean loggingEnabled) {

  public MiddlewareSettings {
    Numbers.requireRange("middleware.performance.slowOperationMs", slowOperationMs, 1L, 3_600_000L);
    Numbers.requireRange("middleware.performance.memoryWarningMb", memoryWarningMb, 1L, 1_048_576L);
    Numbers.requireRange("middleware.rateLimit.requestsPerMinute", requestsPerMinute, 1, 1_000_000);
  }

  public static MiddlewareSettings defaults() {
    return new MiddlewareSettings(true, 1_000L, 50L, true, false, 100, false);
  }

  /**
   * Returns the enabled flag of every built-in middleware keyed by its registered name.
   *
   * @return insertion-ordered flags
   */
  public Map<String, Boolean> enabledByName() {
    Map<String, Boolean> flags = new LinkedHashMap<>();
    flags.put("performance-monitor", performanceEnabled);
    flags.put("security-monitor", securityEnabled);
    flags.put("rate-limit-monitor", rateLimitEnabled);
    flags.put("logging-monitor", loggingEnabled);
    return flags;
  }
}
