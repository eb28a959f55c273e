package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Effective configuration of the observability layer.
 * <p><strong>Why:</strong> Gives the orchestrator one validated value to hold; hot reload replaces the whole value
 * instead of mutating fields.</p>
 * <p><strong>Role:</strong> Built by {@link CompositionRoot} from defaults, YAML, and overrides via
 * {@link #fromMap(Map)}; updated through {@link #apply(ConfigUpdate)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param enabled master switch; when {@code false} events and traces are ignored
 * @param tracing tracing settings
 * @param metrics metric collection settings
 * @param health health and alerting settings
 * @param overhead overhead budget settings
 * @param middleware built-in middleware settings
 * @since 0.1.0
 */
public record ObservabilityConfig(
    boolean enabled,
    TracingSettings tracing,
    MetricsSettings metrics,
    HealthSettings health,
    OverheadSettings overhead,
    MiddlewareSettings middleware) {

  public ObservabilityConfig {
    Objects.requireNonNull(tracing, "tracing");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(health, "health");
    Objects.requireNonNull(overhead, "overhead");
    Objects.requireNonNull(middleware, "middleware");
  }

  /**
   * Returns the embedded defaults.
   *
   * @return default configuration
   */
  public static ObservabilityConfig defaults() {
    return new ObservabilityConfig(
        true,
        TracingSettings.defaults(),
        MetricsSettings.defaults(),
        HealthSettings.defaults(),
        OverheadSettings.defaults(),
        MiddlewareSettings.defaults());
  }

  /**
   * Builds a configuration from flattened dotted keys; absent keys keep their defaults.
   *
   * @param args flat key/value map, for example {@code tracing.sampleRate=0.5}; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static ObservabilityConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    ObservabilityConfig defaults = defaults();

    TracingSettings tracing = new TracingSettings(
        parseBoolean(kv.get("tracing.enableTracing"), defaults.tracing().enableTracing()),
        parseFraction(kv, "tracing.sampleRate", defaults.tracing().sampleRate()),
        parseBoundedInt(kv, "tracing.maxSpans", defaults.tracing().maxSpans(),
            TracingSettings.MIN_MAX_SPANS, TracingSettings.MAX_MAX_SPANS));

    MetricsSettings metrics = new MetricsSettings(
        parseBoolean(kv.get("metrics.enableCollection"), defaults.metrics().enableCollection()),
        parseBoundedLong(kv, "metrics.collectionIntervalMs", defaults.metrics().collectionIntervalMs(),
            MetricsSettings.MIN_INTERVAL_MS, MetricsSettings.MAX_INTERVAL_MS),
        parseBoolean(kv.get("metrics.enableCustomMetrics"), defaults.metrics().enableCustomMetrics()));

    HealthSettings health = new HealthSettings(
        parseBoolean(kv.get("health.enableHealthChecks"), defaults.health().enableHealthChecks()),
        parseBoundedLong(kv, "health.checkIntervalMs", defaults.health().checkIntervalMs(), 1_000L, 3_600_000L));

    OverheadSettings overhead = new OverheadSettings(
        parseDouble(kv, "overhead.maxOverheadMs", defaults.overhead().maxOverheadMs()),
        parseBoolean(kv.get("overhead.throttlingEnabled"), defaults.overhead().throttlingEnabled()));

    MiddlewareSettings mw = defaults.middleware();
    MiddlewareSettings middleware = new MiddlewareSettings(
        parseBoolean(kv.get("middleware.performance.enabled"), mw.performanceEnabled()),
        parseBoundedLong(kv, "middleware.performance.slowOperationMs", mw.slowOperationMs(), 1L, 3_600_000L),
        parseBoundedLong(kv, "middleware.performance.memoryWarningMb", mw.memoryWarningMb(), 1L, 1_048_576L),
        parseBoolean(kv.get("middleware.security.enabled"), mw.securityEnabled()),
        parseBoolean(kv.get("middleware.rateLimit.enabled"), mw.rateLimitEnabled()),
        parseBoundedInt(kv, "middleware.rateLimit.requestsPerMinute", mw.requestsPerMinute(), 1, 1_000_000),
        parseBoolean(kv.get("middleware.logging.enabled"), mw.loggingEnabled()));

    return new ObservabilityConfig(
        parseBoolean(kv.get("enabled"), defaults.enabled()), tracing, metrics, health, overhead, middleware);
  }

  /**
   * Flattens this configuration back into dotted keys understood by {@link #fromMap(Map)}.
   *
   * @return insertion-ordered map
   */
  public Map<String, String> toFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("enabled", Boolean.toString(enabled));
    map.put("tracing.enableTracing", Boolean.toString(tracing.enableTracing()));
    map.put("tracing.sampleRate", Double.toString(tracing.sampleRate()));
    map.put("tracing.maxSpans", Integer.toString(tracing.maxSpans()));
    map.put("metrics.enableCollection", Boolean.toString(metrics.enableCollection()));
    map.put("metrics.collectionIntervalMs", Long.toString(metrics.collectionIntervalMs()));
    map.put("metrics.enableCustomMetrics", Boolean.toString(metrics.enableCustomMetrics()));
    map.put("health.enableHealthChecks", Boolean.toString(health.enableHealthChecks()));
    map.put("health.checkIntervalMs", Long.toString(health.checkIntervalMs()));
    map.put("overhead.maxOverheadMs", Double.toString(overhead.maxOverheadMs()));
    map.put("overhead.throttlingEnabled", Boolean.toString(overhead.throttlingEnabled()));
    map.put("middleware.performance.enabled", Boolean.toString(middleware.performanceEnabled()));
    map.put("middleware.performance.slowOperationMs", Long.toString(middleware.slowOperationMs()));
    map.put("middleware.performance.memoryWarningMb", Long.toString(middleware.memoryWarningMb()));
    map.put("middleware.security.enabled", Boolean.toString(middleware.securityEnabled()));
    map.put("middleware.rateLimit.enabled", Boolean.toString(middleware.rateLimitEnabled()));
    map.put("middleware.rateLimit.requestsPerMinute", Integer.toString(middleware.requestsPerMinute()));
    map.put("middleware.logging.enabled", Boolean.toString(middleware.loggingEnabled()));
    return map;
  }

  /**
   * Returns a copy with the hot-reloadable fields of {@code update} applied.
   *
   * @param update partial update; absent fields keep their current value
   * @return validated configuration
   * @throws IllegalArgumentException when an updated value is out of range
   */
  public ObservabilityConfig apply(ConfigUpdate update) {
    Objects.requireNonNull(update, "update");
    TracingSettings nextTracing = new TracingSettings(
        tracing.enableTracing(), update.sampleRate().orElse(tracing.sampleRate()), tracing.maxSpans());
    MetricsSettings nextMetrics = new MetricsSettings(
        update.enableCollection().orElse(metrics.enableCollection()),
        update.collectionIntervalMs().orElse(metrics.collectionIntervalMs()),
        metrics.enableCustomMetrics());
    HealthSettings nextHealth = new HealthSettings(
        update.enableHealthChecks().orElse(health.enableHealthChecks()), health.checkIntervalMs());
    return new ObservabilityConfig(
        update.enabled().orElse(enabled), nextTracing, nextMetrics, nextHealth, overhead, middleware);
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    return (int) parseBoundedLong(kv, key, defaultValue, min, max);
  }

  private static long parseBoundedLong(
      Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static double parseFraction(Map<String, String> kv, String key, double defaultValue) {
    return Numbers.requireFraction(key, parseDouble(kv, key, defaultValue));
  }

  private static double parseDouble(Map<String, String> kv, String key, double defaultValue) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number", ex);
    }
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
