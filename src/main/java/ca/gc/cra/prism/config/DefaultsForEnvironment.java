package ca.gc.cra.prism.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each deployment environment.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForEnvironment {
  public static final String DEVELOPMENT = "development";
  public static final String PRODUCTION = "production";
  public static final String TEST = "test";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForEnvironment() {}

  /**
   * Returns the defaults for {@code environment} merged over the common defaults.
   *
   * @param environment {@code development}, {@code production}, or {@code test}
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the environment is unknown
   */
  public static Map<String, String> asFlatMap(String environment) {
    Objects.requireNonNull(environment, "environment");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (environment.trim().toLowerCase(Locale.ROOT)) {
      case DEVELOPMENT -> buildDevelopmentDefaults();
      case PRODUCTION -> buildProductionDefaults();
      case TEST -> buildTestDefaults();
      default -> throw new IllegalArgumentException("Unsupported environment: " + environment);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>(ObservabilityConfig.defaults().toFlatMap());
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("watchConfig", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildDevelopmentDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("middleware.logging.enabled", "true");
    map.put("watchConfig", "true");
    return map;
  }

  private static Map<String, String> buildProductionDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("tracing.sampleRate", "0.1");
    map.put("metrics.collectionIntervalMs", "15000");
    map.put("middleware.rateLimit.enabled", "true");
    return map;
  }

  private static Map<String, String> buildTestDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("metrics.enableCollection", "false");
    map.put("health.enableHealthChecks", "false");
    return map;
  }
}
