package ca.gc.cra.prism.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and programmatic overrides with precedence overrides &gt; YAML &gt;
 * defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param yaml optional YAML-derived settings for the active environment
   * @param overrides programmatic key/value overrides; may be {@code null}
   * @param defaults embedded defaults for the environment
   * @param warn consumer invoked when an override replaces a YAML key; may be {@code null}
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged values are invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> overrideCopy = overrides == null ? Map.of() : overrides;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : overrideCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("Override replaces YAML value for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    ObservabilityConfig.fromMap(effective);
    String exporter = effective.getOrDefault("metricsExporter", "").trim();
    if (!exporter.isEmpty() && !exporter.equalsIgnoreCase("otlp") && !exporter.equalsIgnoreCase("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
  }
}
