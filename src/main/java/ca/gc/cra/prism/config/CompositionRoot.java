package ca.gc.cra.prism.config;

import ca.gc.cra.prism.application.metrics.MetricsCollector;
import ca.gc.cra.prism.application.middleware.Middleware;
import ca.gc.cra.prism.application.middleware.MiddlewareManager;
import ca.gc.cra.prism.application.middleware.Middlewares;
import ca.gc.cra.prism.application.orchestration.ObservabilityManager;
import ca.gc.cra.prism.application.overhead.OverheadTracker;
import ca.gc.cra.prism.application.port.AlertingPort;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.HealthRegistryPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.PerformanceSourcePort;
import ca.gc.cra.prism.infrastructure.config.ConfigFileWatcher;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.prism.infrastructure.export.JsonMetricsExporter;
import ca.gc.cra.prism.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.prism.infrastructure.performance.JvmPerformanceSource;
import ca.gc.cra.prism.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.prism.infrastructure.tracing.InMemoryTracingSystem;
import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that wires the observability manager to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate merged configuration into a running instance; there
 * is no global singleton, so hosts and tests each own their root.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the environment and merge defaults, YAML, and overrides.</li>
 *   <li>Apply telemetry system properties before the OpenTelemetry adapter bootstraps.</li>
 *   <li>Build the tracer, collector, overhead tracker, middlewares, and manager.</li>
 *   <li>Optionally watch the YAML file and hot-reload it into the manager.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct on one thread during startup; accessors are safe afterwards.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  /** System property selecting the environment. */
  public static final String ENVIRONMENT_PROPERTY = "prism.environment";
  /** Environment variable selecting the environment when the property is absent. */
  public static final String ENVIRONMENT_VARIABLE = "PRISM_ENV";
  /** System property naming the YAML configuration file. */
  public static final String CONFIG_FILE_PROPERTY = "prism.config";

  private final String environment;
  private final Map<String, String> settings;
  private final ObservabilityConfig config;
  private final ClockPort clock;
  private final MetricsPort metricsPort;
  private final InMemoryTracingSystem tracing;
  private final ObservabilityManager manager;
  private final ConfigFileWatcher watcher;

  /**
   * Wires a root from already merged settings.
   *
   * @param environment active environment name
   * @param settings merged flat settings
   * @param configFile YAML file to watch when {@code watchConfig=true}; may be {@code null}
   * @param overrides overrides re-applied on every hot reload; may be {@code null}
   * @param metricsPort metrics backend
   * @param clock time source
   * @param performanceSource process sampler
   * @param alerting alerting backend
   * @param healthRegistry health registry
   */
  public CompositionRoot(
      String environment,
      Map<String, String> settings,
      Path configFile,
      Map<String, String> overrides,
      MetricsPort metricsPort,
      ClockPort clock,
      PerformanceSourcePort performanceSource,
      AlertingPort alerting,
      HealthRegistryPort healthRegistry) {
    this.environment = Objects.requireNonNull(environment, "environment");
    this.settings = Map.copyOf(Objects.requireNonNull(settings, "settings"));
    this.metricsPort = Objects.requireNonNull(metricsPort, "metricsPort");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.config = ObservabilityConfig.fromMap(this.settings);

    this.tracing = new InMemoryTracingSystem(config.tracing(), clock);
    MetricsCollector collector = new MetricsCollector(
        config.metrics(),
        performanceSource,
        healthRegistry,
        metricsPort,
        clock,
        () -> ExecutorFactories.newSingleThreadScheduler(ExecutorFactories.METRICS_COLLECTOR_THREAD));
    MiddlewareManager middlewares = new MiddlewareManager();
    for (Middleware middleware : Middlewares.builtIns(config.middleware(), clock)) {
      middlewares.register(middleware);
    }
    this.manager = new ObservabilityManager(
        config,
        tracing,
        alerting,
        healthRegistry,
        collector,
        new OverheadTracker(config.overhead().maxOverheadMs()),
        middlewares,
        new JsonMetricsExporter(),
        clock);

    boolean watch = Boolean.parseBoolean(this.settings.getOrDefault("watchConfig", "false").trim());
    if (watch && configFile != null) {
      Map<String, String> reloadOverrides = overrides == null ? Map.of() : Map.copyOf(overrides);
      this.watcher = new ConfigFileWatcher(
          configFile, () -> loadConfig(environment, configFile, reloadOverrides), manager, clock);
    } else {
      this.watcher = null;
    }
    log.info("PRISM wired for environment {} (config file: {})", environment, configFile == null ? "none" : configFile);
  }

  /**
   * Builds a root from system properties and environment variables.
   *
   * @return wired root, not yet started
   * @throws IOException if the configured YAML file cannot be read
   */
  public static CompositionRoot fromEnvironment() throws IOException {
    String file = System.getProperty(CONFIG_FILE_PROPERTY);
    Path configFile = file == null || file.isBlank() ? null : Path.of(file.trim());
    return load(resolveEnvironment(), configFile, Map.of());
  }

  /**
   * Merges defaults, YAML, and overrides and wires production adapters.
   *
   * @param environment {@code development}, {@code production}, or {@code test}
   * @param configFile YAML file; may be {@code null} or missing
   * @param overrides highest-precedence settings; may be {@code null}
   * @return wired root, not yet started
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the merged configuration is invalid
   */
  public static CompositionRoot load(String environment, Path configFile, Map<String, String> overrides)
      throws IOException {
    Map<String, String> effective = mergeSettings(environment, configFile, overrides);
    TelemetryConfigurator.configureMetrics(effective);
    if (Boolean.parseBoolean(effective.getOrDefault("verbose", "false").trim())) {
      LoggingConfigurator.enableVerboseLogging();
    }
    return new CompositionRoot(
        environment,
        effective,
        configFile,
        overrides,
        new OpenTelemetryMetricsAdapter(),
        new SystemClockAdapter(),
        new JvmPerformanceSource(),
        AlertingPort.NO_OP,
        HealthRegistryPort.NO_OP);
  }

  /**
   * Merges the settings of one environment.
   *
   * @param environment environment name
   * @param configFile YAML file; may be {@code null} or missing
   * @param overrides highest-precedence settings; may be {@code null}
   * @return immutable merged settings
   * @throws IOException if the YAML file cannot be read
   */
  public static Map<String, String> mergeSettings(String environment, Path configFile, Map<String, String> overrides)
      throws IOException {
    Map<String, String> defaults = DefaultsForEnvironment.asFlatMap(environment);
    Optional<Map<String, String>> yaml =
        configFile == null ? Optional.empty() : YamlConfigLoader.load(configFile, environment);
    return ConfigMerger.buildEffectiveConfig(yaml, overrides, defaults, log::warn);
  }

  /**
   * Returns the environment named by {@value #ENVIRONMENT_PROPERTY} or {@value #ENVIRONMENT_VARIABLE}.
   *
   * @return normalized environment; {@code development} when neither is set
   */
  public static String resolveEnvironment() {
    String value = System.getProperty(ENVIRONMENT_PROPERTY);
    if (value == null || value.isBlank()) {
      value = System.getenv(ENVIRONMENT_VARIABLE);
    }
    if (value == null || value.isBlank()) {
      return DefaultsForEnvironment.DEVELOPMENT;
    }
    return value.trim().toLowerCase(Locale.ROOT);
  }

  /** Starts the manager and, when configured, the configuration watcher. */
  public void start() {
    manager.start();
    if (watcher != null) {
      watcher.start();
    }
  }

  public ObservabilityManager manager() {
    return manager;
  }

  public InMemoryTracingSystem tracing() {
    return tracing;
  }

  public ObservabilityConfig config() {
    return config;
  }

  public Map<String, String> settings() {
    return settings;
  }

  public String environment() {
    return environment;
  }

  public Optional<ConfigFileWatcher> watcher() {
    return Optional.ofNullable(watcher);
  }

  @Override
  public void close() {
    if (watcher != null) {
      watcher.close();
    }
    manager.close();
    if (metricsPort instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics backend", ex);
      }
    }
  }

  private static ObservabilityConfig loadConfig(String environment, Path configFile, Map<String, String> overrides)
      throws IOException {
    return ObservabilityConfig.fromMap(mergeSettings(environment, configFile, overrides));
  }
}
