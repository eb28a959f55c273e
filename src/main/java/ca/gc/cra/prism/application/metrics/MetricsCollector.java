package ca.gc.cra.prism.application.metrics;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.HealthRegistryPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.PerformanceSourcePort;
import ca.gc.cra.prism.config.MetricsSettings;
import ca.gc.cra.prism.domain.event.AgentEvent;
import ca.gc.cra.prism.domain.event.ExtensionEvent;
import ca.gc.cra.prism.domain.event.HealthEvent;
import ca.gc.cra.prism.domain.event.MemoryEvent;
import ca.gc.cra.prism.domain.event.ObservabilityEvent;
import ca.gc.cra.prism.domain.event.PortalEvent;
import ca.gc.cra.prism.domain.event.SystemEvent;
import ca.gc.cra.prism.domain.health.HealthSummary;
import ca.gc.cra.prism.domain.metrics.HistogramSnapshot;
import ca.gc.cra.prism.domain.metrics.MetricSeries;
import ca.gc.cra.prism.domain.metrics.MetricType;
import ca.gc.cra.prism.domain.metrics.MetricsSnapshot;
import ca.gc.cra.prism.domain.metrics.ObservabilityMetrics;
import ca.gc.cra.prism.domain.metrics.SelfMetrics;
import ca.gc.cra.prism.domain.metrics.SystemMetrics;
import ca.gc.cra.prism.domain.trace.TraceContext;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Turns domain events and periodic process readings into aggregated metrics and exports.
 * <p><strong>Why:</strong> Gives every subsystem one ingress ({@link #recordEvent(ObservabilityEvent)}) and one
 * egress ({@link #exportPrometheusMetrics()}, {@link #getMetrics()}) for numeric telemetry.</p>
 * <p><strong>Role:</strong> Application service owned by the observability orchestrator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pull system gauges from the {@link PerformanceSourcePort} on a fixed interval.</li>
 *   <li>Map each event kind to its counter/histogram/gauge combination.</li>
 *   <li>Mirror every write to the {@link MetricsPort}.</li>
 *   <li>Record the processing latency of every event into {@value MetricNames#OBSERVABILITY_OVERHEAD}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent event ingestion while the collector thread runs.</p>
 * <p><strong>Observability:</strong> Collection and handler failures are logged at ERROR and never thrown.</p>
 *
 * @since 0.1.0
 */
public final class MetricsCollector implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

  private final MetricAggregator aggregator = new MetricAggregator();
  private final AgentMetricsCollector agents;
  private final PortalMetricsCollector portals = new PortalMetricsCollector();
  private final EntityMetricsCollector extensions = new EntityMetricsCollector();
  private final EntityMetricsCollector memoryProviders = new EntityMetricsCollector();
  private final Map<String, DoubleSupplier> customGauges = new ConcurrentHashMap<>();
  private final PerformanceSourcePort performanceSource;
  private final HealthRegistryPort healthRegistry;
  private final MetricsPort metricsPort;
  private final ClockPort clock;
  private final Supplier<ScheduledExecutorService> schedulerFactory;
  private final Object scheduleLock = new Object();

  private volatile MetricsSettings settings;
  private volatile boolean enabled = true;
  private volatile SystemMetrics lastSystemMetrics = SystemMetrics.empty();
  private volatile boolean collectedSystemMetrics;
  private ScheduledExecutorService scheduler;
  private ScheduledFuture<?> collectionTask;

  /**
   * Creates a collector.
   *
   * @param settings initial collection settings
   * @param performanceSource process sampler
   * @param healthRegistry source of the health summary in {@link #getMetrics()}
   * @param metricsPort backend receiving mirrored writes
   * @param clock time source
   * @param schedulerFactory creates the single collector thread on {@link #startCollection()}
   */
  public MetricsCollector(
      MetricsSettings settings,
      PerformanceSourcePort performanceSource,
      HealthRegistryPort healthRegistry,
      MetricsPort metricsPort,
      ClockPort clock,
      Supplier<ScheduledExecutorService> schedulerFactory) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.performanceSource = Objects.requireNonNull(performanceSource, "performanceSource");
    this.healthRegistry = Objects.requireNonNull(healthRegistry, "healthRegistry");
    this.metricsPort = Objects.requireNonNull(metricsPort, "metricsPort");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.schedulerFactory = Objects.requireNonNull(schedulerFactory, "schedulerFactory");
    this.agents = new AgentMetricsCollector(clock);
  }

  /**
   * Starts the scheduled pull; calling it while already collecting has no effect.
   */
  public void startCollection() {
    synchronized (scheduleLock) {
      if (collectionTask != null) {
        return;
      }
      if (scheduler == null) {
        scheduler = schedulerFactory.get();
      }
      scheduleLocked(settings.collectionIntervalMs());
    }
  }

  /**
   * Stops the scheduled pull and releases the collector thread; idempotent.
   */
  public void stopCollection() {
    ScheduledExecutorService toShutdown;
    synchronized (scheduleLock) {
      if (collectionTask != null) {
        collectionTask.cancel(false);
        collectionTask = null;
        log.info("Metrics collection stopped");
      }
      toShutdown = scheduler;
      scheduler = null;
    }
    if (toShutdown != null) {
      toShutdown.shutdownNow();
    }
  }

  public boolean isCollecting() {
    synchronized (scheduleLock) {
      return collectionTask != null;
    }
  }

  /**
   * Replaces the collection settings, rescheduling the pull when the interval changed.
   *
   * @param next new settings
   */
  public void updateConfig(MetricsSettings next) {
    Objects.requireNonNull(next, "next");
    MetricsSettings previous = settings;
    settings = next;
    synchronized (scheduleLock) {
      if (collectionTask != null && previous.collectionIntervalMs() != next.collectionIntervalMs()) {
        collectionTask.cancel(false);
        scheduleLocked(next.collectionIntervalMs());
      }
    }
  }

  public MetricsSettings getConfig() {
    return settings;
  }

  /**
   * Enables or disables event ingestion; the scheduled pull is controlled separately.
   *
   * @param value new state
   */
  public void setEnabled(boolean value) {
    this.enabled = value;
  }

  /**
   * Registers a gauge sampled on every collection while custom metrics are enabled.
   *
   * @param name gauge name
   * @param supplier value source; a throwing supplier is logged and skipped
   */
  public void registerGauge(String name, DoubleSupplier supplier) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(supplier, "supplier");
    customGauges.put(name, supplier);
  }

  /**
   * Runs one collection pass on the calling thread.
   */
  public void collectNow() {
    long started = clock.nanoTime();
    try {
      SystemMetrics system = performanceSource.getSystemMetrics();
      lastSystemMetrics = system;
      collectedSystemMetrics = true;
      gauge(MetricNames.SYSTEM_MEMORY_USAGE, system.memory().usedBytes(), Map.of());
      gauge(MetricNames.SYSTEM_CPU_USAGE, system.cpuUsagePercent(), Map.of());
      gauge(MetricNames.SYSTEM_UPTIME, system.uptimeSeconds(), Map.of());
      gauge(MetricNames.SYSTEM_EVENT_LOOP_LAG, system.eventLoopDelayMs(), Map.of());
      if (settings.enableCustomMetrics()) {
        system.customMetrics().forEach((name, value) -> gauge(name, value, Map.of()));
        customGauges.forEach(this::sampleCustomGauge);
      }
    } catch (RuntimeException ex) {
      log.error("Metrics collection failed", ex);
    } finally {
      histogram(MetricNames.COLLECTION_DURATION, elapsedMs(started), Map.of());
    }
  }

  /**
   * Maps an event to metric writes.
   *
   * @param event event to record; ignored while ingestion is disabled
   */
  public void recordEvent(ObservabilityEvent event) {
    Objects.requireNonNull(event, "event");
    if (!enabled) {
      return;
    }
    long started = clock.nanoTime();
    try {
      Runnable handler = switch (event.kind()) {
        case AGENT -> () -> handleAgent((AgentEvent) event);
        case PORTAL -> () -> handlePortal((PortalEvent) event);
        case EXTENSION -> () -> handleExtension((ExtensionEvent) event);
        case MEMORY -> () -> handleMemory((MemoryEvent) event);
        case HEALTH -> () -> handleHealth((HealthEvent) event);
        case SYSTEM -> () -> handleSystem((SystemEvent) event);
      };
      handler.run();
    } catch (RuntimeException ex) {
      log.error("Failed to record {} event {} for {}", event.kind().wireName(), event.operation(), event.entityId(), ex);
    } finally {
      try {
        histogram(MetricNames.OBSERVABILITY_OVERHEAD, elapsedMs(started), Map.of("event_type", event.kind().wireName()));
      } catch (RuntimeException ex) {
        log.error("Failed to record event processing overhead", ex);
      }
    }
  }

  /**
   * Records a metric labelled with the short trace id and operation of {@code context}.
   *
   * @param context trace the value belongs to
   * @param name metric name
   * @param value value to record
   * @param type metric shape
   */
  public void recordMetricFromTrace(TraceContext context, String name, double value, MetricType type) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(type, "type");
    Map<String, String> labels = Map.of("trace_id", context.shortTraceId(), "operation", context.operationName());
    record(type, name, value, labels);
  }

  /**
   * Records a value of the given shape; failures are logged.
   *
   * @param type metric shape
   * @param name metric name
   * @param value value to record
   * @param labels series labels
   */
  public void record(MetricType type, String name, double value, Map<String, String> labels) {
    try {
      switch (type) {
        case COUNTER -> counter(name, value, labels);
        case GAUGE -> gauge(name, value, labels);
        case HISTOGRAM -> histogram(name, value, labels);
        default -> throw new IllegalStateException("Unhandled metric type " + type);
      }
    } catch (RuntimeException ex) {
      log.error("Failed to record {} {}", type.expositionName(), name, ex);
    }
  }

  /**
   * Records {@code <name>_duration} and {@code <name>_total} for a timed operation.
   *
   * @param name base name
   * @param durationMs elapsed milliseconds
   * @param labels series labels
   */
  public void recordTiming(String name, double durationMs, Map<String, String> labels) {
    try {
      histogram(name + "_duration", durationMs, labels);
      counter(name + "_total", 1d, labels);
    } catch (RuntimeException ex) {
      log.error("Failed to record timing {}", name, ex);
    }
  }

  /**
   * Renders all series in the Prometheus text format.
   *
   * @return exposition text
   */
  public String exportPrometheusMetrics() {
    return PrometheusFormatter.format(aggregator.getMetrics());
  }

  public MetricsSnapshot getSnapshot() {
    return aggregator.getMetrics();
  }

  /**
   * Assembles the consolidated view; trace and alert figures are left at zero for the caller to fill.
   * <p>System readings come from the last collection pass so reads never move the sampler's GC baseline; the
   * sampler is read directly only until the first pass has run.</p>
   *
   * @return consolidated metrics
   */
  public ObservabilityMetrics getMetrics() {
    MetricsSnapshot snapshot = aggregator.getMetrics();
    SelfMetrics self = new SelfMetrics(snapshot.seriesCount(), 0L, 0L, averageOverheadMs(snapshot));
    return new ObservabilityMetrics(
        clock.now(),
        collectedSystemMetrics ? lastSystemMetrics : readSystemMetrics(),
        agents.getAllAgentMetrics(),
        portals.getAllPortalMetrics(),
        extensions.getAll(),
        memoryProviders.getAll(),
        readHealth(),
        self);
  }

  public AgentMetricsCollector agents() {
    return agents;
  }

  public PortalMetricsCollector portals() {
    return portals;
  }

  /** Clears every series and entity figure. */
  public void resetMetrics() {
    aggregator.reset();
    agents.reset(null);
    portals.reset(null);
    extensions.reset(null);
    memoryProviders.reset(null);
    log.info("Metrics reset");
  }

  /** Pushes mirrored writes to the metrics backend. */
  public void flush() {
    try {
      metricsPort.flush();
    } catch (RuntimeException ex) {
      log.error("Metrics backend flush failed", ex);
    }
  }

  @Override
  public void close() {
    stopCollection();
  }

  private void handleAgent(AgentEvent event) {
    Map<String, String> labels = labels("agent_id", event.agentId(), "operation", event.operation());
    counter(MetricNames.AGENT_ACTIONS, 1d, labels);
    agents.recordCounter(event.agentId(), "actions");
    if (event.failed()) {
      counter(MetricNames.AGENT_ERRORS, 1d, labels);
      agents.recordCounter(event.agentId(), "errors");
    }
    event.duration().ifPresent(duration -> histogram(
        "think".equals(event.operation()) ? MetricNames.AGENT_THINK_TIME : MetricNames.AGENT_RESPONSE_TIME,
        duration,
        labels));
  }

  private void handlePortal(PortalEvent event) {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put("portal_id", event.portalId());
    if (event.model() != null) {
      labels.put("model", event.model());
    }
    counter(MetricNames.PORTAL_REQUESTS, 1d, labels);
    boolean error = event.isError();
    if (error) {
      counter(MetricNames.PORTAL_ERRORS, 1d, labels);
    }
    event.duration().ifPresent(duration -> histogram(MetricNames.PORTAL_REQUEST_DURATION, duration, labels));
    event.tokens().ifPresent(tokens -> counter(MetricNames.PORTAL_TOKENS, tokens, labels));
    portals.recordRequest(
        event.portalId(),
        event.model(),
        event.duration().orElse(0d),
        event.tokens().orElse(0L),
        error);
  }

  private void handleExtension(ExtensionEvent event) {
    Map<String, String> labels = labels("extension_id", event.extensionId(), "operation", event.operation());
    counter(MetricNames.EXTENSION_MESSAGES, 1d, labels);
    if (event.failed()) {
      counter(MetricNames.EXTENSION_ERRORS, 1d, labels);
    }
    event.duration().ifPresent(duration -> histogram(MetricNames.EXTENSION_LATENCY, duration, labels));
    extensions.recordOperation(event.extensionId(), event.duration(), event.failed());
  }

  private void handleMemory(MemoryEvent event) {
    Map<String, String> labels = labels("provider_id", event.providerId(), "operation", event.operation());
    counter(MetricNames.MEMORY_OPERATIONS, 1d, labels);
    if (event.failed()) {
      counter(MetricNames.MEMORY_ERRORS, 1d, labels);
    }
    event.duration().ifPresent(duration -> histogram(MetricNames.MEMORY_OPERATION_DURATION, duration, labels));
    event.records().ifPresent(records -> counter(MetricNames.MEMORY_RECORDS, records, labels));
    memoryProviders.recordOperation(event.providerId(), event.duration(), event.failed());
  }

  private void handleHealth(HealthEvent event) {
    Map<String, String> labels = labels("component_id", event.componentId(), "operation", event.operation());
    counter(MetricNames.HEALTH_CHECKS, 1d, labels);
    event.duration().ifPresent(duration -> histogram(MetricNames.HEALTH_CHECK_DURATION, duration, labels));
    gauge(MetricNames.HEALTH_STATUS, event.healthy() ? 1d : 0d, Map.of("component_id", event.componentId()));
  }

  private void handleSystem(SystemEvent event) {
    event.duration().ifPresent(value -> gauge(
        MetricNames.SYSTEM_PREFIX + event.operation(), value, Map.of("operation", event.operation())));
  }

  private void sampleCustomGauge(String name, DoubleSupplier supplier) {
    try {
      gauge(name, supplier.getAsDouble(), Map.of());
    } catch (RuntimeException ex) {
      log.warn("Custom gauge {} failed", name, ex);
    }
  }

  private void counter(String name, double delta, Map<String, String> labels) {
    aggregator.recordCounter(name, delta, labels);
    metricsPort.increment(name, delta, labels);
  }

  private void gauge(String name, double value, Map<String, String> labels) {
    aggregator.recordGauge(name, value, labels);
    metricsPort.gauge(name, value, labels);
  }

  private void histogram(String name, double value, Map<String, String> labels) {
    aggregator.recordHistogram(name, value, labels);
    metricsPort.observe(name, value, labels);
  }

  private SystemMetrics readSystemMetrics() {
    try {
      SystemMetrics system = performanceSource.getSystemMetrics();
      lastSystemMetrics = system;
      return system;
    } catch (RuntimeException ex) {
      log.error("Performance source failed; reporting last known readings", ex);
      return lastSystemMetrics;
    }
  }

  private HealthSummary readHealth() {
    try {
      return healthRegistry.getHealthSummary();
    } catch (RuntimeException ex) {
      log.error("Health registry failed; reporting unknown health", ex);
      return HealthSummary.unknown();
    }
  }

  private void scheduleLocked(long intervalMs) {
    collectionTask = scheduler.scheduleAtFixedRate(
        this::collectNow, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    log.info("Metrics collection scheduled every {} ms", intervalMs);
  }

  private double elapsedMs(long startedNanos) {
    return Math.max(0L, clock.nanoTime() - startedNanos) / 1_000_000d;
  }

  private static double averageOverheadMs(MetricsSnapshot snapshot) {
    double sum = 0d;
    long count = 0L;
    for (Map.Entry<MetricSeries, HistogramSnapshot> entry : snapshot.histograms().entrySet()) {
      if (entry.getKey().name().equals(MetricNames.OBSERVABILITY_OVERHEAD)) {
        sum += entry.getValue().sum();
        count += entry.getValue().count();
      }
    }
    return count == 0 ? 0d : sum / count;
  }

  private static Map<String, String> labels(String idKey, String id, String opKey, String operation) {
    Map<String, String> labels = new LinkedHashMap<>();
    labels.put(idKey, id);
    labels.put(opKey, operation);
    return labels;
  }
}
