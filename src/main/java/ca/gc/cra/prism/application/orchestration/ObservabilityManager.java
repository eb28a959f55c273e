package ca.gc.cra.prism.application.orchestration;

import ca.gc.cra.prism.application.metrics.MetricsCollector;
import ca.gc.cra.prism.application.middleware.Middleware;
import ca.gc.cra.prism.application.middleware.MiddlewareManager;
import ca.gc.cra.prism.application.overhead.OverheadTracker;
import ca.gc.cra.prism.application.port.AlertListener;
import ca.gc.cra.prism.application.port.AlertingPort;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.HealthRegistryPort;
import ca.gc.cra.prism.application.port.MetricsSerializerPort;
import ca.gc.cra.prism.application.port.ObservabilityListener;
import ca.gc.cra.prism.application.port.TracingPort;
import ca.gc.cra.prism.application.trace.TraceContexts;
import ca.gc.cra.prism.config.ConfigUpdate;
import ca.gc.cra.prism.config.MetricsSettings;
import ca.gc.cra.prism.config.ObservabilityConfig;
import ca.gc.cra.prism.domain.alert.ActiveAlert;
import ca.gc.cra.prism.domain.dashboard.DashboardData;
import ca.gc.cra.prism.domain.dashboard.Insight;
import ca.gc.cra.prism.domain.dashboard.InsightSeverity;
import ca.gc.cra.prism.domain.dashboard.InsightType;
import ca.gc.cra.prism.domain.event.EventStatus;
import ca.gc.cra.prism.domain.event.ObservabilityEvent;
import ca.gc.cra.prism.domain.event.SystemEvent;
import ca.gc.cra.prism.domain.health.HealthCheckDescriptor;
import ca.gc.cra.prism.domain.health.HealthCheckResult;
import ca.gc.cra.prism.domain.health.HealthStatus;
import ca.gc.cra.prism.domain.health.HealthSummary;
import ca.gc.cra.prism.domain.metrics.MetricType;
import ca.gc.cra.prism.domain.metrics.ObservabilityMetrics;
import ca.gc.cra.prism.domain.metrics.OverheadStatistics;
import ca.gc.cra.prism.domain.metrics.SelfMetrics;
import ca.gc.cra.prism.domain.trace.SpanStatus;
import ca.gc.cra.prism.domain.trace.TraceContext;
import ca.gc.cra.prism.logging.TraceLogScope;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Orchestrates tracing, metrics, alerting, health, overhead tracking, and middleware for a
 * host runtime.
 * <p><strong>Why:</strong> Gives producers two ingress points ({@link #recordEvent(ObservabilityEvent)} and
 * {@link #traceOperation(String, TracedOperation, TraceContext, Map)}) while keeping the observability layer's own
 * cost measured and bounded.</p>
 * <p><strong>Role:</strong> Application service created once by the composition root; not a singleton.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the {@code STOPPED <-> RUNNING} lifecycle of collection and alert evaluation.</li>
 *   <li>Annotate events with spans and forward them to the {@link MetricsCollector}.</li>
 *   <li>Wrap caller work with spans and middleware hooks, propagating failures unchanged.</li>
 *   <li>Throttle sampling and collection when its own overhead exceeds the budget.</li>
 *   <li>Derive dashboard insights and exports from the combined subsystem state.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe. Lifecycle and configuration changes are serialized on one lock;
 * wrapped work, hooks, and listeners never run while that lock is held.</p>
 * <p><strong>Observability:</strong> Internal failures are logged at ERROR and swallowed; lifecycle transitions are
 * logged at INFO and overhead conditions at WARN.</p>
 *
 * @since 0.1.0
 */
public final class ObservabilityManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ObservabilityManager.class);

  /** Id of the self-registered overhead health probe. */
  public static final String OVERHEAD_PROBE_ID = "observability_overhead";

  static final double THROTTLE_FACTOR = 3d;
  static final double MIN_SAMPLE_RATE = 0.01d;
  static final double MEMORY_INSIGHT_THRESHOLD = 0.8d;
  static final double AGENT_ERROR_INSIGHT_THRESHOLD = 10d;
  static final int ALERT_INSIGHT_THRESHOLD = 5;
  /** Minimum spacing between two overhead reactions (warning or throttling). */
  static final long OVERHEAD_REACTION_COOLDOWN_MS = 10_000L;

  private static final long PROBE_TIMEOUT_MS = 5_000L;

  private final TracingPort tracing;
  private final AlertingPort alerting;
  private final HealthRegistryPort healthRegistry;
  private final MetricsCollector metricsCollector;
  private final OverheadTracker overheadTracker;
  private final MiddlewareManager middlewareManager;
  private final MetricsSerializerPort serializer;
  private final ClockPort clock;
  private final List<ObservabilityListener> listeners = new CopyOnWriteArrayList<>();
  private final AlertListener alertForwarder = new AlertForwarder();
  private final Object lifecycleLock = new Object();

  private volatile ObservabilityConfig config;
  private volatile ManagerState state = ManagerState.STOPPED;
  private volatile long startedAtMillis;
  private final AtomicLong lastOverheadReactionMillis = new AtomicLong(Long.MIN_VALUE);
  private boolean evaluating;
  private boolean probeRegistered;

  /**
   * Creates a manager in the {@link ManagerState#STOPPED} state and pushes the initial configuration to the
   * subsystems.
   *
   * @param config initial configuration
   * @param tracing tracing backend
   * @param alerting alerting backend
   * @param healthRegistry health registry receiving the overhead probe
   * @param metricsCollector metrics pipeline
   * @param overheadTracker window of the layer's own per-operation cost
   * @param middlewareManager hook registry
   * @param serializer JSON renderer used by {@link #exportMetrics(ExportFormat)}
   * @param clock time source
   */
  public ObservabilityManager(
      ObservabilityConfig config,
      TracingPort tracing,
      AlertingPort alerting,
      HealthRegistryPort healthRegistry,
      MetricsCollector metricsCollector,
      OverheadTracker overheadTracker,
      MiddlewareManager middlewareManager,
      MetricsSerializerPort serializer,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.tracing = Objects.requireNonNull(tracing, "tracing");
    this.alerting = Objects.requireNonNull(alerting, "alerting");
    this.healthRegistry = Objects.requireNonNull(healthRegistry, "healthRegistry");
    this.metricsCollector = Objects.requireNonNull(metricsCollector, "metricsCollector");
    this.overheadTracker = Objects.requireNonNull(overheadTracker, "overheadTracker");
    this.middlewareManager = Objects.requireNonNull(middlewareManager, "middlewareManager");
    this.serializer = Objects.requireNonNull(serializer, "serializer");
    this.clock = Objects.requireNonNull(clock, "clock");
    pushSettings(config);
  }

  /**
   * Starts metric collection and alert evaluation as configured. Calling it while running has no effect; a disabled
   * configuration leaves the manager stopped.
   */
  public void start() {
    ObservabilityConfig current;
    synchronized (lifecycleLock) {
      if (state == ManagerState.RUNNING) {
        return;
      }
      current = config;
      if (!current.enabled()) {
        log.warn("Observability is disabled; start request ignored");
        return;
      }
      startedAtMillis = clock.nowMillis();
      state = ManagerState.RUNNING;
      if (current.health().enableHealthChecks()) {
        registerOverheadProbeLocked();
      }
      reconcileLocked(current);
      try {
        alerting.addListener(alertForwarder);
      } catch (RuntimeException ex) {
        log.error("Failed to subscribe to alert notifications", ex);
      }
    }
    log.info(
        "Observability started (tracing={}, metrics={}, healthChecks={}, sampleRate={})",
        current.tracing().enableTracing(),
        current.metrics().enableCollection(),
        current.health().enableHealthChecks(),
        current.tracing().sampleRate());
    notifyListeners(ObservabilityListener::started);
  }

  /**
   * Flushes pending data, then stops collection and evaluation. Calling it while stopped has no effect.
   */
  public void stop() {
    long uptimeMs;
    synchronized (lifecycleLock) {
      if (state == ManagerState.STOPPED) {
        return;
      }
      flush();
      state = ManagerState.STOPPED;
      reconcileLocked(config);
      try {
        alerting.removeListener(alertForwarder);
      } catch (RuntimeException ex) {
        log.error("Failed to unsubscribe from alert notifications", ex);
      }
      uptimeMs = Math.max(0L, clock.nowMillis() - startedAtMillis);
    }
    OverheadStatistics overhead = overheadTracker.getStatistics();
    log.info(
        "Observability stopped after {} ms (overhead avg={} ms, p95={} ms, operations={})",
        uptimeMs,
        format(overhead.averageMs()),
        format(overhead.p95Ms()),
        overhead.totalOperations());
    notifyListeners(ObservabilityListener::stopped);
  }

  @Override
  public void close() {
    stop();
    metricsCollector.close();
  }

  public ManagerState getState() {
    return state;
  }

  public boolean isRunning() {
    return state == ManagerState.RUNNING;
  }

  public ObservabilityConfig getConfig() {
    return config;
  }

  /**
   * Records a domain event: annotates it with a span, forwards it to the metrics pipeline, and notifies listeners.
   * Failures are logged; the event's processing cost is always recorded as overhead.
   *
   * @param event event to record
   * @return context of the annotation span, empty when disabled or not sampled
   */
  public Optional<TraceContext> recordEvent(ObservabilityEvent event) {
    Objects.requireNonNull(event, "event");
    if (!config.enabled()) {
      return Optional.empty();
    }
    long started = clock.nanoTime();
    Optional<TraceContext> span = Optional.empty();
    try {
      span = annotate(event);
      metricsCollector.recordEvent(event);
    } catch (RuntimeException ex) {
      log.error("Failed to record {} event {} for {}", event.kind().wireName(), event.operation(), event.entityId(), ex);
    } finally {
      recordOverhead(elapsedMs(started));
    }
    notifyListeners(listener -> listener.eventRecorded(event));
    return span;
  }

  /**
   * Runs {@code fn} inside a new span with middleware hooks.
   *
   * @param operationName span name
   * @param fn work to run
   * @param <T> result type
   * @param <E> checked exception thrown by {@code fn}
   * @return result of {@code fn}
   * @throws E the exact failure raised by {@code fn}
   */
  public <T, E extends Exception> T traceOperation(String operationName, TracedOperation<T, E> fn) throws E {
    return traceOperation(operationName, fn, null, Map.of());
  }

  /**
   * Runs {@code fn} inside a span that is a child of {@code parent}, or a root span when {@code parent} is
   * {@code null}. When the tracer declines the span, {@code fn} still runs with an unsampled context and the hooks
   * still fire.
   *
   * <p>Order: before hooks, {@code fn}, then after hooks and an ok finish on success, or an error status, error
   * hooks and an error finish on failure. Interruption marks the span {@value SpanStatus#CANCELLED_MESSAGE}.</p>
   *
   * @param operationName span name
   * @param fn work to run
   * @param parent parent context; may be {@code null}
   * @param metadata span tags and hook metadata; may be {@code null}
   * @param <T> result type
   * @param <E> checked exception thrown by {@code fn}
   * @return result of {@code fn}
   * @throws E the exact failure raised by {@code fn}
   */
  public <T, E extends Exception> T traceOperation(
      String operationName, TracedOperation<T, E> fn, TraceContext parent, Map<String, Object> metadata) throws E {
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(fn, "fn");
    if (!config.enabled()) {
      return fn.run(TraceContexts.unsampled(parent, operationName));
    }
    Map<String, Object> tags = metadata == null ? Map.of() : metadata;
    long started = clock.nanoTime();
    Optional<TraceContext> span = openSpan(operationName, parent, tags);
    TraceContext context = span.orElseGet(() -> TraceContexts.unsampled(parent, operationName));
    runBeforeHooks(span, context, operationName, tags);

    long fnStarted = clock.nanoTime();
    long fnNanos = 0L;
    T result;
    try (TraceLogScope ignored = TraceLogScope.open(context)) {
      try {
        result = fn.run(context);
      } finally {
        fnNanos = clock.nanoTime() - fnStarted;
      }
    } catch (Throwable error) {
      completeFailure(span, context, operationName, error, started, fnNanos);
      throw error;
    }
    completeSuccess(span, context, operationName, result, started, fnNanos);
    return result;
  }

  /**
   * Asynchronous counterpart of {@link #traceOperation(String, TracedOperation, TraceContext, Map)}. Span
   * completion and after/error hooks run when the returned stage completes; a cancelled stage marks the span
   * {@value SpanStatus#CANCELLED_MESSAGE}.
   *
   * @param operationName span name
   * @param fn starts the work and returns its stage
   * @param parent parent context; may be {@code null}
   * @param metadata span tags and hook metadata; may be {@code null}
   * @param <T> result type
   * @return stage completing with the outcome of {@code fn}'s stage once bookkeeping is done
   */
  public <T> CompletionStage<T> traceAsync(
      String operationName,
      Function<TraceContext, ? extends CompletionStage<T>> fn,
      TraceContext parent,
      Map<String, Object> metadata) {
    Objects.requireNonNull(operationName, "operationName");
    Objects.requireNonNull(fn, "fn");
    if (!config.enabled()) {
      return fn.apply(TraceContexts.unsampled(parent, operationName));
    }
    Map<String, Object> tags = metadata == null ? Map.of() : metadata;
    long started = clock.nanoTime();
    Optional<TraceContext> span = openSpan(operationName, parent, tags);
    TraceContext context = span.orElseGet(() -> TraceContexts.unsampled(parent, operationName));
    runBeforeHooks(span, context, operationName, tags);

    long fnStarted = clock.nanoTime();
    CompletionStage<T> stage;
    try (TraceLogScope ignored = TraceLogScope.open(context)) {
      stage = Objects.requireNonNull(fn.apply(context), "fn returned null stage");
    } catch (RuntimeException | Error error) {
      completeFailure(span, context, operationName, error, started, clock.nanoTime() - fnStarted);
      throw error;
    }
    return stage.whenComplete((value, error) -> {
      long pendingNanos = clock.nanoTime() - fnStarted;
      if (error == null) {
        completeSuccess(span, context, operationName, value, started, pendingNanos);
      } else {
        completeFailure(span, context, operationName, unwrap(error), started, pendingNanos);
      }
    });
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
    if (!config.enabled()) {
      return;
    }
    metricsCollector.recordMetricFromTrace(context, name, value, type);
  }

  /**
   * Returns the consolidated metrics view including tracing, alerting, and overhead figures.
   *
   * @return metrics view
   */
  public ObservabilityMetrics getMetrics() {
    ObservabilityMetrics base = metricsCollector.getMetrics();
    long traces = safely(() -> tracing.getStatistics().totalTraces(), 0L, "tracing statistics");
    long alerts = safely(() -> alerting.getStatistics().triggeredTotal(), 0L, "alerting statistics");
    SelfMetrics self = new SelfMetrics(
        base.observability().metricsCollected(), traces, alerts, overheadTracker.getStatistics().averageMs());
    return base.withObservability(self);
  }

  /**
   * Assembles the dashboard bundle with fixed-threshold insights.
   *
   * @return dashboard data
   */
  public DashboardData getDashboardData() {
    ObservabilityMetrics metrics = getMetrics();
    List<ActiveAlert> alerts = safely(alerting::getActiveAlerts, List.of(), "active alerts");
    HealthSummary health = safely(healthRegistry::getHealthSummary, HealthSummary.unknown(), "health summary");
    return new DashboardData(metrics, alerts, health, insights(metrics, alerts, overheadTracker.getStatistics()));
  }

  /**
   * Renders the metrics in the requested format.
   *
   * @param format export format
   * @return exposition text or JSON document; {@code "{}"} when JSON serialization fails
   */
  public String exportMetrics(ExportFormat format) {
    Objects.requireNonNull(format, "format");
    return switch (format) {
      case PROMETHEUS -> metricsCollector.exportPrometheusMetrics();
      case JSON -> exportJson();
    };
  }

  /**
   * Renders the metrics in the named format.
   *
   * @param format {@code "prometheus"} or {@code "json"}, case-insensitive
   * @return rendered metrics
   * @throws IllegalArgumentException if the format is unsupported
   */
  public String exportMetrics(String format) {
    return exportMetrics(ExportFormat.parse(format));
  }

  /**
   * Adds a middleware; see {@link MiddlewareManager#register(Middleware)}.
   *
   * @param middleware middleware to add
   * @throws IllegalArgumentException if the name is already registered
   */
  public void registerMiddleware(Middleware middleware) {
    middlewareManager.register(middleware);
  }

  public boolean unregisterMiddleware(String name) {
    return middlewareManager.unregister(name);
  }

  public boolean setMiddlewareEnabled(String name, boolean enabled) {
    return middlewareManager.setEnabled(name, enabled);
  }

  public List<Middleware> getMiddlewares() {
    return middlewareManager.getMiddlewares();
  }

  /**
   * Applies a partial configuration change and pushes it to the running subsystems.
   *
   * @param update change to apply
   * @throws IllegalArgumentException if the resulting configuration is invalid
   */
  public void updateConfig(ConfigUpdate update) {
    Objects.requireNonNull(update, "update");
    if (update.isEmpty()) {
      return;
    }
    ObservabilityConfig next;
    synchronized (lifecycleLock) {
      next = config.apply(update);
      config = next;
      pushSettings(next);
      reconcileLocked(next);
    }
    log.info("Observability configuration updated: {}", update.changedKeys());
    notifyListeners(listener -> listener.configUpdated(next));
  }

  /**
   * Returns an operational summary.
   *
   * @return status snapshot
   */
  public ObservabilityStatus getStatus() {
    ObservabilityConfig current = config;
    ManagerState currentState = state;
    long uptimeMs = currentState == ManagerState.RUNNING ? Math.max(0L, clock.nowMillis() - startedAtMillis) : 0L;
    long traces = safely(() -> tracing.getStatistics().totalTraces(), 0L, "tracing statistics");
    long activeAlerts = safely(() -> (long) alerting.getStatistics().activeAlerts(), 0L, "alerting statistics");
    boolean evaluatingNow;
    synchronized (lifecycleLock) {
      evaluatingNow = evaluating;
    }
    return new ObservabilityStatus(
        current.enabled(),
        currentState,
        uptimeMs,
        new ObservabilityStatus.Subsystem(current.enabled() && current.tracing().enableTracing(), traces),
        new ObservabilityStatus.Subsystem(metricsCollector.isCollecting(), metricsCollector.getSnapshot().seriesCount()),
        new ObservabilityStatus.Subsystem(evaluatingNow, activeAlerts),
        overheadTracker.getStatistics(),
        middlewareManager.size());
  }

  public OverheadStatistics getOverheadStatistics() {
    return overheadTracker.getStatistics();
  }

  /** Forces the metrics backend to export pending data. */
  public void flush() {
    metricsCollector.flush();
  }

  public void addListener(ObservabilityListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ObservabilityListener listener) {
    listeners.remove(listener);
  }

  private Optional<TraceContext> annotate(ObservabilityEvent event) {
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put("event.kind", event.kind().wireName());
    tags.put("event.entity", event.entityId());
    tags.put("event.operation", event.operation());
    tags.put("event.status", event.status().wireName());
    event.duration().ifPresent(duration -> tags.put("event.duration_ms", duration));
    event.metadata().forEach((key, value) -> tags.put("event.metadata." + key, value));
    Optional<TraceContext> span = tracing.startTrace(event.kind().wireName() + "." + event.operation(), tags);
    span.ifPresent(context -> finishQuietly(
        context, event.failed() ? SpanStatus.error(event.operation() + " failed") : SpanStatus.ok()));
    return span;
  }

  private Optional<TraceContext> openSpan(String operationName, TraceContext parent, Map<String, Object> tags) {
    try {
      return parent == null
          ? tracing.startTrace(operationName, tags)
          : tracing.startChildTrace(parent, operationName, tags);
    } catch (RuntimeException ex) {
      log.error("Failed to start span {}", operationName, ex);
      return Optional.empty();
    }
  }

  private void runBeforeHooks(
      Optional<TraceContext> span, TraceContext context, String operationName, Map<String, Object> tags) {
    try {
      middlewareManager.executeBeforeHooks(context, operationName, tags);
    } catch (RuntimeException ex) {
      log.error("Middleware before hooks failed for {}", operationName, ex);
    } catch (Error fatal) {
      span.ifPresent(ctx -> finishQuietly(ctx, SpanStatus.error(describe(fatal))));
      throw fatal;
    }
  }

  private void completeSuccess(
      Optional<TraceContext> span,
      TraceContext context,
      String operationName,
      Object result,
      long startedNanos,
      long fnNanos) {
    try {
      middlewareManager.executeAfterHooks(context, operationName, result, elapsedMs(startedNanos));
    } finally {
      span.ifPresent(ctx -> finishQuietly(ctx, SpanStatus.ok()));
      recordOverhead(overheadMs(startedNanos, fnNanos));
    }
  }

  private void completeFailure(
      Optional<TraceContext> span,
      TraceContext context,
      String operationName,
      Throwable error,
      long startedNanos,
      long fnNanos) {
    SpanStatus status = isCancellation(error) ? SpanStatus.cancelled() : SpanStatus.error(describe(error));
    span.ifPresent(ctx -> {
      try {
        tracing.setTraceStatus(ctx, status);
      } catch (RuntimeException ex) {
        log.error("Failed to set status on span {}", ctx.shortSpanId(), ex);
      }
    });
    try {
      middlewareManager.executeErrorHooks(context, operationName, error, elapsedMs(startedNanos));
    } finally {
      span.ifPresent(ctx -> finishQuietly(ctx, status));
      recordOverhead(overheadMs(startedNanos, fnNanos));
    }
  }

  private void finishQuietly(TraceContext context, SpanStatus status) {
    try {
      tracing.finishTrace(context, status);
    } catch (RuntimeException ex) {
      log.error("Failed to finish span {}", context.shortSpanId(), ex);
    }
  }

  private void recordOverhead(double overheadMs) {
    try {
      overheadTracker.recordOverhead(overheadMs);
      checkOverhead();
    } catch (RuntimeException ex) {
      log.error("Failed to record observability overhead", ex);
    }
  }

  private void checkOverhead() {
    long now = clock.nowMillis();
    long last = lastOverheadReactionMillis.get();
    if (last != Long.MIN_VALUE && now - last < OVERHEAD_REACTION_COOLDOWN_MS) {
      return;
    }
    if (!overheadTracker.isOverheadExcessive()) {
      return;
    }
    // another caller already claimed this window
    if (!lastOverheadReactionMillis.compareAndSet(last, now)) {
      return;
    }
    OverheadStatistics statistics = overheadTracker.getStatistics();
    double budget = overheadTracker.getBudgetMs();
    boolean throttle = config.overhead().throttlingEnabled() && statistics.p95Ms() > THROTTLE_FACTOR * budget;
    if (throttle) {
      throttle(statistics, budget);
    } else {
      log.warn(
          "Observability overhead p95 {} ms exceeds budget {} ms over {} operations",
          format(statistics.p95Ms()),
          format(budget),
          statistics.totalOperations());
    }
    notifyListeners(listener -> listener.overheadExcessive(statistics, throttle));
  }

  private void throttle(OverheadStatistics statistics, double budget) {
    ObservabilityConfig current = config;
    double rate = Math.max(MIN_SAMPLE_RATE, current.tracing().sampleRate() * 0.5d);
    long interval = Math.min(
        MetricsSettings.MAX_INTERVAL_MS, Math.round(current.metrics().collectionIntervalMs() * 1.5d));
    log.warn(
        "Observability overhead p95 {} ms exceeds {}x budget {} ms; throttling sampleRate {} -> {}, "
            + "collectionIntervalMs {} -> {}",
        format(statistics.p95Ms()),
        format(THROTTLE_FACTOR),
        format(budget),
        current.tracing().sampleRate(),
        rate,
        current.metrics().collectionIntervalMs(),
        interval);
    updateConfig(ConfigUpdate.builder().sampleRate(rate).collectionIntervalMs(interval).build());
  }

  private String exportJson() {
    try {
      return serializer.toJson(getMetrics());
    } catch (RuntimeException ex) {
      log.error("JSON metrics export failed", ex);
      return "{}";
    }
  }

  private List<Insight> insights(ObservabilityMetrics metrics, List<ActiveAlert> alerts, OverheadStatistics overhead) {
    List<Insight> insights = new ArrayList<>();
    double memoryUsage = metrics.system().memory().usage();
    if (memoryUsage > MEMORY_INSIGHT_THRESHOLD) {
      insights.add(new Insight(
          InsightType.RESOURCE,
          InsightSeverity.WARNING,
          "Heap usage is " + percent(memoryUsage),
          "Review retained objects or raise the heap limit",
          Map.of("memoryUsage", memoryUsage)));
    }
    double agentErrors = metrics.totalAgentErrors();
    if (agentErrors > AGENT_ERROR_INSIGHT_THRESHOLD) {
      insights.add(new Insight(
          InsightType.ERROR,
          InsightSeverity.ERROR,
          "Agents reported " + format(agentErrors) + " errors",
          "Inspect agent logs for recurring failures",
          Map.of("agentErrors", agentErrors)));
    }
    if (alerts.size() > ALERT_INSIGHT_THRESHOLD) {
      insights.add(new Insight(
          InsightType.TREND,
          InsightSeverity.WARNING,
          alerts.size() + " alerts are active",
          "Check for a shared root cause across active alerts",
          Map.of("activeAlerts", alerts.size())));
    }
    if (!overhead.withinThreshold()) {
      insights.add(new Insight(
          InsightType.PERFORMANCE,
          InsightSeverity.WARNING,
          "Observability overhead p95 is " + format(overhead.p95Ms()) + " ms",
          "Lower the sampling rate or disable optional middlewares",
          Map.of("p95Ms", overhead.p95Ms(), "budgetMs", overheadTracker.getBudgetMs())));
    }
    return insights;
  }

  private HealthCheckResult probeOverhead() {
    OverheadStatistics statistics = overheadTracker.getStatistics();
    double budget = overheadTracker.getBudgetMs();
    HealthStatus status;
    if (statistics.p95Ms() > 2d * budget) {
      status = HealthStatus.UNHEALTHY;
    } else if (statistics.p95Ms() > budget) {
      status = HealthStatus.DEGRADED;
    } else {
      status = HealthStatus.HEALTHY;
    }
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("averageMs", statistics.averageMs());
    details.put("p95Ms", statistics.p95Ms());
    details.put("budgetMs", budget);
    details.put("totalOperations", statistics.totalOperations());
    return new HealthCheckResult(
        status,
        "Observability overhead p95 " + format(statistics.p95Ms()) + " ms, budget " + format(budget) + " ms",
        details,
        clock.now());
  }

  private void registerOverheadProbeLocked() {
    if (probeRegistered) {
      return;
    }
    try {
      healthRegistry.registerCheck(
          new HealthCheckDescriptor(
              OVERHEAD_PROBE_ID,
              "Observability Overhead",
              "performance",
              config.health().checkIntervalMs(),
              PROBE_TIMEOUT_MS,
              false),
          this::probeOverhead);
      probeRegistered = true;
    } catch (RuntimeException ex) {
      log.error("Failed to register the {} health probe", OVERHEAD_PROBE_ID, ex);
    }
  }

  private void pushSettings(ObservabilityConfig next) {
    try {
      tracing.setEnabled(next.enabled() && next.tracing().enableTracing());
      tracing.setSamplingRate(next.tracing().sampleRate());
    } catch (RuntimeException ex) {
      log.error("Failed to apply tracing settings", ex);
    }
    metricsCollector.setEnabled(next.enabled());
    metricsCollector.updateConfig(next.metrics());
    overheadTracker.setBudgetMs(next.overhead().maxOverheadMs());
  }

  private void reconcileLocked(ObservabilityConfig current) {
    boolean running = state == ManagerState.RUNNING && current.enabled();
    if (running && current.metrics().enableCollection()) {
      metricsCollector.startCollection();
    } else {
      metricsCollector.stopCollection();
    }
    boolean evaluate = running && current.health().enableHealthChecks();
    if (evaluate == evaluating) {
      return;
    }
    try {
      if (evaluate) {
        registerOverheadProbeLocked();
        alerting.startEvaluation();
      } else {
        alerting.stopEvaluation();
      }
      evaluating = evaluate;
    } catch (RuntimeException ex) {
      log.error("Failed to {} alert evaluation", evaluate ? "start" : "stop", ex);
    }
  }

  private void notifyListeners(Consumer<ObservabilityListener> action) {
    for (ObservabilityListener listener : listeners) {
      try {
        action.accept(listener);
      } catch (RuntimeException ex) {
        log.error("Observability listener {} failed", listener.getClass().getName(), ex);
      }
    }
  }

  private <V> V safely(Supplier<V> supplier, V fallback, String what) {
    try {
      return supplier.get();
    } catch (RuntimeException ex) {
      log.error("Failed to read {}", what, ex);
      return fallback;
    }
  }

  private double elapsedMs(long startedNanos) {
    return Math.max(0L, clock.nanoTime() - startedNanos) / 1_000_000d;
  }

  private double overheadMs(long startedNanos, long fnNanos) {
    return Math.max(0L, clock.nanoTime() - startedNanos - fnNanos) / 1_000_000d;
  }

  private static boolean isCancellation(Throwable error) {
    return error instanceof InterruptedException || error instanceof CancellationException;
  }

  private static Throwable unwrap(Throwable error) {
    if (error instanceof CompletionException && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.3f", value);
  }

  private static String percent(double ratio) {
    return String.format(Locale.ROOT, "%.1f%%", ratio * 100d);
  }

  private final class AlertForwarder implements AlertListener {
    @Override
    public void alertTriggered(ActiveAlert alert) {
      notifyListeners(listener -> listener.alertTriggered(alert));
      Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("alertId", alert.id());
      metadata.put("rule", alert.ruleName());
      metadata.put("severity", alert.severity().name());
      recordEvent(new SystemEvent("alerting", "alert_triggered", 1d, EventStatus.COMPLETED, metadata));
    }

    @Override
    public void alertResolved(ActiveAlert alert) {
      notifyListeners(listener -> listener.alertResolved(alert));
    }
  }
}
