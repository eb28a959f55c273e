package ca.gc.cra.prism.application.orchestration;

import ca.gc.cra.prism.application.metrics.MetricsCollector;
import ca.gc.cra.prism.application.middleware.MiddlewareHooks;
import ca.gc.cra.prism.application.middleware.MiddlewareManager;
import ca.gc.cra.prism.application.middleware.Middlewares;
import ca.gc.cra.prism.application.overhead.OverheadTracker;
import ca.gc.cra.prism.application.port.MetricsSerializerPort;
import ca.gc.cra.prism.config.ObservabilityConfig;
import ca.gc.cra.prism.domain.metrics.SystemMetrics;
import ca.gc.cra.prism.domain.trace.TraceContext;
import ca.gc.cra.prism.infrastructure.export.JsonMetricsExporter;
import ca.gc.cra.prism.infrastructure.tracing.InMemoryTracingSystem;
import ca.gc.cra.prism.testing.FakeClock;
import ca.gc.cra.prism.testing.RecordingAlerting;
import ca.gc.cra.prism.testing.RecordingHealthRegistry;
import ca.gc.cra.prism.testing.RecordingMetricsPort;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires a manager against in-memory doubles driven by a {@link FakeClock}.
 */
final class ManagerFixture implements AutoCloseable {
  final FakeClock clock = new FakeClock();
  final RecordingMetricsPort metricsPort = new RecordingMetricsPort();
  final RecordingAlerting alerting = new RecordingAlerting();
  final RecordingHealthRegistry health = new RecordingHealthRegistry();
  final MiddlewareManager middlewares = new MiddlewareManager();
  final AtomicReference<SystemMetrics> system = new AtomicReference<>(SystemMetrics.empty());
  final InMemoryTracingSystem tracing;
  final MetricsCollector collector;
  final OverheadTracker overhead;
  final ObservabilityManager manager;

  ManagerFixture() {
    this(ObservabilityConfig.defaults());
  }

  ManagerFixture(ObservabilityConfig config) {
    this(config, new JsonMetricsExporter());
  }

  ManagerFixture(ObservabilityConfig config, MetricsSerializerPort serializer) {
    tracing = new InMemoryTracingSystem(config.tracing(), clock);
    collector = new MetricsCollector(
        config.metrics(), system::get, health, metricsPort, clock, Executors::newSingleThreadScheduledExecutor);
    overhead = new OverheadTracker(config.overhead().maxOverheadMs());
    manager = new ObservabilityManager(
        config, tracing, alerting, health, collector, overhead, middlewares, serializer, clock);
  }

  /** Registers a middleware whose before hook advances the clock, which the manager counts as overhead. */
  void addOverheadPerOperation(long millis) {
    manager.registerMiddleware(Middlewares.custom("slow-hook", new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        clock.advanceMillis(millis);
      }
    }));
  }

  void runOperations(int count) {
    for (int i = 0; i < count; i++) {
      manager.traceOperation("op", context -> null);
    }
  }

  @Override
  public void close() {
    manager.close();
  }
}
