package ca.gc.cra.prism.application.orchestration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.port.ObservabilityListener;
import ca.gc.cra.prism.config.ObservabilityConfig;
import ca.gc.cra.prism.domain.alert.ActiveAlert;
import ca.gc.cra.prism.domain.alert.AlertSeverity;
import ca.gc.cra.prism.domain.dashboard.DashboardData;
import ca.gc.cra.prism.domain.dashboard.Insight;
import ca.gc.cra.prism.domain.dashboard.InsightType;
import ca.gc.cra.prism.domain.event.AgentEvent;
import ca.gc.cra.prism.domain.event.EventStatus;
import ca.gc.cra.prism.domain.health.HealthCheckDescriptor;
import ca.gc.cra.prism.domain.health.HealthCheckResult;
import ca.gc.cra.prism.domain.health.HealthStatus;
import ca.gc.cra.prism.domain.metrics.OverheadStatistics;
import ca.gc.cra.prism.domain.metrics.SystemMetrics;
import ca.gc.cra.prism.testing.LogCapture;
import ch.qos.logback.classic.Level;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ObservabilityManagerOverheadTest {
  private ManagerFixture fixture;

  @AfterEach
  void tearDown() {
    if (fixture != null) {
      fixture.close();
    }
  }

  @Test
  void severeOverheadThrottlesSamplingAndCollection() {
    fixture = new ManagerFixture();
    OverheadRecorder recorder = new OverheadRecorder();
    fixture.manager.addListener(recorder);
    fixture.addOverheadPerOperation(20L);

    fixture.runOperations(99);
    assertTrue(recorder.throttled.isEmpty());

    fixture.runOperations(1);

    assertEquals(List.of(true), recorder.throttled);
    assertEquals(0.5d, fixture.manager.getConfig().tracing().sampleRate());
    assertEquals(7_500L, fixture.manager.getConfig().metrics().collectionIntervalMs());
    assertEquals(0.5d, fixture.tracing.getSamplingRate());
  }

  @Test
  void throttlingWaitsForCooldown() {
    fixture = new ManagerFixture();
    OverheadRecorder recorder = new OverheadRecorder();
    fixture.manager.addListener(recorder);
    fixture.addOverheadPerOperation(20L);

    fixture.runOperations(200);
    assertEquals(1, recorder.throttled.size());

    fixture.clock.advanceMillis(ObservabilityManager.OVERHEAD_REACTION_COOLDOWN_MS);
    fixture.runOperations(1);

    assertEquals(2, recorder.throttled.size());
    assertEquals(0.25d, fixture.manager.getConfig().tracing().sampleRate());
    assertEquals(11_250L, fixture.manager.getConfig().metrics().collectionIntervalMs());
  }

  @Test
  void moderateOverheadOnlyWarns() {
    fixture = new ManagerFixture();
    OverheadRecorder recorder = new OverheadRecorder();
    fixture.manager.addListener(recorder);
    fixture.addOverheadPerOperation(8L);

    try (LogCapture logs = LogCapture.attach(ObservabilityManager.class)) {
      fixture.runOperations(150);

      List<String> warnings = logs.messages(Level.WARN);
      assertEquals(1, warnings.size());
      assertTrue(warnings.get(0).contains("exceeds budget"));
    }
    assertEquals(List.of(false), recorder.throttled);
    assertEquals(1.0d, fixture.manager.getConfig().tracing().sampleRate());
    assertEquals(5_000L, fixture.manager.getConfig().metrics().collectionIntervalMs());
  }

  @Test
  void disabledThrottlingOnlyWarns() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of("overhead.throttlingEnabled", "false")));
    OverheadRecorder recorder = new OverheadRecorder();
    fixture.manager.addListener(recorder);
    fixture.addOverheadPerOperation(50L);

    fixture.runOperations(100);

    assertEquals(List.of(false), recorder.throttled);
    assertEquals(1.0d, fixture.manager.getConfig().tracing().sampleRate());
  }

  @Test
  void throttlingIsClamped() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of(
        "tracing.sampleRate", "0.015",
        "metrics.collectionIntervalMs", "25000")));
    fixture.addOverheadPerOperation(20L);

    fixture.runOperations(100);

    assertEquals(ObservabilityManager.MIN_SAMPLE_RATE, fixture.manager.getConfig().tracing().sampleRate());
    assertEquals(30_000L, fixture.manager.getConfig().metrics().collectionIntervalMs());
  }

  @Test
  void fewSamplesNeverTriggerReaction() {
    fixture = new ManagerFixture();
    OverheadRecorder recorder = new OverheadRecorder();
    fixture.manager.addListener(recorder);
    fixture.addOverheadPerOperation(100L);

    fixture.runOperations(50);

    assertTrue(recorder.throttled.isEmpty());
    assertFalse(fixture.manager.getOverheadStatistics().withinThreshold());
  }

  @Test
  void overheadProbeIsRegisteredOnStart() {
    fixture = new ManagerFixture();
    fixture.manager.start();

    HealthCheckDescriptor descriptor = fixture.health.descriptor(ObservabilityManager.OVERHEAD_PROBE_ID);

    assertEquals("Observability Overhead", descriptor.name());
    assertEquals("performance", descriptor.type());
    assertEquals(30_000L, descriptor.intervalMs());
    assertFalse(descriptor.critical());
    assertEquals(HealthStatus.HEALTHY, fixture.health.run(ObservabilityManager.OVERHEAD_PROBE_ID).status());
  }

  @Test
  void probeIsSkippedWithoutHealthChecks() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of("health.enableHealthChecks", "false")));
    fixture.manager.start();

    assertEquals(0, fixture.health.registrations());
    assertEquals(0, fixture.alerting.startCount());
  }

  @Test
  void probeDegradesAboveBudget() {
    fixture = new ManagerFixture();
    fixture.manager.start();
    fixture.addOverheadPerOperation(6L);
    fixture.runOperations(10);

    HealthCheckResult result = fixture.health.run(ObservabilityManager.OVERHEAD_PROBE_ID);

    assertEquals(HealthStatus.DEGRADED, result.status());
    assertEquals(6d, result.details().get("p95Ms"));
    assertEquals(10, result.details().get("totalOperations"));
  }

  @Test
  void probeFailsAboveTwiceBudget() {
    fixture = new ManagerFixture();
    fixture.manager.start();
    fixture.addOverheadPerOperation(11L);
    fixture.runOperations(10);

    assertEquals(HealthStatus.UNHEALTHY, fixture.health.run(ObservabilityManager.OVERHEAD_PROBE_ID).status());
  }

  @Test
  void quietSystemHasNoInsights() {
    fixture = new ManagerFixture();

    assertTrue(fixture.manager.getDashboardData().insights().isEmpty());
  }

  @Test
  void heapPressureProducesResourceInsight() {
    fixture = new ManagerFixture();
    fixture.system.set(new SystemMetrics(SystemMetrics.MemoryStats.of(90L, 100L), 0d, 0d, 0d, Map.of()));

    assertEquals(List.of(InsightType.RESOURCE), types(fixture.manager.getDashboardData()));
  }

  @Test
  void agentErrorsProduceErrorInsight() {
    fixture = new ManagerFixture();
    for (int i = 0; i < 10; i++) {
      fixture.manager.recordEvent(AgentEvent.of("agent-1", "act", EventStatus.FAILED));
    }
    assertTrue(types(fixture.manager.getDashboardData()).isEmpty());

    fixture.manager.recordEvent(AgentEvent.of("agent-2", "act", EventStatus.FAILED));

    assertEquals(List.of(InsightType.ERROR), types(fixture.manager.getDashboardData()));
  }

  @Test
  void manyActiveAlertsProduceTrendInsight() {
    fixture = new ManagerFixture();
    for (int i = 0; i < 6; i++) {
      fixture.alerting.trigger(
          new ActiveAlert("alert-" + i, "rule", AlertSeverity.WARNING, "firing", Instant.EPOCH, Map.of()));
    }

    DashboardData data = fixture.manager.getDashboardData();

    assertEquals(6, data.activeAlerts().size());
    assertEquals(List.of(InsightType.TREND), types(data));
  }

  @Test
  void excessiveOverheadProducesPerformanceInsight() {
    fixture = new ManagerFixture();
    fixture.addOverheadPerOperation(6L);
    fixture.runOperations(5);

    Insight insight = fixture.manager.getDashboardData().insights().get(0);

    assertEquals(InsightType.PERFORMANCE, insight.type());
    assertEquals(5d, insight.data().get("budgetMs"));
  }

  private static List<InsightType> types(DashboardData data) {
    List<InsightType> types = new ArrayList<>();
    for (Insight insight : data.insights()) {
      types.add(insight.type());
    }
    return types;
  }

  @Test
  void concurrentCallersThrottleOnce() throws Exception {
    fixture = new ManagerFixture();
    OverheadRecorder recorder = new OverheadRecorder();
    fixture.manager.addListener(recorder);
    for (int i = 0; i < 100; i++) {
      fixture.overhead.recordOverhead(20d);
    }
    int callers = 8;
    CountDownLatch ready = new CountDownLatch(callers);
    CountDownLatch go = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      List<Future<?>> calls = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        calls.add(pool.submit(() -> {
          ready.countDown();
          go.await();
          return fixture.manager.traceOperation("op", context -> null);
        }));
      }
      assertTrue(ready.await(5, TimeUnit.SECONDS));
      go.countDown();
      for (Future<?> call : calls) {
        call.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertEquals(List.of(true), recorder.throttled);
    assertEquals(0.5d, fixture.manager.getConfig().tracing().sampleRate());
    assertEquals(7_500L, fixture.manager.getConfig().metrics().collectionIntervalMs());
  }

  private static final class OverheadRecorder implements ObservabilityListener {
    private final List<Boolean> throttled = new CopyOnWriteArrayList<>();

    @Override
    public void overheadExcessive(OverheadStatistics statistics, boolean throttled) {
      this.throttled.add(throttled);
    }
  }
}
