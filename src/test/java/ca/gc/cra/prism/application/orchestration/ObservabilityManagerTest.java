package ca.gc.cra.prism.application.orchestration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.metrics.MetricNames;
import ca.gc.cra.prism.application.middleware.MiddlewareHooks;
import ca.gc.cra.prism.application.middleware.MiddlewareManager;
import ca.gc.cra.prism.application.middleware.Middlewares;
import ca.gc.cra.prism.application.port.ObservabilityListener;
import ca.gc.cra.prism.application.trace.TraceContexts;
import ca.gc.cra.prism.config.ConfigUpdate;
import ca.gc.cra.prism.config.ObservabilityConfig;
import ca.gc.cra.prism.domain.alert.ActiveAlert;
import ca.gc.cra.prism.domain.alert.AlertSeverity;
import ca.gc.cra.prism.domain.event.AgentEvent;
import ca.gc.cra.prism.domain.event.EventStatus;
import ca.gc.cra.prism.domain.event.ObservabilityEvent;
import ca.gc.cra.prism.domain.metrics.MetricType;
import ca.gc.cra.prism.domain.trace.SpanStatus;
import ca.gc.cra.prism.domain.trace.TraceContext;
import ca.gc.cra.prism.infrastructure.tracing.SpanRecord;
import ca.gc.cra.prism.testing.LogCapture;
import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ObservabilityManagerTest {
  private ManagerFixture fixture;

  @AfterEach
  void tearDown() {
    if (fixture != null) {
      fixture.close();
    }
  }

  @Test
  void startIsIdempotentAndStartsSubsystems() {
    fixture = new ManagerFixture();
    RecordingListener listener = new RecordingListener();
    fixture.manager.addListener(listener);

    fixture.manager.start();
    fixture.manager.start();

    assertEquals(ManagerState.RUNNING, fixture.manager.getState());
    assertTrue(fixture.collector.isCollecting());
    assertEquals(1, fixture.alerting.startCount());
    assertEquals(1, fixture.alerting.listenerCount());
    assertEquals(1, fixture.health.registrations());
    assertEquals(List.of("started"), listener.calls);
  }

  @Test
  void disabledManagerRefusesToStart() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of("enabled", "false")));

    try (LogCapture logs = LogCapture.attach(ObservabilityManager.class)) {
      fixture.manager.start();

      assertEquals(ManagerState.STOPPED, fixture.manager.getState());
      assertEquals(1, logs.messages(Level.WARN).size());
    }
    assertFalse(fixture.collector.isCollecting());
    assertEquals(0, fixture.alerting.startCount());
  }

  @Test
  void stopFlushesAndReleasesSubsystems() {
    fixture = new ManagerFixture();
    RecordingListener listener = new RecordingListener();
    fixture.manager.addListener(listener);
    fixture.manager.start();

    fixture.manager.stop();
    fixture.manager.stop();

    assertEquals(ManagerState.STOPPED, fixture.manager.getState());
    assertFalse(fixture.collector.isCollecting());
    assertEquals(1, fixture.metricsPort.flushCount());
    assertEquals(1, fixture.alerting.stopCount());
    assertEquals(0, fixture.alerting.listenerCount());
    assertEquals(List.of("started", "stopped"), listener.calls);
  }

  @Test
  void restartDoesNotRegisterProbeTwice() {
    fixture = new ManagerFixture();

    fixture.manager.start();
    fixture.manager.stop();
    fixture.manager.start();

    assertEquals(1, fixture.health.registrations());
    assertEquals(2, fixture.alerting.startCount());
  }

  @Test
  void recordEventProducesFinishedSpanAndMetrics() {
    fixture = new ManagerFixture();
    RecordingListener listener = new RecordingListener();
    fixture.manager.addListener(listener);
    AgentEvent event = new AgentEvent("agent-1", "act", 12d, EventStatus.FAILED, Map.of("tool", "search"));

    Optional<TraceContext> span = fixture.manager.recordEvent(event);

    assertTrue(span.isPresent());
    SpanRecord record = fixture.tracing.exportSpans().get(0);
    assertEquals("agent.act", record.operationName());
    assertEquals(SpanStatus.error("act failed"), record.status());
    assertEquals("agent", record.tags().get("event.kind"));
    assertEquals("agent-1", record.tags().get("event.entity"));
    assertEquals("failed", record.tags().get("event.status"));
    assertEquals(12d, record.tags().get("event.duration_ms"));
    assertEquals("search", record.tags().get("event.metadata.tool"));
    assertEquals(1d, fixture.collector.getSnapshot().counterTotal(MetricNames.AGENT_ERRORS));
    assertEquals(1, fixture.manager.getOverheadStatistics().totalOperations());
    assertEquals(List.of("event:agent-1"), listener.calls);
  }

  @Test
  void recordEventIsRejectedWhenDisabled() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of("enabled", "false")));

    Optional<TraceContext> span = fixture.manager.recordEvent(AgentEvent.of("agent-1", "act", EventStatus.COMPLETED));

    assertTrue(span.isEmpty());
    assertTrue(fixture.collector.getSnapshot().isEmpty());
    assertTrue(fixture.tracing.exportSpans().isEmpty());
  }

  @Test
  void traceOperationReturnsResultAndRunsHooksInOrder() {
    fixture = new ManagerFixture();
    List<String> calls = new ArrayList<>();
    fixture.manager.registerMiddleware(Middlewares.custom("recorder", new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        calls.add("before:" + operation + ":" + metadata.get("orderId"));
      }

      @Override
      public void afterOperation(TraceContext context, String operation, Object result, double durationMs) {
        calls.add("after:" + result);
      }
    }));

    String result = fixture.manager.traceOperation("checkout", context -> {
      calls.add("fn:" + context.operationName());
      return "done";
    }, null, Map.of("orderId", "42"));

    assertEquals("done", result);
    assertEquals(List.of("before:checkout:42", "fn:checkout", "after:done"), calls);
    SpanRecord record = fixture.tracing.exportSpans().get(0);
    assertEquals("checkout", record.operationName());
    assertEquals(SpanStatus.ok(), record.status());
    assertEquals("42", record.tags().get("orderId"));
  }

  @Test
  void traceOperationRethrowsOriginalCheckedException() {
    fixture = new ManagerFixture();
    List<Throwable> seen = new ArrayList<>();
    fixture.manager.registerMiddleware(Middlewares.custom("errors", new MiddlewareHooks() {
      @Override
      public void onError(TraceContext context, String operation, Throwable error, double durationMs) {
        seen.add(error);
      }
    }));
    IOException failure = new IOException("disk full");
    TracedOperation<String, IOException> operation = context -> {
      throw failure;
    };

    IOException thrown = assertThrows(IOException.class, () -> fixture.manager.traceOperation("write", operation));

    assertSame(failure, thrown);
    assertEquals(List.of(failure), seen);
    assertEquals(SpanStatus.error("disk full"), fixture.tracing.exportSpans().get(0).status());
  }

  @Test
  void exceptionWithoutMessageUsesTypeName() {
    fixture = new ManagerFixture();
    TracedOperation<String, RuntimeException> operation = context -> {
      throw new IllegalStateException();
    };

    assertThrows(IllegalStateException.class, () -> fixture.manager.traceOperation("op", operation));

    assertEquals("IllegalStateException", fixture.tracing.exportSpans().get(0).status().message());
  }

  @Test
  void interruptionMarksSpanCancelled() {
    fixture = new ManagerFixture();
    TracedOperation<String, InterruptedException> operation = context -> {
      throw new InterruptedException("shutdown");
    };

    assertThrows(InterruptedException.class, () -> fixture.manager.traceOperation("wait", operation));

    assertEquals(SpanStatus.cancelled(), fixture.tracing.exportSpans().get(0).status());
  }

  @Test
  void parentContextProducesChildSpan() {
    fixture = new ManagerFixture();

    String parentSpan = fixture.manager.traceOperation("outer", outer -> {
      fixture.manager.traceOperation("inner", inner -> inner.spanId(), outer, Map.of());
      return outer.spanId();
    });

    List<SpanRecord> spans = fixture.tracing.exportSpans();
    assertEquals(2, spans.size());
    SpanRecord inner = spans.get(0);
    assertEquals("inner", inner.operationName());
    assertEquals(parentSpan, inner.parentSpanId());
    assertEquals(spans.get(1).traceId(), inner.traceId());
  }

  @Test
  void unsampledOperationStillRunsWithContext() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of("tracing.sampleRate", "0")));
    AtomicReference<TraceContext> seen = new AtomicReference<>();

    Integer result = fixture.manager.traceOperation("op", context -> {
      seen.set(context);
      return 7;
    });

    assertEquals(7, result);
    assertFalse(seen.get().sampled());
    assertTrue(fixture.tracing.exportSpans().isEmpty());
  }

  @Test
  void disabledManagerRunsFunctionWithoutHooks() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of("enabled", "false")));
    List<String> calls = new ArrayList<>();
    fixture.manager.registerMiddleware(Middlewares.custom("recorder", new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        calls.add("before");
      }
    }));

    String result = fixture.manager.traceOperation("op", context -> context.sampled() ? "sampled" : "unsampled");

    assertEquals("unsampled", result);
    assertTrue(calls.isEmpty());
    assertEquals(0, fixture.manager.getOverheadStatistics().totalOperations());
  }

  @Test
  void overheadExcludesFunctionTime() {
    fixture = new ManagerFixture();

    fixture.manager.traceOperation("slow", context -> {
      fixture.clock.advanceMillis(500L);
      return null;
    });

    assertEquals(1, fixture.manager.getOverheadStatistics().totalOperations());
    assertEquals(0d, fixture.manager.getOverheadStatistics().maxMs());
    assertEquals(500d, fixture.tracing.exportSpans().get(0).durationMs());
  }

  @Test
  void updateConfigPushesSettingsAndReconciles() {
    fixture = new ManagerFixture();
    RecordingListener listener = new RecordingListener();
    fixture.manager.addListener(listener);
    fixture.manager.start();

    fixture.manager.updateConfig(ConfigUpdate.builder()
        .sampleRate(0.25d)
        .enableCollection(false)
        .enableHealthChecks(false)
        .build());

    assertEquals(0.25d, fixture.tracing.getSamplingRate());
    assertEquals(0.25d, fixture.manager.getConfig().tracing().sampleRate());
    assertFalse(fixture.collector.isCollecting());
    assertFalse(fixture.alerting.isEvaluating());
    assertTrue(fixture.manager.isRunning());
    assertEquals(List.of("started", "config:0.25"), listener.calls);
  }

  @Test
  void emptyUpdateIsIgnored() {
    fixture = new ManagerFixture();
    RecordingListener listener = new RecordingListener();
    fixture.manager.addListener(listener);
    ObservabilityConfig before = fixture.manager.getConfig();

    fixture.manager.updateConfig(ConfigUpdate.empty());

    assertSame(before, fixture.manager.getConfig());
    assertTrue(listener.calls.isEmpty());
  }

  @Test
  void disablingAtRuntimeStopsCollectionButKeepsState() {
    fixture = new ManagerFixture();
    fixture.manager.start();

    fixture.manager.updateConfig(ConfigUpdate.builder().enabled(false).build());

    assertFalse(fixture.collector.isCollecting());
    assertFalse(fixture.tracing.isEnabled());
    assertTrue(fixture.manager.recordEvent(AgentEvent.of("agent-1", "act", EventStatus.COMPLETED)).isEmpty());
  }

  @Test
  void triggeredAlertIsForwardedAndRecorded() {
    fixture = new ManagerFixture();
    RecordingListener listener = new RecordingListener();
    fixture.manager.addListener(listener);
    fixture.manager.start();

    fixture.alerting.trigger(new ActiveAlert(
        "alert-1", "high-latency", AlertSeverity.CRITICAL, "p95 over 2s", Instant.EPOCH, Map.of()));

    assertTrue(listener.calls.contains("alert:alert-1"));
    assertEquals(1d, fixture.collector.getSnapshot()
        .gauge("system_alert_triggered", Map.of("operation", "alert_triggered")).orElseThrow());
    assertEquals(1L, fixture.manager.getMetrics().observability().alertsTriggered());
  }

  @Test
  void statusReflectsSubsystems() {
    fixture = new ManagerFixture();
    fixture.manager.start();
    fixture.clock.advanceMillis(1_500L);
    fixture.manager.recordEvent(AgentEvent.of("agent-1", "act", EventStatus.COMPLETED));

    ObservabilityStatus status = fixture.manager.getStatus();

    assertTrue(status.enabled());
    assertEquals(ManagerState.RUNNING, status.state());
    assertEquals(1_500L, status.uptimeMs());
    assertTrue(status.tracing().enabled());
    assertEquals(1L, status.tracing().count());
    assertTrue(status.metrics().enabled());
    assertTrue(status.alerting().enabled());
    assertEquals(0, status.middlewares());
    assertEquals(1, status.overhead().totalOperations());
  }

  @Test
  void metricFromTraceIsIgnoredWhenDisabled() {
    fixture = new ManagerFixture(ObservabilityConfig.fromMap(Map.of("enabled", "false")));
    TraceContext context = TraceContexts.createRootSpan("op");

    fixture.manager.recordMetricFromTrace(context, "items", 1d, MetricType.COUNTER);

    assertTrue(fixture.collector.getSnapshot().isEmpty());
  }

  @Test
  void middlewareRegistryIsExposed() {
    fixture = new ManagerFixture();
    fixture.manager.registerMiddleware(Middlewares.security());

    assertTrue(fixture.manager.setMiddlewareEnabled(Middlewares.SECURITY, false));
    assertFalse(fixture.manager.getMiddlewares().get(0).enabled());
    assertTrue(fixture.manager.unregisterMiddleware(Middlewares.SECURITY));
    assertTrue(fixture.manager.getMiddlewares().isEmpty());
  }

  @Test
  void nullMetadataValuesDoNotSkipOperation() {
    fixture = new ManagerFixture();
    List<Map<String, Object>> seen = new ArrayList<>();
    fixture.manager.registerMiddleware(Middlewares.custom("capture", new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        seen.add(metadata);
      }
    }));
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("userId", null);
    metadata.put("channel", "web");

    String result = fixture.manager.traceOperation("login", context -> "ok", null, metadata);

    assertEquals("ok", result);
    assertEquals(List.of(Map.of("channel", "web")), seen);
    assertEquals(1, fixture.tracing.exportSpans().size());
    assertEquals(0, fixture.tracing.getStatistics().activeSpans());
    assertEquals(1, fixture.manager.getOverheadStatistics().totalOperations());
  }

  @Test
  void hookErrorDoesNotAbortOperation() {
    fixture = new ManagerFixture();
    fixture.manager.registerMiddleware(Middlewares.custom("buggy", new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        throw new AssertionError("hook bug");
      }

      @Override
      public void afterOperation(TraceContext context, String operation, Object result, double durationMs) {
        throw new AssertionError("hook bug");
      }
    }));
    AtomicReference<String> ran = new AtomicReference<>();

    try (LogCapture ignored = LogCapture.attach(MiddlewareManager.class)) {
      fixture.manager.traceOperation("op", context -> {
        ran.set(context.operationName());
        return null;
      });
    }

    assertEquals("op", ran.get());
    assertEquals(SpanStatus.ok(), fixture.tracing.exportSpans().get(0).status());
    assertEquals(0, fixture.tracing.getStatistics().activeSpans());
    assertEquals(1, fixture.manager.getOverheadStatistics().totalOperations());
  }

  @Test
  void fatalHookErrorStillFinishesSpan() {
    fixture = new ManagerFixture();
    fixture.manager.registerMiddleware(Middlewares.custom("exhausted", new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        throw new StackOverflowError();
      }
    }));

    assertThrows(StackOverflowError.class, () -> fixture.manager.traceOperation("op", context -> "never"));

    assertEquals(SpanStatus.error("StackOverflowError"), fixture.tracing.exportSpans().get(0).status());
    assertEquals(0, fixture.tracing.getStatistics().activeSpans());
  }

  @Test
  void everyInvocationFinishesExactlyOneSpan() {
    fixture = new ManagerFixture();
    int invocations = 40;
    int failures = 0;

    for (int i = 0; i < invocations; i++) {
      int attempt = i;
      TracedOperation<Integer, IOException> operation = context -> {
        if (attempt % 2 == 1) {
          throw new IOException("attempt " + attempt);
        }
        return attempt;
      };
      try {
        fixture.manager.traceOperation("step", operation);
      } catch (IOException expected) {
        failures++;
      }
    }

    List<SpanRecord> spans = fixture.tracing.exportSpans();
    assertEquals(invocations, spans.size());
    assertEquals(20, failures);
    assertEquals(20L, spans.stream().filter(span -> span.status().equals(SpanStatus.ok())).count());
    assertEquals(0, fixture.tracing.getStatistics().activeSpans());
    assertEquals(invocations, fixture.manager.getOverheadStatistics().totalOperations());
  }

  private static final class RecordingListener implements ObservabilityListener {
    private final List<String> calls = new ArrayList<>();

    @Override
    public void started() {
      calls.add("started");
    }

    @Override
    public void stopped() {
      calls.add("stopped");
    }

    @Override
    public void eventRecorded(ObservabilityEvent event) {
      calls.add("event:" + event.entityId());
    }

    @Override
    public void configUpdated(ObservabilityConfig config) {
      calls.add("config:" + config.tracing().sampleRate());
    }

    @Override
    public void alertTriggered(ActiveAlert alert) {
      calls.add("alert:" + alert.id());
    }
  }
}
