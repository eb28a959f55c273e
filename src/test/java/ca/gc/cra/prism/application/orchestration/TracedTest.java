package ca.gc.cra.prism.application.orchestration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.metrics.MetricNames;
import ca.gc.cra.prism.domain.trace.SpanStatus;
import ca.gc.cra.prism.infrastructure.tracing.SpanRecord;
import java.io.IOException;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TracedTest {
  private ManagerFixture fixture;

  @BeforeEach
  void setUp() {
    fixture = new ManagerFixture();
  }

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  @Test
  void wrappedFunctionRunsInsideSpan() {
    Function<String, Integer> length = String::length;
    Function<String, Integer> traced =
        Traced.wrap(fixture.manager, TracedOptions.named("length").withMetadata(Map.of("unit", "chars")), length);

    assertEquals(5, traced.apply("hello"));

    SpanRecord span = span("length");
    assertEquals(SpanStatus.ok(), span.status());
    assertEquals("chars", span.tags().get("unit"));
    assertTrue(fixture.collector.getSnapshot().isEmpty());
  }

  @Test
  void recordMetricsEmitsSystemEvent() {
    Supplier<String> work = () -> "ok";
    Supplier<String> traced = Traced.wrap(fixture.manager, TracedOptions.named("load").withRecordMetrics(true), work);

    assertEquals("ok", traced.get());

    assertTrue(fixture.collector.getSnapshot().gauge("system_load", Map.of("operation", "load")).isPresent());
  }

  @Test
  void failedCallRecordsErrorEvent() {
    Supplier<String> work = () -> {
      throw new IllegalStateException("unavailable");
    };
    Supplier<String> traced = Traced.wrap(fixture.manager, TracedOptions.named("load").withRecordMetrics(true), work);

    assertThrows(IllegalStateException.class, traced::get);

    assertTrue(fixture.collector.getSnapshot()
        .gauge("system_load_error", Map.of("operation", "load_error")).isPresent());
    assertEquals(SpanStatus.error("unavailable"), span("load").status());
  }

  @Test
  void wrappedOperationBecomesChildOfInvocationContext() throws Exception {
    TracedOperation<String, IOException> step = context -> context.parentSpanId();
    TracedOperation<String, IOException> traced = Traced.wrap(fixture.manager, TracedOptions.named("step"), step);

    String parentSpan = fixture.manager.traceOperation("request", context -> {
      String seen = traced.run(context);
      assertEquals(context.spanId(), seen);
      return context.spanId();
    });

    assertEquals(parentSpan, span("step").parentSpanId());
  }

  @Test
  void agentOperationRecordsAgentEvent() {
    String answer = Traced.traceAgentOperation(fixture.manager, "agent-7", "think", context -> "42");

    assertEquals("42", answer);
    assertEquals("agent-7", span("agent.think").tags().get("agentId"));
    assertEquals(1d, fixture.collector.getSnapshot().counterTotal(MetricNames.AGENT_ACTIONS));
    assertEquals(0d, fixture.collector.getSnapshot().counterTotal(MetricNames.AGENT_ERRORS));
  }

  @Test
  void failedAgentOperationRethrowsAndCountsError() {
    IOException failure = new IOException("tool crashed");
    TracedOperation<String, IOException> operation = context -> {
      throw failure;
    };

    IOException thrown = assertThrows(IOException.class,
        () -> Traced.traceAgentOperation(fixture.manager, "agent-7", "act", operation));

    assertSame(failure, thrown);
    assertEquals(1d, fixture.collector.getSnapshot().counterTotal(MetricNames.AGENT_ERRORS));
  }

  @Test
  void portalOperationTagsModel() {
    Traced.tracePortalOperation(fixture.manager, "portal-1", "gpt-x", context -> null);

    SpanRecord span = span("portal.request");
    assertEquals("portal-1", span.tags().get("portalId"));
    assertEquals("gpt-x", span.tags().get("model"));
    assertEquals(1d, fixture.collector.getSnapshot().counterTotal(MetricNames.PORTAL_REQUESTS));
  }

  @Test
  void extensionAndMemoryOperationsUseEntitySpans() {
    Traced.traceExtensionOperation(fixture.manager, "ext-1", "message", context -> null);
    Traced.traceMemoryOperation(fixture.manager, "store-1", "query", context -> null);

    assertEquals("ext-1", span("extension.message").tags().get("extensionId"));
    assertEquals("store-1", span("memory.query").tags().get("providerId"));
    assertEquals(1d, fixture.collector.getSnapshot().counterTotal(MetricNames.EXTENSION_MESSAGES));
    assertEquals(1d, fixture.collector.getSnapshot().counterTotal(MetricNames.MEMORY_OPERATIONS));
  }

  @Test
  void blankEntityIdIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> Traced.traceAgentOperation(fixture.manager, " ", "act", context -> null));
  }

  private SpanRecord span(String operationName) {
    for (SpanRecord record : fixture.tracing.exportSpans()) {
      if (record.operationName().equals(operationName)) {
        return record;
      }
    }
    throw new AssertionError("No span named " + operationName);
  }
}
