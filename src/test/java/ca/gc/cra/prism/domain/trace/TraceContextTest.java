package ca.gc.cra.prism.domain.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TraceContextTest {

  @Test
  void blankParentIsTreatedAsRoot() {
    TraceContext context = new TraceContext(
        "0123456789abcdef0123456789abcdef", "0123456789abcdef", " ", true, 0, null, Instant.EPOCH, null);

    assertTrue(context.isRoot());
    assertTrue(context.parent().isEmpty());
    assertEquals(Map.of(), context.baggage());
  }

  @Test
  void shortIdsKeepLastEightCharacters() {
    TraceContext context = new TraceContext(
        "0123456789abcdef0123456789abcdef", "fedcba9876543210", null, true, 0, Map.of(), Instant.EPOCH, Map.of());

    assertEquals("89abcdef", context.shortTraceId());
    assertEquals("76543210", context.shortSpanId());
  }

  @Test
  void annotateAddsAndRemovesMetadata() {
    TraceContext context = new TraceContext("t", "s", null, true, 0, Map.of(), Instant.EPOCH, Map.of());

    context.annotate("tenant", "cra");
    assertEquals("cra", context.metadata().get("tenant"));

    context.annotate("tenant", null);
    assertFalse(context.metadata().containsKey("tenant"));
    assertEquals("unknown", context.operationName());
  }

  @Test
  void withSampledReturnsSameInstanceWhenUnchanged() {
    TraceContext context = new TraceContext("t", "s", null, true, 0, Map.of(), Instant.EPOCH, Map.of());

    assertSame(context, context.withSampled(true));
    assertFalse(context.withSampled(false).sampled());
  }

  @Test
  void cancelledStatusIsAnError() {
    SpanStatus status = SpanStatus.cancelled();

    assertTrue(status.isError());
    assertEquals(SpanStatus.CANCELLED_MESSAGE, status.message());
    assertFalse(SpanStatus.ok().isError());
  }
}
