package ca.gc.cra.prism.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.prism.application.trace.TraceContexts;
import ca.gc.cra.prism.domain.trace.TraceContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceLogScopeTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void scopePublishesAndRestoresTraceIds() {
    TraceContext outer = TraceContexts.createRootSpan("outer");
    TraceContext inner = TraceContexts.createChildSpan(outer, "inner");

    try (TraceLogScope ignored = TraceLogScope.open(outer)) {
      assertEquals(outer.shortSpanId(), MDC.get(TraceLogScope.SPAN_ID_KEY));
      try (TraceLogScope nested = TraceLogScope.open(inner)) {
        assertEquals(inner.shortSpanId(), MDC.get(TraceLogScope.SPAN_ID_KEY));
        assertEquals(outer.shortTraceId(), MDC.get(TraceLogScope.TRACE_ID_KEY));
      }
      assertEquals(outer.shortSpanId(), MDC.get(TraceLogScope.SPAN_ID_KEY));
    }

    assertNull(MDC.get(TraceLogScope.TRACE_ID_KEY));
    assertNull(MDC.get(TraceLogScope.SPAN_ID_KEY));
  }
}
