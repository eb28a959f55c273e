package ca.gc.cra.prism.logging;

import ca.gc.cra.prism.domain.trace.TraceContext;
import org.slf4j.MDC;

/**
 * Places the trace and span id of a {@link TraceContext} into the SLF4J MDC for the lifetime of the scope.
 *
 * <p>Closing the scope restores whatever values were present before it opened, so nested scopes unwind
 * correctly. Scopes are bound to the opening thread.</p>
 *
 * @since 0.1.0
 */
public final class TraceLogScope implements AutoCloseable {
  public static final String TRACE_ID_KEY = "traceId";
  public static final String SPAN_ID_KEY = "spanId";

  private final String previousTraceId;
  private final String previousSpanId;

  private TraceLogScope(TraceContext context) {
    this.previousTraceId = MDC.get(TRACE_ID_KEY);
    this.previousSpanId = MDC.get(SPAN_ID_KEY);
    if (context != null) {
      MDC.put(TRACE_ID_KEY, context.shortTraceId());
      MDC.put(SPAN_ID_KEY, context.shortSpanId());
    }
  }

  /**
   * Opens a scope; a {@code null} context leaves the MDC untouched.
   *
   * @param context context to expose; may be {@code null}
   * @return scope to close in a try-with-resources block
   */
  public static TraceLogScope open(TraceContext context) {
    return new TraceLogScope(context);
  }

  @Override
  public void close() {
    restore(TRACE_ID_KEY, previousTraceId);
    restore(SPAN_ID_KEY, previousSpanId);
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }
}
