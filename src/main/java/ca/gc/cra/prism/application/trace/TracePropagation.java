package ca.gc.cra.prism.application.trace;

import ca.gc.cra.prism.domain.trace.TraceContext;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves {@link TraceContext} identity in and out of header-style carriers.
 *
 * <p>Header lookup ignores case. Baggage and metadata are not propagated.</p>
 *
 * @since 0.1.0
 */
public final class TracePropagation {
  public static final String TRACE_ID_HEADER = "x-trace-id";
  public static final String SPAN_ID_HEADER = "x-span-id";
  public static final String PARENT_SPAN_ID_HEADER = "x-parent-span-id";
  public static final String SAMPLED_HEADER = "x-trace-sampled";
  public static final String FLAGS_HEADER = "x-trace-flags";

  private TracePropagation() {}

  /**
   * Reads an inbound context.
   *
   * @param headers carrier headers; may be {@code null}
   * @return context, or empty when the trace id or span id is missing or blank
   */
  public static Optional<TraceContext> extractFromCarrier(Map<String, String> headers) {
    if (headers == null || headers.isEmpty()) {
      return Optional.empty();
    }
    Map<String, String> normalized = new LinkedHashMap<>();
    headers.forEach((key, value) -> {
      if (key != null && value != null) {
        normalized.put(key.trim().toLowerCase(Locale.ROOT), value.trim());
      }
    });
    String traceId = normalized.get(TRACE_ID_HEADER);
    String spanId = normalized.get(SPAN_ID_HEADER);
    if (traceId == null || traceId.isEmpty() || spanId == null || spanId.isEmpty()) {
      return Optional.empty();
    }
    String parent = normalized.get(PARENT_SPAN_ID_HEADER);
    boolean sampled = "true".equalsIgnoreCase(normalized.get(SAMPLED_HEADER));
    int flags = parseFlags(normalized.get(FLAGS_HEADER));
    return Optional.of(new TraceContext(
        traceId, spanId, parent, sampled, flags, Map.of(), Instant.now(), Map.of()));
  }

  /**
   * Renders a context as outbound headers.
   *
   * @param context context to propagate
   * @return new mutable header map; the parent header is an empty string for roots
   */
  public static Map<String, String> injectIntoCarrier(TraceContext context) {
    return injectIntoCarrier(context, new LinkedHashMap<>());
  }

  /**
   * Writes a context into an existing carrier, replacing any previous trace headers.
   *
   * @param context context to propagate
   * @param carrier mutable carrier
   * @return {@code carrier}, for chaining
   */
  public static Map<String, String> injectIntoCarrier(TraceContext context, Map<String, String> carrier) {
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(carrier, "carrier");
    carrier.put(TRACE_ID_HEADER, context.traceId());
    carrier.put(SPAN_ID_HEADER, context.spanId());
    carrier.put(PARENT_SPAN_ID_HEADER, context.parent().orElse(""));
    carrier.put(SAMPLED_HEADER, Boolean.toString(context.sampled()));
    carrier.put(FLAGS_HEADER, Integer.toString(context.flags()));
    return carrier;
  }

  /**
   * Formats a short identity for log lines.
   *
   * @param context context to describe
   * @return {@code trace=<last8> span=<last8>}
   */
  public static String formatForLog(TraceContext context) {
    Objects.requireNonNull(context, "context");
    return "trace=" + context.shortTraceId() + " span=" + context.shortSpanId();
  }

  private static int parseFlags(String raw) {
    if (raw == null || raw.isEmpty()) {
      return 0;
    }
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
