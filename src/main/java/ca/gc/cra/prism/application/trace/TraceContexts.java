package ca.gc.cra.prism.application.trace;

import ca.gc.cra.prism.domain.trace.TraceContext;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Factory for root and child {@link TraceContext} values.
 * <p><strong>Why:</strong> Keeps id generation and baggage inheritance rules in one place so every hop of a trace
 * tree is derived the same way.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from a shared {@link SecureRandom}, which is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TraceContexts {
  /** Bytes in a trace id (32 hex characters). */
  public static final int TRACE_ID_BYTES = 16;
  /** Bytes in a span id (16 hex characters). */
  public static final int SPAN_ID_BYTES = 8;
  /** Baggage key carrying the operation that started the hop. */
  public static final String OPERATION_BAGGAGE_KEY = "operation";

  private static final SecureRandom RANDOM = new SecureRandom();
  private static final HexFormat HEX = HexFormat.of();

  private TraceContexts() {}

  /**
   * Starts a new trace tree.
   *
   * @param operationName name of the initiating operation
   * @param baggage propagated key/value pairs; may be {@code null}
   * @return sampled root context with fresh ids
   */
  public static TraceContext createRootSpan(String operationName, Map<String, String> baggage) {
    Objects.requireNonNull(operationName, "operationName");
    Map<String, String> merged = new LinkedHashMap<>();
    if (baggage != null) {
      merged.putAll(baggage);
    }
    merged.put(OPERATION_BAGGAGE_KEY, operationName);
    Map<String, Object> metadata = new HashMap<>();
    metadata.put(TraceContext.OPERATION_NAME_KEY, operationName);
    return new TraceContext(
        newTraceId(), newSpanId(), null, true, 0, merged, Instant.now(), metadata);
  }

  public static TraceContext createRootSpan(String operationName) {
    return createRootSpan(operationName, Map.of());
  }

  /**
   * Derives a child hop.
   *
   * <p>The trace id, sampling decision, and flags are inherited; baggage is merged with the child's entries
   * winning on collision; parent metadata is copied and the operation name replaced.</p>
   *
   * @param parent parent hop
   * @param operationName name of the child operation
   * @param baggage child baggage; may be {@code null}
   * @return child context
   */
  public static TraceContext createChildSpan(TraceContext parent, String operationName, Map<String, String> baggage) {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(operationName, "operationName");
    Map<String, String> merged = new LinkedHashMap<>(parent.baggage());
    if (baggage != null) {
      baggage.forEach((key, value) -> {
        if (key != null && value != null) {
          merged.put(key, value);
        }
      });
    }
    Map<String, Object> metadata = new HashMap<>(parent.metadata());
    metadata.put(TraceContext.OPERATION_NAME_KEY, operationName);
    return new TraceContext(
        parent.traceId(),
        newSpanId(),
        parent.spanId(),
        parent.sampled(),
        parent.flags(),
        merged,
        Instant.now(),
        metadata);
  }

  public static TraceContext createChildSpan(TraceContext parent, String operationName) {
    return createChildSpan(parent, operationName, Map.of());
  }

  /**
   * Builds an unsampled context for work that runs while the tracing backend declines spans.
   *
   * @param parent optional parent whose trace id is kept; may be {@code null}
   * @param operationName operation name
   * @return context with {@code sampled == false}
   */
  public static TraceContext unsampled(TraceContext parent, String operationName) {
    TraceContext context = parent == null
        ? createRootSpan(operationName)
        : createChildSpan(parent, operationName);
    return context.withSampled(false);
  }

  static String newTraceId() {
    return randomHex(TRACE_ID_BYTES);
  }

  static String newSpanId() {
    return randomHex(SPAN_ID_BYTES);
  }

  private static String randomHex(int bytes) {
    byte[] buffer = new byte[bytes];
    RANDOM.nextBytes(buffer);
    return HEX.formatHex(buffer);
  }
}
