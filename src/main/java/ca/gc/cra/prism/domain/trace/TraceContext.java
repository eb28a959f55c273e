package ca.gc.cra.prism.domain.trace;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <strong>What:</strong> Identity and propagation record threaded through every traced call.
 * <p><strong>Why:</strong> Lets concurrent operations carry their own trace lineage without shared mutable
 * state; each hop derives a new context instead of mutating its parent.</p>
 * <p><strong>Role:</strong> Domain value created at the root of a traced operation or extracted from an inbound
 * carrier, discarded when the operation finishes.</p>
 * <p><strong>Thread-safety:</strong> Identity fields and baggage are immutable. {@link #metadata()} is a concurrent
 * map and is the only part annotated during execution.</p>
 *
 * @param traceId 32 hex characters shared by every span of one operation tree; never {@code null}
 * @param spanId 16 hex characters unique per hop; never {@code null}
 * @param parentSpanId span id of the parent hop; {@code null} for roots
 * @param sampled whether spans for this context are recorded
 * @param flags numeric propagation flags
 * @param baggage propagated key/value pairs; never {@code null}
 * @param startTime creation instant; never {@code null}
 * @param metadata execution annotations; never {@code null}
 * @since 0.1.0
 */
public record TraceContext(
    String traceId,
    String spanId,
    String parentSpanId,
    boolean sampled,
    int flags,
    Map<String, String> baggage,
    Instant startTime,
    Map<String, Object> metadata) {

  /** Metadata key holding the operation name of the hop. */
  public static final String OPERATION_NAME_KEY = "operationName";

  private static final int SHORT_ID_LENGTH = 8;

  /**
   * Validates identifiers and copies the supplied maps.
   */
  public TraceContext {
    traceId = Objects.requireNonNull(traceId, "traceId");
    spanId = Objects.requireNonNull(spanId, "spanId");
    if (parentSpanId != null && parentSpanId.isBlank()) {
      parentSpanId = null;
    }
    baggage = copyBaggage(baggage);
    startTime = Objects.requireNonNull(startTime, "startTime");
    ConcurrentHashMap<String, Object> annotations = new ConcurrentHashMap<>();
    if (metadata != null) {
      metadata.forEach((key, value) -> {
        if (key != null && value != null) {
          annotations.put(key, value);
        }
      });
    }
    metadata = annotations;
  }

  /**
   * Returns the parent span id when this context is a child hop.
   *
   * @return optional parent span id
   */
  public Optional<String> parent() {
    return Optional.ofNullable(parentSpanId);
  }

  /**
   * Indicates whether this context starts a trace tree.
   *
   * @return {@code true} when no parent span is linked
   */
  public boolean isRoot() {
    return parentSpanId == null;
  }

  /**
   * Returns the operation name recorded when the hop was created.
   *
   * @return operation name, or {@code "unknown"} when absent
   */
  public String operationName() {
    Object value = metadata.get(OPERATION_NAME_KEY);
    return value == null ? "unknown" : value.toString();
  }

  /**
   * Adds or replaces an execution annotation.
   *
   * @param key annotation key; must not be {@code null}
   * @param value annotation value; {@code null} removes the key
   */
  public void annotate(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      metadata.remove(key);
    } else {
      metadata.put(key, value);
    }
  }

  /**
   * Returns the trailing characters of the trace id, used where full ids would explode label cardinality.
   *
   * @return last eight characters of {@link #traceId()}
   */
  public String shortTraceId() {
    return tail(traceId);
  }

  /**
   * Returns the trailing characters of the span id.
   *
   * @return last eight characters of {@link #spanId()}
   */
  public String shortSpanId() {
    return tail(spanId);
  }

  /**
   * Returns a copy with a different sampling decision; identity, baggage and metadata are preserved.
   *
   * @param decision new sampling decision
   * @return this instance when unchanged, otherwise a copy
   */
  public TraceContext withSampled(boolean decision) {
    if (decision == sampled) {
      return this;
    }
    return new TraceContext(traceId, spanId, parentSpanId, decision, flags, baggage, startTime, metadata);
  }

  private static String tail(String id) {
    return id.length() <= SHORT_ID_LENGTH ? id : id.substring(id.length() - SHORT_ID_LENGTH);
  }

  private static Map<String, String> copyBaggage(Map<String, String> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, String> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    return Map.copyOf(copy);
  }
}
