package ca.gc.cra.prism.infrastructure.tracing;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.port.TracingPort;
import ca.gc.cra.prism.application.trace.TraceContexts;
import ca.gc.cra.prism.config.TracingSettings;
import ca.gc.cra.prism.domain.trace.SpanStatus;
import ca.gc.cra.prism.domain.trace.TraceContext;
import ca.gc.cra.prism.domain.trace.TracingStatistics;
import ca.gc.cra.prism.validation.Numbers;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Default {@link TracingPort} that keeps spans in memory.
 * <p><strong>Why:</strong> Gives the orchestrator a working tracer without an external collector; finished spans can
 * be read back through {@link #exportSpans()}.</p>
 * <p><strong>Sampling:</strong> Root spans are sampled by hashing the trace id against the sampling rate, so every
 * process makes the same decision for a given trace. Child spans follow their parent.</p>
 * <p><strong>Bounds:</strong> At most {@code maxSpans} active spans are tracked and at most {@code maxSpans} finished
 * spans are retained; the oldest finished span is evicted first.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryTracingSystem implements TracingPort {
  private static final Logger log = LoggerFactory.getLogger(InMemoryTracingSystem.class);
  private static final int SAMPLE_HEX_DIGITS = 13;
  private static final double SAMPLE_SPACE = (double) (1L << 52);

  private final int maxSpans;
  private final ClockPort clock;
  private final Map<String, ActiveSpan> active = new ConcurrentHashMap<>();
  private final Deque<SpanRecord> finished = new ArrayDeque<>();
  private final Object finishedLock = new Object();

  private volatile boolean enabled;
  private volatile double samplingRate;

  /**
   * Creates a tracer from tracing settings.
   *
   * @param settings enable flag, sampling rate, and span cap
   * @param clock time source
   */
  public InMemoryTracingSystem(TracingSettings settings, ClockPort clock) {
    Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.maxSpans = settings.maxSpans();
    this.enabled = settings.enableTracing();
    this.samplingRate = settings.sampleRate();
  }

  @Override
  public Optional<TraceContext> startTrace(String operationName, Map<String, Object> tags) {
    Objects.requireNonNull(operationName, "operationName");
    if (!enabled) {
      return Optional.empty();
    }
    TraceContext root = TraceContexts.createRootSpan(operationName);
    if (!shouldSample(root.traceId())) {
      return Optional.empty();
    }
    return track(root, tags);
  }

  @Override
  public Optional<TraceContext> startChildTrace(TraceContext parent, String operationName, Map<String, Object> tags) {
    Objects.requireNonNull(parent, "parent");
    Objects.requireNonNull(operationName, "operationName");
    if (!enabled || !parent.sampled()) {
      return Optional.empty();
    }
    return track(TraceContexts.createChildSpan(parent, operationName), tags);
  }

  @Override
  public void addTags(TraceContext context, Map<String, Object> tags) {
    ActiveSpan span = context == null ? null : active.get(context.spanId());
    if (span != null && tags != null) {
      span.putTags(tags);
    }
  }

  /**
   * Adds a timestamped event to an active span; ignored once the span finished.
   *
   * @param context span to annotate
   * @param name event name
   * @param attributes event attributes; may be {@code null}
   */
  public void addEvent(TraceContext context, String name, Map<String, Object> attributes) {
    Objects.requireNonNull(name, "name");
    ActiveSpan span = context == null ? null : active.get(context.spanId());
    if (span != null) {
      span.addEvent(new SpanRecord.SpanEvent(name, clock.now(), attributes));
    }
  }

  @Override
  public void setTraceStatus(TraceContext context, SpanStatus status) {
    ActiveSpan span = context == null ? null : active.get(context.spanId());
    if (span != null && status != null) {
      span.status = status;
    }
  }

  @Override
  public void finishTrace(TraceContext context, SpanStatus status) {
    if (context == null) {
      return;
    }
    ActiveSpan span = active.remove(context.spanId());
    if (span == null) {
      return;
    }
    if (status != null) {
      span.status = status;
    }
    double durationMs = Math.max(0L, clock.nanoTime() - span.startNanos) / 1_000_000d;
    SpanRecord record = span.toRecord(durationMs);
    synchronized (finishedLock) {
      finished.addLast(record);
      while (finished.size() > maxSpans) {
        finished.removeFirst();
      }
    }
    if (record.status().isError()) {
      log.debug("Span {} ({}) finished with error: {}", record.operationName(), context.shortSpanId(),
          record.status().message());
    }
  }

  @Override
  public TracingStatistics getStatistics() {
    List<SpanRecord> spans = exportSpans();
    Set<String> traces = new HashSet<>();
    double total = 0d;
    for (SpanRecord span : spans) {
      traces.add(span.traceId());
      total += span.durationMs();
    }
    double average = spans.isEmpty() ? 0d : total / spans.size();
    return new TracingStatistics(traces.size(), active.size(), spans.size(), samplingRate, average);
  }

  @Override
  public double getSamplingRate() {
    return samplingRate;
  }

  @Override
  public void setSamplingRate(double rate) {
    this.samplingRate = Numbers.requireFraction("samplingRate", rate);
  }

  @Override
  public void setEnabled(boolean value) {
    this.enabled = value;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Returns the retained finished spans, oldest first.
   *
   * @return immutable copy
   */
  public List<SpanRecord> exportSpans() {
    synchronized (finishedLock) {
      return List.copyOf(finished);
    }
  }

  /**
   * Returns the retained finished spans of one trace, oldest first.
   *
   * @param traceId trace id
   * @return matching spans
   */
  public List<SpanRecord> getTrace(String traceId) {
    List<SpanRecord> matches = new ArrayList<>();
    for (SpanRecord span : exportSpans()) {
      if (span.traceId().equals(traceId)) {
        matches.add(span);
      }
    }
    return matches;
  }

  /** Drops all active and finished spans. */
  public void clear() {
    active.clear();
    synchronized (finishedLock) {
      finished.clear();
    }
  }

  boolean shouldSample(String traceId) {
    double rate = samplingRate;
    if (rate >= 1d) {
      return true;
    }
    if (rate <= 0d) {
      return false;
    }
    return sampleFraction(traceId) < rate;
  }

  static double sampleFraction(String traceId) {
    if (traceId.length() >= SAMPLE_HEX_DIGITS) {
      try {
        long bits = Long.parseLong(traceId.substring(traceId.length() - SAMPLE_HEX_DIGITS), 16);
        return bits / SAMPLE_SPACE;
      } catch (NumberFormatException ex) {
        log.debug("Trace id {} is not hexadecimal; sampling by hash", traceId);
      }
    }
    return (traceId.hashCode() & Integer.MAX_VALUE) / (double) Integer.MAX_VALUE;
  }

  private Optional<TraceContext> track(TraceContext context, Map<String, Object> tags) {
    if (active.size() >= maxSpans) {
      log.debug("Active span limit {} reached; not recording {}", maxSpans, context.operationName());
      return Optional.empty();
    }
    ActiveSpan span = new ActiveSpan(context, clock.now(), clock.nanoTime());
    if (tags != null) {
      span.putTags(tags);
    }
    active.put(context.spanId(), span);
    return Optional.of(context);
  }

  private static final class ActiveSpan {
    private final TraceContext context;
    private final Instant startTime;
    private final long startNanos;
    private final Map<String, Object> tags = new LinkedHashMap<>();
    private final List<SpanRecord.SpanEvent> events = new ArrayList<>();
    private volatile SpanStatus status = SpanStatus.ok();

    private ActiveSpan(TraceContext context, Instant startTime, long startNanos) {
      this.context = context;
      this.startTime = startTime;
      this.startNanos = startNanos;
    }

    private synchronized void putTags(Map<String, Object> values) {
      values.forEach((key, value) -> {
        if (key != null && value != null) {
          tags.put(key, value);
        }
      });
    }

    private synchronized void addEvent(SpanRecord.SpanEvent event) {
      events.add(event);
    }

    private synchronized SpanRecord toRecord(double durationMs) {
      return new SpanRecord(
          context.traceId(),
          context.spanId(),
          context.parentSpanId(),
          context.operationName(),
          startTime,
          durationMs,
          status,
          tags,
          events);
    }
  }
}
