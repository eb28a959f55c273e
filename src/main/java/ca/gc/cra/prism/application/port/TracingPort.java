package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.trace.SpanStatus;
import ca.gc.cra.prism.domain.trace.TraceContext;
import ca.gc.cra.prism.domain.trace.TracingStatistics;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Port to the tracing backend that records spans.
 * <p><strong>Why:</strong> The orchestrator creates and finishes spans without knowing where they are stored or
 * how sampling is decided.</p>
 * <p><strong>Role:</strong> Implemented by {@code InMemoryTracingSystem}; {@link #NO_OP} declines every span.</p>
 * <p><strong>Contract:</strong> A context returned by a {@code start*} method must be finished exactly once with
 * {@link #finishTrace(TraceContext, SpanStatus)}. An empty result means the backend declined (disabled or not
 * sampled) and nothing must be finished.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public interface TracingPort {
  /**
   * Starts a root span.
   *
   * @param operationName span name
   * @param tags initial span tags; never {@code null}
   * @return sampled context, or empty when declined
   */
  Optional<TraceContext> startTrace(String operationName, Map<String, Object> tags);

  /**
   * Starts a span under {@code parent}; unsampled parents yield no span.
   *
   * @param parent parent context
   * @param operationName span name
   * @param tags initial span tags; never {@code null}
   * @return sampled child context, or empty when declined
   */
  Optional<TraceContext> startChildTrace(TraceContext parent, String operationName, Map<String, Object> tags);

  /**
   * Adds tags to an open span; unknown spans are ignored.
   *
   * @param context span context
   * @param tags tags to merge
   */
  void addTags(TraceContext context, Map<String, Object> tags);

  /**
   * Sets the status of an open span without finishing it.
   *
   * @param context span context
   * @param status new status
   */
  void setTraceStatus(TraceContext context, SpanStatus status);

  /**
   * Finishes a span; a second call for the same span is ignored.
   *
   * @param context span context
   * @param status final status; {@code null} keeps the status already set
   */
  void finishTrace(TraceContext context, SpanStatus status);

  TracingStatistics getStatistics();

  double getSamplingRate();

  /**
   * Changes the fraction of root traces recorded.
   *
   * @param rate sampling rate in {@code [0, 1]}
   */
  void setSamplingRate(double rate);

  void setEnabled(boolean enabled);

  /** Backend that records nothing and declines every span. */
  TracingPort NO_OP = new TracingPort() {
    @Override
    public Optional<TraceContext> startTrace(String operationName, Map<String, Object> tags) {
      return Optional.empty();
    }

    @Override
    public Optional<TraceContext> startChildTrace(
        TraceContext parent, String operationName, Map<String, Object> tags) {
      return Optional.empty();
    }

    @Override public void addTags(TraceContext context, Map<String, Object> tags) {}

    @Override public void setTraceStatus(TraceContext context, SpanStatus status) {}

    @Override public void finishTrace(TraceContext context, SpanStatus status) {}

    @Override
    public TracingStatistics getStatistics() {
      return TracingStatistics.empty(0d);
    }

    @Override
    public double getSamplingRate() {
      return 0d;
    }

    @Override public void setSamplingRate(double rate) {}

    @Override public void setEnabled(boolean enabled) {}
  };
}
