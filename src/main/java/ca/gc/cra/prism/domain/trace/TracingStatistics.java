package ca.gc.cra.prism.domain.trace;

/**
 * Point-in-time figures reported by a tracing backend.
 *
 * @param totalTraces distinct trace ids among retained completed spans
 * @param activeSpans spans started but not yet finished
 * @param completedSpans retained finished spans
 * @param samplingRate current sampling rate in {@code [0, 1]}
 * @param averageSpanDurationMs mean duration of retained finished spans
 * @since 0.1.0
 */
public record TracingStatistics(
    long totalTraces,
    int activeSpans,
    int completedSpans,
    double samplingRate,
    double averageSpanDurationMs) {

  /**
   * Returns statistics for a backend that records nothing.
   *
   * @param samplingRate sampling rate to report
   * @return zeroed statistics
   */
  public static TracingStatistics empty(double samplingRate) {
    return new TracingStatistics(0L, 0, 0, samplingRate, 0d);
  }
}
