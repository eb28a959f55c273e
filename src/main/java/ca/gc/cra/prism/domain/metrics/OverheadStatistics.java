package ca.gc.cra.prism.domain.metrics;

/**
 * Rolling-window figures over the observability layer's own per-operation cost.
 *
 * @param averageMs mean sample
 * @param maxMs largest sample
 * @param minMs smallest sample
 * @param p95Ms 95th percentile sample
 * @param totalOperations samples currently in the window
 * @param withinThreshold {@code true} when {@code p95Ms} is within the budget
 * @since 0.1.0
 */
public record OverheadStatistics(
    double averageMs, double maxMs, double minMs, double p95Ms, int totalOperations, boolean withinThreshold) {
  private static final OverheadStatistics EMPTY = new OverheadStatistics(0d, 0d, 0d, 0d, 0, true);

  public static OverheadStatistics empty() {
    return EMPTY;
  }
}
