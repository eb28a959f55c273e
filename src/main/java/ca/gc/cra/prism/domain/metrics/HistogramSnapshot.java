package ca.gc.cra.prism.domain.metrics;

import java.util.List;

/**
 * Immutable copy of one histogram series.
 *
 * @param sum total of all observations
 * @param count number of observations
 * @param boundaries upper bounds in ascending order, ending with positive infinity
 * @param cumulativeCounts observations {@code <=} the boundary at the same index
 * @since 0.1.0
 */
public record HistogramSnapshot(double sum, long count, List<Double> boundaries, List<Long> cumulativeCounts) {

  public HistogramSnapshot {
    boundaries = List.copyOf(boundaries);
    cumulativeCounts = List.copyOf(cumulativeCounts);
    if (boundaries.size() != cumulativeCounts.size()) {
      throw new IllegalArgumentException("boundaries and counts must have the same size");
    }
  }

  /**
   * Returns the cumulative count for a boundary.
   *
   * @param boundary upper bound, exactly as configured
   * @return cumulative count, or {@code 0} when the boundary is not configured
   */
  public long bucket(double boundary) {
    int index = boundaries.indexOf(boundary);
    return index < 0 ? 0L : cumulativeCounts.get(index);
  }

  /**
   * Returns the mean observation.
   *
   * @return {@code sum / count}, or {@code 0} when empty
   */
  public double average() {
    return count == 0 ? 0d : sum / count;
  }
}
