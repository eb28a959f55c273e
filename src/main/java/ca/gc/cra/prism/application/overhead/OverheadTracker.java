package ca.gc.cra.prism.application.overhead;

import ca.gc.cra.prism.domain.metrics.OverheadStatistics;
import ca.gc.cra.prism.validation.Numbers;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;

/**
 * <strong>What:</strong> Rolling statistics over the observability layer's own per-operation cost.
 * <p><strong>Why:</strong> Feeds the self-throttling loop; instrumentation that grows expensive lowers its own
 * fidelity instead of slowing the host.</p>
 * <p><strong>Thread-safety:</strong> All state is guarded by one lock.</p>
 * <p><strong>Performance:</strong> {@link #recordOverhead(double)} is O(1) with a running sum;
 * {@link #getStatistics()} sorts a copy of the window, bounded by {@link #WINDOW_SIZE}.</p>
 *
 * @since 0.1.0
 */
public final class OverheadTracker {
  /** Samples retained; the oldest is evicted on overflow. */
  public static final int WINDOW_SIZE = 1_000;
  /** Samples required before {@link #isOverheadExcessive()} can report {@code true}. */
  public static final int MIN_SAMPLES = 100;

  private final Object lock = new Object();
  private final Deque<Double> window = new ArrayDeque<>(WINDOW_SIZE);
  private double runningSum;
  private volatile double budgetMs;

  /**
   * Creates a tracker.
   *
   * @param budgetMs p95 cost considered acceptable, in milliseconds
   */
  public OverheadTracker(double budgetMs) {
    setBudgetMs(budgetMs);
  }

  /**
   * Adds a sample; negative or non-finite values are clamped to zero.
   *
   * @param durationMs measured bookkeeping cost
   */
  public void recordOverhead(double durationMs) {
    double sample = Double.isFinite(durationMs) && durationMs > 0d ? durationMs : 0d;
    synchronized (lock) {
      if (window.size() == WINDOW_SIZE) {
        runningSum -= window.removeFirst();
      }
      window.addLast(sample);
      runningSum += sample;
    }
  }

  /**
   * Computes the window figures.
   *
   * <p>The p95 is the element at index {@code floor(n * 0.95)} of the sorted window, clamped to {@code n - 1}.</p>
   *
   * @return statistics; zeros with {@code withinThreshold == true} when empty
   */
  public OverheadStatistics getStatistics() {
    double[] samples;
    double sum;
    synchronized (lock) {
      if (window.isEmpty()) {
        return OverheadStatistics.empty();
      }
      samples = new double[window.size()];
      int i = 0;
      for (Double value : window) {
        samples[i++] = value;
      }
      sum = runningSum;
    }
    Arrays.sort(samples);
    int n = samples.length;
    double p95 = samples[Math.min(n - 1, (int) Math.floor(n * 0.95d))];
    return new OverheadStatistics(
        sum / n, samples[n - 1], samples[0], p95, n, p95 <= budgetMs);
  }

  /**
   * Indicates whether the p95 exceeds the budget once enough samples exist.
   *
   * @return {@code true} when not within threshold and at least {@link #MIN_SAMPLES} samples are retained
   */
  public boolean isOverheadExcessive() {
    OverheadStatistics statistics = getStatistics();
    return !statistics.withinThreshold() && statistics.totalOperations() >= MIN_SAMPLES;
  }

  public double getBudgetMs() {
    return budgetMs;
  }

  public void setBudgetMs(double budgetMs) {
    this.budgetMs = Numbers.requireRange("overhead.maxOverheadMs", budgetMs, 0.001d, 60_000d);
  }

  /** Discards every sample. */
  public void reset() {
    synchronized (lock) {
      window.clear();
      runningSum = 0d;
    }
  }
}
