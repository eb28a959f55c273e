package ca.gc.cra.prism.application.metrics;

import ca.gc.cra.prism.domain.metrics.HistogramSnapshot;
import ca.gc.cra.prism.domain.metrics.MetricSeries;
import ca.gc.cra.prism.domain.metrics.MetricsSnapshot;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> In-memory counters, gauges, and histograms keyed by name plus sorted labels.
 * <p><strong>Why:</strong> Label permutations collapse into one {@link MetricSeries}, which keeps exports
 * deterministic and cardinality predictable.</p>
 * <p><strong>Thread-safety:</strong> One lock per table. Counters and histograms add under their lock so the
 * collector timer and request threads never lose updates; gauges are last-write-wins.</p>
 * <p><strong>Performance:</strong> O(1) per write plus the bucket scan for histograms; {@link #getMetrics()}
 * copies every series.</p>
 *
 * @since 0.1.0
 */
public final class MetricAggregator {
  /** Histogram upper bounds in milliseconds; the last bucket is unbounded. */
  public static final List<Double> DEFAULT_BUCKETS = List.of(
      1d, 5d, 10d, 25d, 50d, 100d, 250d, 500d, 1_000d, 2_500d, 5_000d, 10_000d, Double.POSITIVE_INFINITY);

  private final Object counterLock = new Object();
  private final Object gaugeLock = new Object();
  private final Object histogramLock = new Object();
  private final Map<MetricSeries, Double> counters = new HashMap<>();
  private final Map<MetricSeries, Double> gauges = new HashMap<>();
  private final Map<MetricSeries, Histogram> histograms = new HashMap<>();

  /**
   * Adds {@code delta} to a counter series.
   *
   * @param name metric name
   * @param delta non-negative increment
   * @param labels series labels; may be {@code null}
   * @throws IllegalArgumentException if {@code delta} is negative or not finite
   */
  public void recordCounter(String name, double delta, Map<String, String> labels) {
    requireFinite(name, delta);
    if (delta < 0d) {
      throw new IllegalArgumentException("counter " + name + " cannot be decremented");
    }
    MetricSeries series = MetricSeries.of(name, labels);
    synchronized (counterLock) {
      counters.merge(series, delta, Double::sum);
    }
  }

  public void recordCounter(String name, Map<String, String> labels) {
    recordCounter(name, 1d, labels);
  }

  /**
   * Replaces the value of a gauge series.
   *
   * @param name metric name
   * @param value current value
   * @param labels series labels; may be {@code null}
   */
  public void recordGauge(String name, double value, Map<String, String> labels) {
    requireFinite(name, value);
    MetricSeries series = MetricSeries.of(name, labels);
    synchronized (gaugeLock) {
      gauges.put(series, value);
    }
  }

  /**
   * Adds an observation to a histogram series.
   *
   * @param name metric name
   * @param value observation, usually milliseconds
   * @param labels series labels; may be {@code null}
   */
  public void recordHistogram(String name, double value, Map<String, String> labels) {
    requireFinite(name, value);
    MetricSeries series = MetricSeries.of(name, labels);
    synchronized (histogramLock) {
      histograms.computeIfAbsent(series, ignored -> new Histogram()).observe(value);
    }
  }

  /**
   * Records a timed operation as histogram {@code <name>_duration} plus counter {@code <name>_total}.
   *
   * @param name base metric name
   * @param durationMs elapsed milliseconds
   * @param labels series labels; may be {@code null}
   */
  public void recordTiming(String name, double durationMs, Map<String, String> labels) {
    recordHistogram(name + "_duration", durationMs, labels);
    recordCounter(name + "_total", 1d, labels);
  }

  /**
   * Returns a detached copy of every series.
   *
   * @return immutable snapshot
   */
  public MetricsSnapshot getMetrics() {
    Map<MetricSeries, Double> counterCopy;
    synchronized (counterLock) {
      counterCopy = new HashMap<>(counters);
    }
    Map<MetricSeries, Double> gaugeCopy;
    synchronized (gaugeLock) {
      gaugeCopy = new HashMap<>(gauges);
    }
    Map<MetricSeries, HistogramSnapshot> histogramCopy = new HashMap<>();
    synchronized (histogramLock) {
      histograms.forEach((series, histogram) -> histogramCopy.put(series, histogram.snapshot()));
    }
    return new MetricsSnapshot(
        new TreeMap<>(counterCopy),
        new TreeMap<>(gaugeCopy),
        new TreeMap<>(histogramCopy));
  }

  /**
   * Returns the number of distinct series across all tables.
   *
   * @return series count
   */
  public int seriesCount() {
    int total;
    synchronized (counterLock) {
      total = counters.size();
    }
    synchronized (gaugeLock) {
      total += gauges.size();
    }
    synchronized (histogramLock) {
      total += histograms.size();
    }
    return total;
  }

  /** Drops every series. */
  public void reset() {
    synchronized (counterLock) {
      counters.clear();
    }
    synchronized (gaugeLock) {
      gauges.clear();
    }
    synchronized (histogramLock) {
      histograms.clear();
    }
  }

  private static void requireFinite(String name, double value) {
    Objects.requireNonNull(name, "name");
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("metric " + name + " value must be finite (was " + value + ")");
    }
  }

  /** Guarded by {@code histogramLock}. */
  private static final class Histogram {
    private final long[] buckets = new long[DEFAULT_BUCKETS.size()];
    private double sum;
    private long count;

    void observe(double value) {
      sum += value;
      count++;
      for (int i = 0; i < buckets.length; i++) {
        if (value <= DEFAULT_BUCKETS.get(i)) {
          buckets[i]++;
        }
      }
    }

    HistogramSnapshot snapshot() {
      List<Long> cumulative = new ArrayList<>(buckets.length);
      for (long bucket : buckets) {
        cumulative.add(bucket);
      }
      return new HistogramSnapshot(sum, count, DEFAULT_BUCKETS, cumulative);
    }
  }
}
