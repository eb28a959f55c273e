package ca.gc.cra.prism.domain.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Detached copy of every aggregated series, ordered by series so exports are deterministic.
 *
 * @param counters counter values
 * @param gauges gauge values
 * @param histograms histogram copies
 * @since 0.1.0
 */
public record MetricsSnapshot(
    SortedMap<MetricSeries, Double> counters,
    SortedMap<MetricSeries, Double> gauges,
    SortedMap<MetricSeries, HistogramSnapshot> histograms) {

  private static final MetricsSnapshot EMPTY = new MetricsSnapshot(null, null, null);

  public MetricsSnapshot {
    counters = freeze(counters);
    gauges = freeze(gauges);
    histograms = freeze(histograms);
  }

  public static MetricsSnapshot empty() {
    return EMPTY;
  }

  public OptionalDouble counter(String name, Map<String, String> labels) {
    Double value = counters.get(MetricSeries.of(name, labels));
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public OptionalDouble gauge(String name, Map<String, String> labels) {
    Double value = gauges.get(MetricSeries.of(name, labels));
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public HistogramSnapshot histogram(String name, Map<String, String> labels) {
    return histograms.get(MetricSeries.of(name, labels));
  }

  /**
   * Sums every counter series sharing a metric name.
   *
   * @param name metric name
   * @return total across label sets
   */
  public double counterTotal(String name) {
    double total = 0d;
    for (Map.Entry<MetricSeries, Double> entry : counters.entrySet()) {
      if (entry.getKey().name().equals(name)) {
        total += entry.getValue();
      }
    }
    return total;
  }

  /**
   * Returns the number of distinct series across all shapes.
   *
   * @return series count
   */
  public int seriesCount() {
    return counters.size() + gauges.size() + histograms.size();
  }

  public boolean isEmpty() {
    return seriesCount() == 0;
  }

  private static <V> SortedMap<MetricSeries, V> freeze(Map<MetricSeries, V> source) {
    TreeMap<MetricSeries, V> copy = source == null ? new TreeMap<>() : new TreeMap<>(source);
    return Collections.unmodifiableSortedMap(copy);
  }
}
