package ca.gc.cra.prism.application.metrics;

import ca.gc.cra.prism.domain.metrics.HistogramSnapshot;
import ca.gc.cra.prism.domain.metrics.MetricSeries;
import ca.gc.cra.prism.domain.metrics.MetricType;
import ca.gc.cra.prism.domain.metrics.MetricsSnapshot;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link MetricsSnapshot} in the Prometheus text exposition format.
 *
 * <p>Counters come first, then gauges, then histograms. One {@code # TYPE} line precedes the series of each
 * metric name. Histogram series expand to cumulative {@code _bucket} lines ending with {@code le="+Inf"},
 * followed by {@code _sum} and {@code _count}.</p>
 *
 * @since 0.1.0
 */
public final class PrometheusFormatter {
  private static final String INF = "+Inf";

  private PrometheusFormatter() {}

  public static String format(MetricsSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    StringBuilder out = new StringBuilder();
    appendScalars(out, snapshot.counters(), MetricType.COUNTER);
    appendScalars(out, snapshot.gauges(), MetricType.GAUGE);
    String currentName = null;
    for (Map.Entry<MetricSeries, HistogramSnapshot> entry : snapshot.histograms().entrySet()) {
      MetricSeries series = entry.getKey();
      if (!series.name().equals(currentName)) {
        currentName = series.name();
        typeLine(out, currentName, MetricType.HISTOGRAM);
      }
      appendHistogram(out, series, entry.getValue());
    }
    return out.toString();
  }

  /**
   * Formats a sample value; integral values drop the fractional part.
   *
   * @param value sample value
   * @return exposition token
   */
  static String formatNumber(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? INF : "-Inf";
    }
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  private static void appendScalars(StringBuilder out, Map<MetricSeries, Double> series, MetricType type) {
    String currentName = null;
    for (Map.Entry<MetricSeries, Double> entry : series.entrySet()) {
      String name = entry.getKey().name();
      if (!name.equals(currentName)) {
        currentName = name;
        typeLine(out, name, type);
      }
      out.append(entry.getKey().key()).append(' ').append(formatNumber(entry.getValue())).append('\n');
    }
  }

  private static void appendHistogram(StringBuilder out, MetricSeries series, HistogramSnapshot histogram) {
    String name = series.name();
    for (int i = 0; i < histogram.boundaries().size(); i++) {
      Map<String, String> labels = new LinkedHashMap<>(series.labels());
      labels.put("le", formatNumber(histogram.boundaries().get(i)));
      out.append(name).append("_bucket").append(MetricSeries.renderLabels(labels))
          .append(' ').append(histogram.cumulativeCounts().get(i)).append('\n');
    }
    String labelBlock = MetricSeries.renderLabels(series.labels());
    out.append(name).append("_sum").append(labelBlock).append(' ').append(formatNumber(histogram.sum())).append('\n');
    out.append(name).append("_count").append(labelBlock).append(' ').append(histogram.count()).append('\n');
  }

  private static void typeLine(StringBuilder out, String name, MetricType type) {
    out.append("# TYPE ").append(name).append(' ').append(type.expositionName()).append('\n');
  }
}
