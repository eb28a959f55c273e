package ca.gc.cra.prism.application.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.metrics.MetricsSnapshot;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PrometheusFormatterTest {

  @Test
  void formatsCountersGaugesAndHistograms() {
    MetricAggregator aggregator = new MetricAggregator();
    aggregator.recordCounter("requests_total", 2d, Map.of("route", "/a"));
    aggregator.recordCounter("requests_total", 1d, Map.of("route", "/b"));
    aggregator.recordGauge("queue_depth", 3.5d, Map.of());
    aggregator.recordHistogram("latency_ms", 7d, Map.of());

    List<String> lines = Arrays.asList(PrometheusFormatter.format(aggregator.getMetrics()).split("\n"));

    assertEquals("# TYPE requests_total counter", lines.get(0));
    assertEquals("requests_total{route=\"/a\"} 2", lines.get(1));
    assertEquals("requests_total{route=\"/b\"} 1", lines.get(2));
    assertEquals("# TYPE queue_depth gauge", lines.get(3));
    assertEquals("queue_depth 3.5", lines.get(4));
    assertEquals("# TYPE latency_ms histogram", lines.get(5));
    assertTrue(lines.contains("latency_ms_bucket{le=\"5\"} 0"));
    assertTrue(lines.contains("latency_ms_bucket{le=\"10\"} 1"));
    assertTrue(lines.contains("latency_ms_bucket{le=\"+Inf\"} 1"));
    assertTrue(lines.contains("latency_ms_sum 7"));
    assertTrue(lines.contains("latency_ms_count 1"));
  }

  @Test
  void typeLineIsWrittenOncePerMetricName() {
    MetricAggregator aggregator = new MetricAggregator();
    aggregator.recordHistogram("latency_ms", 1d, Map.of("op", "a"));
    aggregator.recordHistogram("latency_ms", 1d, Map.of("op", "b"));

    String output = PrometheusFormatter.format(aggregator.getMetrics());

    assertEquals(output.indexOf("# TYPE latency_ms histogram"), output.lastIndexOf("# TYPE latency_ms histogram"));
    assertTrue(output.contains("latency_ms_bucket{op=\"b\",le=\"1\"} 1"));
  }

  @Test
  void emptySnapshotFormatsToEmptyString() {
    assertEquals("", PrometheusFormatter.format(MetricsSnapshot.empty()));
  }

  @Test
  void numbersUseIntegralFormWhenExact() {
    assertEquals("1000", PrometheusFormatter.formatNumber(1_000d));
    assertEquals("0.25", PrometheusFormatter.formatNumber(0.25d));
    assertEquals("+Inf", PrometheusFormatter.formatNumber(Double.POSITIVE_INFINITY));
  }
}
