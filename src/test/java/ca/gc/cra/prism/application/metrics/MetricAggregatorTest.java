package ca.gc.cra.prism.application.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.metrics.HistogramSnapshot;
import ca.gc.cra.prism.domain.metrics.MetricsSnapshot;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricAggregatorTest {
  private final MetricAggregator aggregator = new MetricAggregator();

  @Test
  void countersAccumulatePerLabelSet() {
    aggregator.recordCounter("requests_total", Map.of("route", "/a"));
    aggregator.recordCounter("requests_total", 2d, Map.of("route", "/a"));
    aggregator.recordCounter("requests_total", Map.of("route", "/b"));

    MetricsSnapshot snapshot = aggregator.getMetrics();

    assertEquals(3d, snapshot.counter("requests_total", Map.of("route", "/a")).orElseThrow());
    assertEquals(1d, snapshot.counter("requests_total", Map.of("route", "/b")).orElseThrow());
    assertEquals(4d, snapshot.counterTotal("requests_total"));
  }

  @Test
  void countersCannotDecrease() {
    assertThrows(IllegalArgumentException.class, () -> aggregator.recordCounter("requests_total", -1d, Map.of()));
  }

  @Test
  void nonFiniteValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> aggregator.recordGauge("queue_depth", Double.NaN, Map.of()));
    assertThrows(IllegalArgumentException.class,
        () -> aggregator.recordHistogram("latency_ms", Double.POSITIVE_INFINITY, Map.of()));
    assertTrue(aggregator.getMetrics().isEmpty());
  }

  @Test
  void gaugesKeepLastValue() {
    aggregator.recordGauge("queue_depth", 3d, null);
    aggregator.recordGauge("queue_depth", 1d, null);

    assertEquals(1d, aggregator.getMetrics().gauge("queue_depth", Map.of()).orElseThrow());
  }

  @Test
  void histogramBucketsAreCumulative() {
    aggregator.recordHistogram("latency_ms", 3d, Map.of());
    aggregator.recordHistogram("latency_ms", 30d, Map.of());
    aggregator.recordHistogram("latency_ms", 20_000d, Map.of());

    HistogramSnapshot histogram = aggregator.getMetrics().histogram("latency_ms", Map.of());

    assertEquals(3L, histogram.count());
    assertEquals(20_033d, histogram.sum());
    assertEquals(0L, histogram.bucket(1d));
    assertEquals(1L, histogram.bucket(5d));
    assertEquals(1L, histogram.bucket(25d));
    assertEquals(2L, histogram.bucket(50d));
    assertEquals(2L, histogram.bucket(10_000d));
    assertEquals(3L, histogram.bucket(Double.POSITIVE_INFINITY));
  }

  @Test
  void timingRecordsDurationAndCount() {
    aggregator.recordTiming("db_query", 12d, Map.of("table", "users"));

    MetricsSnapshot snapshot = aggregator.getMetrics();

    assertEquals(1L, snapshot.histogram("db_query_duration", Map.of("table", "users")).count());
    assertEquals(1d, snapshot.counter("db_query_total", Map.of("table", "users")).orElseThrow());
  }

  @Test
  void resetClearsEverySeries() {
    aggregator.recordCounter("a", Map.of());
    aggregator.recordGauge("b", 1d, Map.of());
    aggregator.recordHistogram("c", 1d, Map.of());
    assertEquals(3, aggregator.seriesCount());

    aggregator.reset();

    assertEquals(0, aggregator.seriesCount());
  }
}
