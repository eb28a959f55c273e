package ca.gc.cra.prism.application.port;

import java.util.Map;

/**
 * <strong>What:</strong> Port mirroring aggregated metric writes to an external metrics backend.
 * <p><strong>Why:</strong> Lets the collector push the same counters, gauges, and histograms over OTLP without
 * binding the application layer to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the collector
 * timer and request threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 *
 * @implNote Consumers must not pass {@code null} metric names; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Adds {@code delta} to the named counter series.
   *
   * @param name metric name, for example {@code agent_actions_total}
   * @param delta non-negative increment
   * @param labels series labels; never {@code null}
   */
  void increment(String name, double delta, Map<String, String> labels);

  /**
   * Records the latest value of a gauge series.
   *
   * @param name metric name
   * @param value current value
   * @param labels series labels; never {@code null}
   */
  void gauge(String name, double value, Map<String, String> labels);

  /**
   * Adds a histogram observation.
   *
   * @param name metric name
   * @param value observed value, usually milliseconds
   * @param labels series labels; never {@code null}
   */
  void observe(String name, double value, Map<String, String> labels);

  /**
   * Pushes buffered data to the backend, if the adapter buffers.
   */
  default void flush() {}

  /**
   * Metrics implementation that ignores all updates; used by tests and when export is disabled.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String name, double delta, Map<String, String> labels) {}

    @Override public void gauge(String name, double value, Map<String, String> labels) {}

    @Override public void observe(String name, double value, Map<String, String> labels) {}
  };
}
