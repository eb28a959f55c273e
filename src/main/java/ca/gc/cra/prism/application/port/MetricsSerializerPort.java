package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.metrics.ObservabilityMetrics;

/**
 * Port rendering the consolidated metrics view as a JSON document.
 *
 * @since 0.1.0
 * @see ca.gc.cra.prism.infrastructure.export.JsonMetricsExporter
 */
@FunctionalInterface
public interface MetricsSerializerPort {
  /**
   * Serializes a metrics view.
   *
   * @param metrics view to render
   * @return JSON text
   * @throws IllegalStateException when serialization fails
   */
  String toJson(ObservabilityMetrics metrics);
}
