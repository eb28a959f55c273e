package ca.gc.cra.prism.domain.metrics;

import java.util.Locale;

/**
 * Shapes a metric series can take.
 *
 * @since 0.1.0
 */
public enum MetricType {
  /** Monotonic accumulator. */
  COUNTER,
  /** Last-write-wins value. */
  GAUGE,
  /** Sum, count, and cumulative bucket counts. */
  HISTOGRAM;

  /**
   * Returns the type token used on {@code # TYPE} exposition lines.
   *
   * @return lower-case type name
   */
  public String expositionName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a type name, ignoring case.
   *
   * @param value type text; must not be {@code null}
   * @return matching type
   * @throws IllegalArgumentException if the name is unknown
   */
  public static MetricType parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("metric type must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported metric type: " + value, ex);
    }
  }
}
