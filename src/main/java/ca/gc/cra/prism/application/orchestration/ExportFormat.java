package ca.gc.cra.prism.application.orchestration;

import java.util.Locale;

/**
 * Formats accepted by {@link ObservabilityManager#exportMetrics(ExportFormat)}.
 *
 * @since 0.1.0
 */
public enum ExportFormat {
  PROMETHEUS,
  JSON;

  /**
   * Parses a format name, ignoring case.
   *
   * @param value format name
   * @return matching format
   * @throws IllegalArgumentException if the name is blank or unsupported
   */
  public static ExportFormat parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Unsupported export format: " + value);
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "prometheus" -> PROMETHEUS;
      case "json" -> JSON;
      default -> throw new IllegalArgumentException("Unsupported export format: " + value);
    };
  }
}
