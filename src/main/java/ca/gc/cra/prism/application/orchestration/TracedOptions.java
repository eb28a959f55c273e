package ca.gc.cra.prism.application.orchestration;

import ca.gc.cra.prism.validation.Strings;
import java.util.Map;

/**
 * Options for the {@link Traced} wrappers.
 *
 * @param operationName span name
 * @param recordMetrics whether to record a {@code system} event with the elapsed time
 * @param metadata span tags and hook metadata
 * @since 0.1.0
 */
public record TracedOptions(String operationName, boolean recordMetrics, Map<String, Object> metadata) {

  public TracedOptions {
    operationName = Strings.requireNonBlank("operationName", operationName);
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Options that only trace.
   *
   * @param operationName span name
   * @return options without metric recording or metadata
   */
  public static TracedOptions named(String operationName) {
    return new TracedOptions(operationName, false, Map.of());
  }

  public TracedOptions withRecordMetrics(boolean value) {
    return new TracedOptions(operationName, value, metadata);
  }

  public TracedOptions withMetadata(Map<String, Object> value) {
    return new TracedOptions(operationName, recordMetrics, value);
  }
}
