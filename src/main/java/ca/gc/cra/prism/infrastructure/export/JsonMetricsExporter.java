package ca.gc.cra.prism.infrastructure.export;

import ca.gc.cra.prism.application.port.MetricsSerializerPort;
import ca.gc.cra.prism.domain.metrics.ObservabilityMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Objects;

/**
 * Renders the consolidated metrics view as pretty-printed JSON with ISO-8601 timestamps.
 *
 * @since 0.1.0
 */
public final class JsonMetricsExporter implements MetricsSerializerPort {
  private final ObjectMapper mapper;

  public JsonMetricsExporter() {
    this(new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT));
  }

  JsonMetricsExporter(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String toJson(ObservabilityMetrics metrics) {
    Objects.requireNonNull(metrics, "metrics");
    try {
      return mapper.writeValueAsString(metrics);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize metrics", ex);
    }
  }
}
