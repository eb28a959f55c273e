package ca.gc.cra.prism.infrastructure.export;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.prism.domain.health.HealthSummary;
import ca.gc.cra.prism.domain.metrics.AgentSummary;
import ca.gc.cra.prism.domain.metrics.ObservabilityMetrics;
import ca.gc.cra.prism.domain.metrics.SelfMetrics;
import ca.gc.cra.prism.domain.metrics.SystemMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonMetricsExporterTest {
  private static final Instant TIMESTAMP = Instant.parse("2024-03-01T12:00:00Z");

  @Test
  void rendersIsoTimestampsAndNestedFigures() throws Exception {
    ObservabilityMetrics metrics = new ObservabilityMetrics(
        TIMESTAMP,
        new SystemMetrics(SystemMetrics.MemoryStats.of(256L, 1_024L), 12.5d, 60d, 0d, Map.of()),
        Map.of("agent-1", new AgentSummary("agent-1", Map.of(AgentSummary.ERRORS, 2d), 0)),
        Map.of(),
        Map.of(),
        Map.of(),
        HealthSummary.unknown(),
        new SelfMetrics(7L, 3L, 1L, 0.25d));

    JsonNode root = new ObjectMapper().readTree(new JsonMetricsExporter().toJson(metrics));

    assertEquals("2024-03-01T12:00:00Z", root.path("timestamp").asText());
    assertEquals(0.25d, root.path("system").path("memory").path("usage").asDouble());
    assertEquals(2d, root.path("agents").path("agent-1").path("counters").path("errors").asDouble());
    assertEquals(7L, root.path("observability").path("metricsCollected").asLong());
    assertEquals(3L, root.path("observability").path("tracesGenerated").asLong());
  }

  @Test
  void serializationFailureIsReportedAsIllegalState() {
    JsonMetricsExporter exporter = new JsonMetricsExporter(new ObjectMapper());
    ObservabilityMetrics metrics = new ObservabilityMetrics(
        TIMESTAMP, null, null, null, null, null, null, new SelfMetrics(0L, 0L, 0L, 0d));

    assertThrows(IllegalStateException.class, () -> exporter.toJson(metrics));
  }
}
