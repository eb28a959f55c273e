package ca.gc.cra.prism.application.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.domain.metrics.ModelUsage;
import ca.gc.cra.prism.domain.metrics.PortalSummary;
import org.junit.jupiter.api.Test;

class PortalMetricsCollectorTest {

  @Test
  void aggregatesRequestsPerPortalAndModel() {
    PortalMetricsCollector collector = new PortalMetricsCollector();
    collector.recordRequest("openai", "gpt-4", 100d, 50L, false);
    collector.recordRequest("openai", "gpt-4", 300d, 70L, true);
    collector.recordRequest("openai", null, 200d, 0L, false);

    PortalSummary summary = collector.getPortalMetrics("openai").orElseThrow();

    assertEquals(3L, summary.requestCount());
    assertEquals(1L, summary.errorCount());
    assertEquals(200d, summary.averageLatencyMs());
    assertEquals(120L, summary.tokenUsage());
    assertEquals(new ModelUsage(2L, 1L, 120L), summary.models().get("gpt-4"));
    assertEquals(1, summary.models().size());
  }

  @Test
  void unknownPortalIsEmpty() {
    assertTrue(new PortalMetricsCollector().getPortalMetrics("missing").isEmpty());
  }
}
