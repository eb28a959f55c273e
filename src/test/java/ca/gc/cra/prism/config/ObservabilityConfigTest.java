package ca.gc.cra.prism.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObservabilityConfigTest {

  @Test
  void emptyMapYieldsDefaults() {
    assertEquals(ObservabilityConfig.defaults(), ObservabilityConfig.fromMap(Map.of()));
    assertEquals(ObservabilityConfig.defaults(), ObservabilityConfig.fromMap(null));
  }

  @Test
  void parsesDottedKeys() {
    Map<String, String> args = new HashMap<>();
    args.put("enabled", "true");
    args.put("tracing.sampleRate", " 0.25 ");
    args.put("tracing.maxSpans", "500");
    args.put("metrics.collectionIntervalMs", "2000");
    args.put("health.enableHealthChecks", "false");
    args.put("overhead.maxOverheadMs", "2.5");
    args.put("middleware.rateLimit.enabled", "true");
    args.put("middleware.rateLimit.requestsPerMinute", "60");

    ObservabilityConfig config = ObservabilityConfig.fromMap(args);

    assertTrue(config.enabled());
    assertEquals(0.25d, config.tracing().sampleRate());
    assertEquals(500, config.tracing().maxSpans());
    assertEquals(2_000L, config.metrics().collectionIntervalMs());
    assertFalse(config.health().enableHealthChecks());
    assertEquals(2.5d, config.overhead().maxOverheadMs());
    assertTrue(config.middleware().rateLimitEnabled());
    assertEquals(60, config.middleware().requestsPerMinute());
  }

  @Test
  void blankValuesKeepDefaults() {
    ObservabilityConfig config = ObservabilityConfig.fromMap(Map.of("tracing.sampleRate", " ", "enabled", ""));

    assertEquals(1.0d, config.tracing().sampleRate());
    assertTrue(config.enabled());
  }

  @Test
  void rejectsOutOfRangeValues() {
    assertThrows(IllegalArgumentException.class,
        () -> ObservabilityConfig.fromMap(Map.of("tracing.sampleRate", "1.5")));
    assertThrows(IllegalArgumentException.class,
        () -> ObservabilityConfig.fromMap(Map.of("tracing.maxSpans", "50")));
    assertThrows(IllegalArgumentException.class,
        () -> ObservabilityConfig.fromMap(Map.of("metrics.collectionIntervalMs", "31000")));
    assertThrows(IllegalArgumentException.class,
        () -> ObservabilityConfig.fromMap(Map.of("overhead.maxOverheadMs", "0")));
  }

  @Test
  void rejectsUnparseableNumbers() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ObservabilityConfig.fromMap(Map.of("metrics.collectionIntervalMs", "soon")));

    assertTrue(ex.getMessage().contains("metrics.collectionIntervalMs"));
  }

  @Test
  void flatMapRoundTrips() {
    ObservabilityConfig config = ObservabilityConfig.fromMap(Map.of(
        "tracing.sampleRate", "0.3",
        "middleware.logging.enabled", "true",
        "overhead.throttlingEnabled", "false"));

    assertEquals(config, ObservabilityConfig.fromMap(config.toFlatMap()));
  }

  @Test
  void applyChangesOnlyUpdatedFields() {
    ObservabilityConfig base = ObservabilityConfig.defaults();

    ObservabilityConfig next = base.apply(ConfigUpdate.builder()
        .sampleRate(0.5d)
        .collectionIntervalMs(10_000L)
        .build());

    assertEquals(0.5d, next.tracing().sampleRate());
    assertEquals(10_000L, next.metrics().collectionIntervalMs());
    assertEquals(base.tracing().maxSpans(), next.tracing().maxSpans());
    assertSame(base.overhead(), next.overhead());
    assertSame(base.middleware(), next.middleware());
    assertEquals(base.health(), next.health());
  }
}
