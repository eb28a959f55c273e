package ca.gc.cra.prism.infrastructure.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prism.application.metrics.MetricsCollector;
import ca.gc.cra.prism.application.middleware.MiddlewareManager;
import ca.gc.cra.prism.application.orchestration.ObservabilityManager;
import ca.gc.cra.prism.application.overhead.OverheadTracker;
import ca.gc.cra.prism.application.port.AlertingPort;
import ca.gc.cra.prism.application.port.HealthRegistryPort;
import ca.gc.cra.prism.application.port.MetricsPort;
import ca.gc.cra.prism.application.port.PerformanceSourcePort;
import ca.gc.cra.prism.config.ObservabilityConfig;
import ca.gc.cra.prism.config.YamlConfigLoader;
import ca.gc.cra.prism.infrastructure.export.JsonMetricsExporter;
import ca.gc.cra.prism.infrastructure.tracing.InMemoryTracingSystem;
import ca.gc.cra.prism.testing.FakeClock;
import ca.gc.cra.prism.testing.LogCapture;
import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigFileWatcherTest {
  @TempDir Path tempDir;

  private FakeClock clock;
  private ObservabilityManager manager;
  private Path file;
  private ConfigFileWatcher watcher;

  @BeforeEach
  void setUp() throws IOException {
    clock = new FakeClock();
    ObservabilityConfig config = ObservabilityConfig.defaults();
    manager = new ObservabilityManager(
        config,
        new InMemoryTracingSystem(config.tracing(), clock),
        AlertingPort.NO_OP,
        HealthRegistryPort.NO_OP,
        new MetricsCollector(
            config.metrics(),
            PerformanceSourcePort.NONE,
            HealthRegistryPort.NO_OP,
            MetricsPort.NO_OP,
            clock,
            Executors::newSingleThreadScheduledExecutor),
        new OverheadTracker(config.overhead().maxOverheadMs()),
        new MiddlewareManager(),
        new JsonMetricsExporter(),
        clock);
    file = tempDir.resolve("prism.yaml");
    writeSampleRate("1.0", FileTime.fromMillis(1_000_000L));
    watcher = new ConfigFileWatcher(
        file, () -> ObservabilityConfig.fromMap(YamlConfigLoader.load(file, "test").orElse(Map.of())), manager, clock);
  }

  @AfterEach
  void tearDown() {
    watcher.close();
    manager.close();
  }

  @Test
  void unchangedFileIsNotReloaded() {
    assertFalse(watcher.maybeReload());
  }

  @Test
  void modifiedFileIsAppliedToManager() throws IOException {
    writeSampleRate("0.2", FileTime.fromMillis(2_000_000L));

    assertTrue(watcher.maybeReload());

    assertEquals(0.2d, manager.getConfig().tracing().sampleRate());
  }

  @Test
  void checksAreSpacedByInterval() throws IOException {
    assertFalse(watcher.maybeReload());
    writeSampleRate("0.2", FileTime.fromMillis(2_000_000L));

    assertFalse(watcher.maybeReload());

    clock.advanceMillis(ConfigFileWatcher.DEFAULT_INTERVAL_MILLIS);
    assertTrue(watcher.maybeReload());
  }

  @Test
  void invalidFileKeepsCurrentSettings() throws IOException {
    writeSampleRate("3.0", FileTime.fromMillis(2_000_000L));

    try (LogCapture logs = LogCapture.attach(ConfigFileWatcher.class)) {
      assertFalse(watcher.maybeReload());
      assertEquals(1, logs.messages(Level.WARN).size());
    }
    assertEquals(1.0d, manager.getConfig().tracing().sampleRate());
  }

  @Test
  void changesOutsideHotReloadableKeysAreIgnored() throws IOException {
    Files.writeString(file, "test:\n  tracing:\n    sampleRate: 1.0\n    maxSpans: 500\n", StandardCharsets.UTF_8);
    Files.setLastModifiedTime(file, FileTime.fromMillis(2_000_000L));

    assertFalse(watcher.maybeReload());
    assertEquals(10_000, manager.getConfig().tracing().maxSpans());
  }

  private void writeSampleRate(String rate, FileTime modified) throws IOException {
    Files.writeString(file, "test:\n  tracing:\n    sampleRate: " + rate + "\n", StandardCharsets.UTF_8);
    Files.setLastModifiedTime(file, modified);
  }
}
