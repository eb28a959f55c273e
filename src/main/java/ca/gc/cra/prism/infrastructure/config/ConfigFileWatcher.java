package ca.gc.cra.prism.infrastructure.config;

import ca.gc.cra.prism.application.orchestration.ObservabilityManager;
import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.config.ConfigUpdate;
import ca.gc.cra.prism.config.ObservabilityConfig;
import ca.gc.cra.prism.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polling watcher that re-reads the configuration file when its modification time changes and applies the
 * hot-reloadable differences through {@link ObservabilityManager#updateConfig(ConfigUpdate)}.
 *
 * @since 0.1.0
 */
public final class ConfigFileWatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConfigFileWatcher.class);
  static final long DEFAULT_INTERVAL_MILLIS = 5_000L;
  static final long MIN_INTERVAL_MILLIS = 1_000L;

  private final Path file;
  private final ConfigSource source;
  private final ObservabilityManager manager;
  private final ClockPort clock;
  private final long intervalMillis;
  private final Object scheduleLock = new Object();

  private volatile long nextCheckAt;
  private FileTime lastModified;
  private ScheduledExecutorService scheduler;

  public ConfigFileWatcher(Path file, ConfigSource source, ObservabilityManager manager, ClockPort clock) {
    this(file, source, manager, clock, DEFAULT_INTERVAL_MILLIS);
  }

  /**
   * Creates a watcher; the current modification time becomes the baseline.
   *
   * @param file configuration file to poll
   * @param source loads the merged configuration
   * @param manager receives configuration updates
   * @param clock time source for the poll interval
   * @param intervalMillis minimum delay between checks; clamped to at least one second
   */
  public ConfigFileWatcher(
      Path file, ConfigSource source, ObservabilityManager manager, ClockPort clock, long intervalMillis) {
    this.file = Objects.requireNonNull(file, "file");
    this.source = Objects.requireNonNull(source, "source");
    this.manager = Objects.requireNonNull(manager, "manager");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.intervalMillis = Math.max(MIN_INTERVAL_MILLIS, intervalMillis);
    this.lastModified = modificationTime();
  }

  /**
   * Checks the file and reloads it when it changed since the last successful reload.
   *
   * @return {@code true} when a configuration update was applied
   */
  public synchronized boolean maybeReload() {
    long now = clock.nowMillis();
    if (now < nextCheckAt) {
      return false;
    }
    nextCheckAt = now + intervalMillis;

    FileTime current = modificationTime();
    if (current == null || current.equals(lastModified)) {
      return false;
    }
    try {
      ObservabilityConfig next = source.load();
      ConfigUpdate update = ConfigUpdate.between(manager.getConfig(), next);
      lastModified = current;
      if (update.isEmpty()) {
        log.info("Configuration file {} changed without hot-reloadable differences", file);
        return false;
      }
      manager.updateConfig(update);
      log.info("Reloaded configuration from {}: {}", file, update.changedKeys());
      return true;
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Failed to reload configuration from {}; keeping current settings", file, ex);
      return false;
    }
  }

  /**
   * Polls on a dedicated daemon thread until {@link #close()}; calling it twice has no effect.
   */
  public void start() {
    synchronized (scheduleLock) {
      if (scheduler != null) {
        return;
      }
      scheduler = ExecutorFactories.newSingleThreadScheduler(ExecutorFactories.CONFIG_WATCHER_THREAD);
      scheduler.scheduleWithFixedDelay(this::pollQuietly, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }
    log.info("Watching {} for configuration changes every {} ms", file, intervalMillis);
  }

  @Override
  public void close() {
    ScheduledExecutorService toShutdown;
    synchronized (scheduleLock) {
      toShutdown = scheduler;
      scheduler = null;
    }
    if (toShutdown != null) {
      toShutdown.shutdownNow();
    }
  }

  private void pollQuietly() {
    try {
      maybeReload();
    } catch (RuntimeException ex) {
      log.error("Configuration watcher poll failed", ex);
    }
  }

  private FileTime modificationTime() {
    try {
      return Files.exists(file) ? Files.getLastModifiedTime(file) : null;
    } catch (IOException ex) {
      log.warn("Unable to read modification time for {}", file, ex);
      return null;
    }
  }
}
