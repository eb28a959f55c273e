package ca.gc.cra.prism.domain.metrics;

import java.util.Map;
import java.util.Objects;

/**
 * Process readings supplied by the performance source.
 *
 * @param memory heap figures
 * @param cpuUsagePercent process CPU load in percent, {@code 0..100}
 * @param uptimeSeconds process uptime
 * @param eventLoopDelayMs scheduling stall attributed to the runtime
 * @param customMetrics additional named gauges supplied by the source
 * @since 0.1.0
 */
public record SystemMetrics(
    MemoryStats memory,
    double cpuUsagePercent,
    double uptimeSeconds,
    double eventLoopDelayMs,
    Map<String, Double> customMetrics) {

  private static final SystemMetrics EMPTY =
      new SystemMetrics(new MemoryStats(0L, 0L, 0d), 0d, 0d, 0d, Map.of());

  public SystemMetrics {
    memory = Objects.requireNonNull(memory, "memory");
    customMetrics = customMetrics == null ? Map.of() : Map.copyOf(customMetrics);
  }

  /**
   * Returns zeroed readings used when no source is available.
   *
   * @return empty readings
   */
  public static SystemMetrics empty() {
    return EMPTY;
  }

  /**
   * Heap readings.
   *
   * @param usedBytes bytes in use
   * @param totalBytes bytes available to the heap
   * @param usage {@code usedBytes / totalBytes} in {@code [0, 1]}
   */
  public record MemoryStats(long usedBytes, long totalBytes, double usage) {

    /**
     * Derives the usage ratio from raw byte counts.
     *
     * @param usedBytes bytes in use
     * @param totalBytes bytes available; zero or negative yields a usage of {@code 0}
     * @return memory readings
     */
    public static MemoryStats of(long usedBytes, long totalBytes) {
      double usage = totalBytes <= 0 ? 0d : Math.min(1d, Math.max(0d, (double) usedBytes / totalBytes));
      return new MemoryStats(usedBytes, totalBytes, usage);
    }
  }
}
