package ca.gc.cra.prism.infrastructure.performance;

import ca.gc.cra.prism.application.port.PerformanceSourcePort;
import ca.gc.cra.prism.domain.metrics.SystemMetrics;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.RuntimeMXBean;
import java.lang.management.ThreadMXBean;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> {@link PerformanceSourcePort} reading heap, CPU, uptime, and GC figures from the platform
 * MXBeans.
 * <p><strong>Event loop lag:</strong> The JVM has no single event loop; the reading reports garbage-collection time
 * accumulated since the previous call, the closest process-wide stall signal.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls; the GC baseline is updated atomically.</p>
 *
 * @since 0.1.0
 */
public final class JvmPerformanceSource implements PerformanceSourcePort {
  static final String THREAD_COUNT = "jvm_threads_live";
  static final String GC_COUNT = "jvm_gc_collections_total";

  private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
  private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
  private final RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();
  private final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
  private final List<GarbageCollectorMXBean> collectors = ManagementFactory.getGarbageCollectorMXBeans();
  private final AtomicLong lastGcTimeMs = new AtomicLong(-1L);

  @Override
  public SystemMetrics getSystemMetrics() {
    MemoryUsage heap = memory.getHeapMemoryUsage();
    long total = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
    long gcTime = 0L;
    long gcCount = 0L;
    for (GarbageCollectorMXBean collector : collectors) {
      gcTime += Math.max(0L, collector.getCollectionTime());
      gcCount += Math.max(0L, collector.getCollectionCount());
    }
    long previous = lastGcTimeMs.getAndSet(gcTime);
    double gcDeltaMs = previous < 0 ? 0d : Math.max(0L, gcTime - previous);

    Map<String, Double> custom = new LinkedHashMap<>();
    custom.put(THREAD_COUNT, (double) threads.getThreadCount());
    custom.put(GC_COUNT, (double) gcCount);
    return new SystemMetrics(
        SystemMetrics.MemoryStats.of(heap.getUsed(), total),
        cpuPercent(),
        runtime.getUptime() / 1000d,
        gcDeltaMs,
        custom);
  }

  private double cpuPercent() {
    if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
      double load = sunOs.getProcessCpuLoad();
      if (load >= 0d) {
        return load * 100d;
      }
    }
    double average = os.getSystemLoadAverage();
    int processors = Math.max(1, os.getAvailableProcessors());
    return average < 0d ? 0d : Math.min(100d, average / processors * 100d);
  }
}
