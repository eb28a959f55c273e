package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.metrics.SystemMetrics;

/**
 * Port to the process performance sampler read by the scheduled metrics pull.
 *
 * <p>Implementations are called from the collector thread and must not block for long.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PerformanceSourcePort {
  /**
   * Reads current process figures.
   *
   * @return readings; never {@code null}
   */
  SystemMetrics getSystemMetrics();

  /** Source that always reports zeroed readings. */
  PerformanceSourcePort NONE = SystemMetrics::empty;
}
