package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.config.ObservabilityConfig;
import ca.gc.cra.prism.domain.alert.ActiveAlert;
import ca.gc.cra.prism.domain.event.ObservabilityEvent;
import ca.gc.cra.prism.domain.metrics.OverheadStatistics;

/**
 * Local notifications emitted by the observability orchestrator.
 *
 * <p>All methods default to no-ops so listeners override only what they need. Listeners run on the caller's
 * thread; a throwing listener is logged and skipped.</p>
 *
 * @since 0.1.0
 */
public interface ObservabilityListener {
  default void started() {}

  default void stopped() {}

  default void eventRecorded(ObservabilityEvent event) {}

  /**
   * Overhead crossed the budget.
   *
   * @param statistics figures at the time of the check
   * @param throttled whether sampling and collection frequency were lowered
   */
  default void overheadExcessive(OverheadStatistics statistics, boolean throttled) {}

  default void configUpdated(ObservabilityConfig config) {}

  default void alertTriggered(ActiveAlert alert) {}

  default void alertResolved(ActiveAlert alert) {}
}
