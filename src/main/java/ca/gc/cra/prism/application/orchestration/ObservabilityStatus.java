package ca.gc.cra.prism.application.orchestration;

import ca.gc.cra.prism.domain.metrics.OverheadStatistics;
import java.util.Objects;

/**
 * Operational summary returned by {@link ObservabilityManager#getStatus()}.
 *
 * @param enabled master switch
 * @param state lifecycle state
 * @param uptimeMs time since the last start; {@code 0} while stopped
 * @param tracing tracing switch and trace count
 * @param metrics collection switch and series count
 * @param alerting evaluation switch and active alert count
 * @param overhead overhead window figures
 * @param middlewares registered middleware count
 * @since 0.1.0
 */
public record ObservabilityStatus(
    boolean enabled,
    ManagerState state,
    long uptimeMs,
    Subsystem tracing,
    Subsystem metrics,
    Subsystem alerting,
    OverheadStatistics overhead,
    int middlewares) {

  public ObservabilityStatus {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(tracing, "tracing");
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(alerting, "alerting");
    Objects.requireNonNull(overhead, "overhead");
  }

  /**
   * Switch and headline figure of one subsystem.
   *
   * @param enabled whether the subsystem is active
   * @param count traces, series, or alerts depending on the subsystem
   */
  public record Subsystem(boolean enabled, long count) {}
}
