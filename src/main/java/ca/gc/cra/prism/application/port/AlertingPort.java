package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.alert.ActiveAlert;
import ca.gc.cra.prism.domain.alert.AlertingStatistics;
import java.util.List;

/**
 * <strong>What:</strong> Port to the alert-rule evaluation engine.
 * <p><strong>Role:</strong> Started and stopped with the orchestrator; queried for dashboards and status.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate listener registration from any thread and
 * may invoke listeners on their own threads.</p>
 *
 * @since 0.1.0
 */
public interface AlertingPort {
  void startEvaluation();

  void stopEvaluation();

  /**
   * Returns alerts currently firing.
   *
   * @return immutable list; never {@code null}
   */
  List<ActiveAlert> getActiveAlerts();

  AlertingStatistics getStatistics();

  void addListener(AlertListener listener);

  void removeListener(AlertListener listener);

  /** Engine with no rules. */
  AlertingPort NO_OP = new AlertingPort() {
    @Override public void startEvaluation() {}

    @Override public void stopEvaluation() {}

    @Override
    public List<ActiveAlert> getActiveAlerts() {
      return List.of();
    }

    @Override
    public AlertingStatistics getStatistics() {
      return AlertingStatistics.empty();
    }

    @Override public void addListener(AlertListener listener) {}

    @Override public void removeListener(AlertListener listener) {}
  };
}
