package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.alert.ActiveAlert;

/**
 * Callback invoked by the alerting backend when alerts change state.
 *
 * @since 0.1.0
 */
public interface AlertListener {
  void alertTriggered(ActiveAlert alert);

  default void alertResolved(ActiveAlert alert) {}
}
