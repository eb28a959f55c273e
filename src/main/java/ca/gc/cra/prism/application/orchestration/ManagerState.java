package ca.gc.cra.prism.application.orchestration;

/**
 * Lifecycle states of the {@link ObservabilityManager}.
 *
 * @since 0.1.0
 */
public enum ManagerState {
  STOPPED,
  RUNNING
}
