package ca.gc.cra.prism.application.port;

import ca.gc.cra.prism.domain.health.HealthCheckDescriptor;
import ca.gc.cra.prism.domain.health.HealthCheckResult;
import ca.gc.cra.prism.domain.health.HealthSummary;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Port to the persistent health-check registry.
 * <p><strong>Role:</strong> The orchestrator registers its overhead probe once at startup and reads the summary
 * for dashboards; the registry owns scheduling of probes.</p>
 *
 * @since 0.1.0
 */
public interface HealthRegistryPort {
  /**
   * Registers a probe; re-registering the same id replaces the previous probe.
   *
   * @param descriptor probe details
   * @param check probe body; may throw, in which case the registry records a failure
   */
  void registerCheck(HealthCheckDescriptor descriptor, Supplier<HealthCheckResult> check);

  /**
   * Returns the latest overall and per-component health.
   *
   * @return summary; never {@code null}
   */
  HealthSummary getHealthSummary();

  /** Registry that stores nothing. */
  HealthRegistryPort NO_OP = new HealthRegistryPort() {
    @Override public void registerCheck(HealthCheckDescriptor descriptor, Supplier<HealthCheckResult> check) {}

    @Override
    public HealthSummary getHealthSummary() {
      return HealthSummary.unknown();
    }
  };
}
