package ca.gc.cra.prism.application.metrics;

import ca.gc.cra.prism.domain.metrics.EntitySummary;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Operation and error totals for a family of entities such as extensions or memory providers.
 *
 * @since 0.1.0
 */
public final class EntityMetricsCollector {
  private final Object lock = new Object();
  private final Map<String, Stats> entities = new HashMap<>();

  /**
   * Records one operation.
   *
   * @param entityId entity identifier
   * @param durationMs latency when measured
   * @param error whether the operation failed
   */
  public void recordOperation(String entityId, OptionalDouble durationMs, boolean error) {
    Objects.requireNonNull(entityId, "entityId");
    Objects.requireNonNull(durationMs, "durationMs");
    synchronized (lock) {
      Stats stats = entities.computeIfAbsent(entityId, ignored -> new Stats());
      stats.operations++;
      if (error) {
        stats.errors++;
      }
      if (durationMs.isPresent()) {
        stats.timed++;
        stats.totalLatencyMs += durationMs.getAsDouble();
      }
    }
  }

  public Map<String, EntitySummary> getAll() {
    Map<String, EntitySummary> all = new HashMap<>();
    synchronized (lock) {
      entities.forEach((entityId, stats) -> all.put(entityId, stats.summary(entityId)));
    }
    return Map.copyOf(all);
  }

  public void reset(String entityId) {
    synchronized (lock) {
      if (entityId == null) {
        entities.clear();
      } else {
        entities.remove(entityId);
      }
    }
  }

  private static final class Stats {
    private long operations;
    private long errors;
    private long timed;
    private double totalLatencyMs;

    EntitySummary summary(String entityId) {
      return new EntitySummary(entityId, operations, errors, timed == 0 ? 0d : totalLatencyMs / timed);
    }
  }
}
