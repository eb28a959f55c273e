package ca.gc.cra.prism.application.metrics;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.domain.metrics.AgentSummary;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-agent operation timers and counters.
 *
 * <p>Each {@link #startOperation(String, String)} pairs with at most one {@link #endOperation(String, String)};
 * unknown or repeated ends return {@code 0} and never throw. All state is guarded by one lock.</p>
 *
 * @since 0.1.0
 */
public final class AgentMetricsCollector {
  private final ClockPort clock;
  private final AtomicLong sequence = new AtomicLong();
  private final Object lock = new Object();
  private final Map<String, Map<String, Long>> timers = new HashMap<>();
  private final Map<String, Map<String, Double>> counters = new HashMap<>();

  public AgentMetricsCollector(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Starts timing an agent operation.
   *
   * @param agentId agent identifier
   * @param operation operation name
   * @return operation id to pass to {@link #endOperation(String, String)}
   */
  public String startOperation(String agentId, String operation) {
    Objects.requireNonNull(agentId, "agentId");
    Objects.requireNonNull(operation, "operation");
    String operationId = agentId + "_" + operation + "_" + sequence.incrementAndGet();
    long started = clock.nanoTime();
    synchronized (lock) {
      timers.computeIfAbsent(agentId, ignored -> new HashMap<>()).put(operationId, started);
    }
    return operationId;
  }

  /**
   * Stops a timer started by {@link #startOperation(String, String)}.
   *
   * @param agentId agent identifier
   * @param operationId id returned when the timer started
   * @return elapsed milliseconds, or {@code 0} when the timer is unknown or already ended
   */
  public double endOperation(String agentId, String operationId) {
    if (agentId == null || operationId == null) {
      return 0d;
    }
    long ended = clock.nanoTime();
    Long started;
    synchronized (lock) {
      Map<String, Long> agentTimers = timers.get(agentId);
      started = agentTimers == null ? null : agentTimers.remove(operationId);
    }
    if (started == null) {
      return 0d;
    }
    return Math.max(0L, ended - started) / 1_000_000d;
  }

  /**
   * Adds {@code delta} to a named agent counter.
   *
   * @param agentId agent identifier
   * @param counter counter name such as {@code actions}
   * @param delta increment
   */
  public void recordCounter(String agentId, String counter, double delta) {
    Objects.requireNonNull(agentId, "agentId");
    Objects.requireNonNull(counter, "counter");
    synchronized (lock) {
      counters.computeIfAbsent(agentId, ignored -> new LinkedHashMap<>()).merge(counter, delta, Double::sum);
    }
  }

  public void recordCounter(String agentId, String counter) {
    recordCounter(agentId, counter, 1d);
  }

  /**
   * Returns the counters and open timer count of one agent.
   *
   * @param agentId agent identifier
   * @return summary; empty counters for unknown agents
   */
  public AgentSummary getAgentMetrics(String agentId) {
    synchronized (lock) {
      return summaryLocked(agentId);
    }
  }

  /**
   * Returns summaries of every agent that has counters or open timers.
   *
   * @return immutable map keyed by agent id
   */
  public Map<String, AgentSummary> getAllAgentMetrics() {
    Map<String, AgentSummary> all = new HashMap<>();
    synchronized (lock) {
      for (String agentId : counters.keySet()) {
        all.put(agentId, summaryLocked(agentId));
      }
      for (String agentId : timers.keySet()) {
        all.computeIfAbsent(agentId, this::summaryLocked);
      }
    }
    return Map.copyOf(all);
  }

  /**
   * Clears one agent, or every agent when {@code agentId} is {@code null}.
   *
   * @param agentId agent to clear; may be {@code null}
   */
  public void reset(String agentId) {
    synchronized (lock) {
      if (agentId == null) {
        counters.clear();
        timers.clear();
      } else {
        counters.remove(agentId);
        timers.remove(agentId);
      }
    }
  }

  private AgentSummary summaryLocked(String agentId) {
    Map<String, Double> agentCounters = counters.getOrDefault(agentId, Map.of());
    Map<String, Long> agentTimers = timers.getOrDefault(agentId, Map.of());
    return new AgentSummary(agentId, agentCounters, agentTimers.size());
  }
}
