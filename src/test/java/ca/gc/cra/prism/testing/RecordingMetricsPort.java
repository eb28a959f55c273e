package ca.gc.cra.prism.testing;

import ca.gc.cra.prism.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Test double capturing metric usage for assertions.
 */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, Double> counters = new HashMap<>();
  private final Map<String, Double> gauges = new HashMap<>();
  private final Map<String, List<Double>> observations = new HashMap<>();
  private int flushes;

  @Override
  public synchronized void increment(String name, double delta, Map<String, String> labels) {
    counters.merge(name, delta, Double::sum);
  }

  @Override
  public synchronized void gauge(String name, double value, Map<String, String> labels) {
    gauges.put(name, value);
  }

  @Override
  public synchronized void observe(String name, double value, Map<String, String> labels) {
    observations.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
  }

  @Override
  public synchronized void flush() {
    flushes++;
  }

  public synchronized double counter(String name) {
    return counters.getOrDefault(name, 0d);
  }

  public synchronized Double gaugeValue(String name) {
    return gauges.get(name);
  }

  public synchronized List<Double> observed(String name) {
    return List.copyOf(observations.getOrDefault(name, Collections.emptyList()));
  }

  public synchronized int flushCount() {
    return flushes;
  }
}
