package ca.gc.cra.prism.domain.metrics;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Identity of one metric series: a name plus a label set sorted by key.
 * <p><strong>Why:</strong> Label permutations must collapse to one series, so labels are held in a sorted map
 * and the rendered {@link #key()} is deterministic.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param name metric name; never blank
 * @param labels labels sorted by key; never {@code null}
 * @since 0.1.0
 */
public record MetricSeries(String name, SortedMap<String, String> labels) implements Comparable<MetricSeries> {

  public MetricSeries {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("metric name must not be blank");
    }
    TreeMap<String, String> sorted = new TreeMap<>();
    if (labels != null) {
      labels.forEach((key, value) -> {
        if (key != null && value != null) {
          sorted.put(key, value);
        }
      });
    }
    labels = Collections.unmodifiableSortedMap(sorted);
  }

  /**
   * Creates a series from an arbitrary label map; insertion order is irrelevant.
   *
   * @param name metric name
   * @param labels labels; may be {@code null}
   * @return series identity
   */
  public static MetricSeries of(String name, Map<String, String> labels) {
    if (labels == null || labels.isEmpty()) {
      return new MetricSeries(name, null);
    }
    TreeMap<String, String> sorted = new TreeMap<>();
    labels.forEach((key, value) -> {
      if (key != null && value != null) {
        sorted.put(key, value);
      }
    });
    return new MetricSeries(name, sorted);
  }

  /**
   * Creates an unlabelled series.
   *
   * @param name metric name
   * @return series identity
   */
  public static MetricSeries of(String name) {
    return new MetricSeries(name, null);
  }

  /**
   * Renders {@code name{k="v",...}}, or the bare name when unlabelled.
   *
   * @return series key
   */
  public String key() {
    if (labels.isEmpty()) {
      return name;
    }
    return name + renderLabels(labels);
  }

  /**
   * Renders a label block with values escaped for the text exposition format.
   *
   * @param labels labels in output order
   * @return {@code {k="v",...}}, or an empty string for no labels
   */
  public static String renderLabels(Map<String, String> labels) {
    if (labels.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (Map.Entry<String, String> entry : labels.entrySet()) {
      if (!first) {
        sb.append(',');
      }
      first = false;
      sb.append(entry.getKey()).append("=\"").append(escape(entry.getValue())).append('"');
    }
    return sb.append('}').toString();
  }

  static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\\' -> sb.append("\\\\");
        case '"' -> sb.append("\\\"");
        case '\n' -> sb.append("\\n");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }

  @Override
  public int compareTo(MetricSeries other) {
    int byName = name.compareTo(other.name);
    return byName != 0 ? byName : key().compareTo(other.key());
  }

  @Override
  public String toString() {
    return key();
  }
}
