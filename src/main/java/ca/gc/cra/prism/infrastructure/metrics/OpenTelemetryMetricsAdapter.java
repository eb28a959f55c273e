package ca.gc.cra.prism.infrastructure.metrics;

import ca.gc.cra.prism.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleCounter;
import io.opentelemetry.api.metrics.DoubleGauge;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that mirrors PRISM counters, gauges, and histograms to OpenTelemetry instruments, carrying the
 * series labels as attributes.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final String FALLBACK_METRIC_NAME = "prism.metric";

  private final MetricsDelegate delegate;
  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
      this.delegate = NoopDelegate.INSTANCE;
    } else {
      this.delegate = new OtelDelegate(bootstrap.meter());
    }
  }

  @Override
  public void increment(String name, double delta, Map<String, String> labels) {
    delegate.increment(name, delta, labels);
  }

  @Override
  public void gauge(String name, double value, Map<String, String> labels) {
    delegate.gauge(name, value, labels);
  }

  @Override
  public void observe(String name, double value, Map<String, String> labels) {
    delegate.observe(name, value, labels);
  }

  @Override
  public void flush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private interface MetricsDelegate {
    void increment(String name, double delta, Map<String, String> labels);

    void gauge(String name, double value, Map<String, String> labels);

    void observe(String name, double value, Map<String, String> labels);
  }

  private static final class NoopDelegate implements MetricsDelegate {
    private static final NoopDelegate INSTANCE = new NoopDelegate();

    @Override
    public void increment(String name, double delta, Map<String, String> labels) {}

    @Override
    public void gauge(String name, double value, Map<String, String> labels) {}

    @Override
    public void observe(String name, double value, Map<String, String> labels) {}
  }

  private static final class OtelDelegate implements MetricsDelegate {
    private final Meter meter;
    private final ConcurrentMap<String, DoubleCounter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, DoubleGauge> gauges = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, DoubleHistogram> histograms = new ConcurrentHashMap<>();

    private OtelDelegate(Meter meter) {
      this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public void increment(String name, double delta, Map<String, String> labels) {
      counters.computeIfAbsent(Objects.requireNonNull(name, "name"), this::createCounter)
          .add(delta, attributes(labels));
    }

    @Override
    public void gauge(String name, double value, Map<String, String> labels) {
      gauges.computeIfAbsent(Objects.requireNonNull(name, "name"), this::createGauge)
          .set(value, attributes(labels));
    }

    @Override
    public void observe(String name, double value, Map<String, String> labels) {
      histograms.computeIfAbsent(Objects.requireNonNull(name, "name"), this::createHistogram)
          .record(value, attributes(labels));
    }

    private DoubleCounter createCounter(String name) {
      return meter.counterBuilder(sanitized(name))
          .ofDoubles()
          .setDescription("PRISM counter " + name)
          .build();
    }

    private DoubleGauge createGauge(String name) {
      return meter.gaugeBuilder(sanitized(name))
          .setDescription("PRISM gauge " + name)
          .build();
    }

    private DoubleHistogram createHistogram(String name) {
      return meter.histogramBuilder(sanitized(name))
          .setDescription("PRISM histogram " + name)
          .build();
    }

    private static String sanitized(String name) {
      String sanitized = sanitizeName(name);
      if (!sanitized.equals(name)) {
        log.debug("Sanitized metric name '{}' -> '{}'", name, sanitized);
      }
      return sanitized;
    }

    private static Attributes attributes(Map<String, String> labels) {
      if (labels == null || labels.isEmpty()) {
        return Attributes.empty();
      }
      AttributesBuilder builder = Attributes.builder();
      labels.forEach((key, value) -> {
        if (key != null && value != null) {
          builder.put(AttributeKey.stringKey(key), value);
        }
      });
      return builder.build();
    }
  }
}
