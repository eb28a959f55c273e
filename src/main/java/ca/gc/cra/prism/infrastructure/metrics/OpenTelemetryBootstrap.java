package ca.gc.cra.prism.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the meter PRISM records through: an OTLP gRPC pipeline, or a no-op meter when the exporter is
 * {@code none}.
 * <p>Settings come from the {@code otel.*} system properties written by the composition root, then from the
 * matching {@code OTEL_*} environment variables.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.prism";
  static final String SERVICE_NAME = "prism";
  static final String SERVICE_NAMESPACE = "ca.gc.cra";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5L;
  private static final String VERSION = Optional.ofNullable(OpenTelemetryBootstrap.class.getPackage())
      .map(Package::getImplementationVersion)
      .orElse("0.1.0-SNAPSHOT");

  private OpenTelemetryBootstrap() {}

  static BootstrapResult initialize() {
    String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp").toLowerCase(Locale.ROOT);
    if (exporter.equals("none")) {
      log.info("PRISM metrics export disabled (exporter=none)");
      return BootstrapResult.noop();
    }
    if (!exporter.equals("otlp")) {
      log.warn("Unsupported metrics exporter '{}'; exporting over OTLP", exporter);
    }
    String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
    Attributes extra = parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
    try {
      MetricReader reader = PeriodicMetricReader.builder(
              OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
          .setInterval(EXPORT_INTERVAL)
          .build();
      log.info("PRISM metrics exporting over OTLP to {}", endpoint);
      return BootstrapResult.of(meterProvider(reader, extra));
    } catch (RuntimeException ex) {
      log.error("Failed to start OTLP metrics export; recording to a no-op meter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return BootstrapResult.of(meterProvider(Objects.requireNonNull(reader, "reader"), Attributes.empty()));
  }

  /** Parses {@code key=value} pairs separated by commas; entries without both parts are skipped. */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    for (String entry : raw.split(",")) {
      String[] pair = entry.split("=", 2);
      if (pair.length == 2 && !pair[0].isBlank() && !pair[1].isBlank()) {
        builder.put(pair[0].trim(), pair[1].trim());
      } else if (!entry.isBlank()) {
        log.warn("Ignoring resource attribute entry without key=value: {}", entry.trim());
      }
    }
    return builder.build();
  }

  private static SdkMeterProvider meterProvider(MetricReader reader, Attributes extra) {
    Attributes service = Attributes.of(
        AttributeKey.stringKey("service.name"), SERVICE_NAME,
        AttributeKey.stringKey("service.namespace"), SERVICE_NAMESPACE,
        AttributeKey.stringKey("service.version"), VERSION,
        AttributeKey.stringKey("service.instance.id"), ManagementFactory.getRuntimeMXBean().getName());
    Resource resource = Resource.getDefault().merge(Resource.create(service)).merge(Resource.create(extra));
    return SdkMeterProvider.builder().setResource(resource).registerMetricReader(reader).build();
  }

  private static String setting(String property, String variable, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(variable);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  /** Meter handed to the adapter plus the provider that owns it; the provider is {@code null} for no-op. */
  record BootstrapResult(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult of(SdkMeterProvider provider) {
      return new BootstrapResult(
          provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(VERSION).build(), provider);
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null && !await(provider.forceFlush())) {
        log.warn("PRISM metrics flush did not finish within {} s", SHUTDOWN_TIMEOUT_SECONDS);
      }
    }

    @Override
    public void close() {
      if (provider != null && !await(provider.shutdown())) {
        log.warn("PRISM meter provider did not shut down within {} s", SHUTDOWN_TIMEOUT_SECONDS);
      }
    }

    private static boolean await(CompletableResultCode result) {
      return result.join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS).isSuccess();
    }
  }
}
