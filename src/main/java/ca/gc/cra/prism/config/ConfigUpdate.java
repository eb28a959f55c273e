package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Partial update of the hot-reloadable configuration fields.
 *
 * <p>Only the master switch, sampling rate, collection interval, collection switch, and health-check switch
 * can change while running; everything else requires a restart.</p>
 *
 * @since 0.1.0
 */
public final class ConfigUpdate {
  private static final ConfigUpdate EMPTY = builder().build();

  private final Boolean enabled;
  private final Double sampleRate;
  private final Long collectionIntervalMs;
  private final Boolean enableCollection;
  private final Boolean enableHealthChecks;

  private ConfigUpdate(Builder builder) {
    this.enabled = builder.enabled;
    this.sampleRate = builder.sampleRate;
    this.collectionIntervalMs = builder.collectionIntervalMs;
    this.enableCollection = builder.enableCollection;
    this.enableHealthChecks = builder.enableHealthChecks;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ConfigUpdate empty() {
    return EMPTY;
  }

  /**
   * Computes the hot-reloadable differences between two configurations.
   *
   * @param current configuration in force
   * @param next configuration just loaded
   * @return update containing only fields whose value changed
   */
  public static ConfigUpdate between(ObservabilityConfig current, ObservabilityConfig next) {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(next, "next");
    Builder builder = builder();
    if (current.enabled() != next.enabled()) {
      builder.enabled(next.enabled());
    }
    if (Double.compare(current.tracing().sampleRate(), next.tracing().sampleRate()) != 0) {
      builder.sampleRate(next.tracing().sampleRate());
    }
    if (current.metrics().collectionIntervalMs() != next.metrics().collectionIntervalMs()) {
      builder.collectionIntervalMs(next.metrics().collectionIntervalMs());
    }
    if (current.metrics().enableCollection() != next.metrics().enableCollection()) {
      builder.enableCollection(next.metrics().enableCollection());
    }
    if (current.health().enableHealthChecks() != next.health().enableHealthChecks()) {
      builder.enableHealthChecks(next.health().enableHealthChecks());
    }
    return builder.build();
  }

  public Optional<Boolean> enabled() {
    return Optional.ofNullable(enabled);
  }

  public Optional<Double> sampleRate() {
    return Optional.ofNullable(sampleRate);
  }

  public Optional<Long> collectionIntervalMs() {
    return Optional.ofNullable(collectionIntervalMs);
  }

  public Optional<Boolean> enableCollection() {
    return Optional.ofNullable(enableCollection);
  }

  public Optional<Boolean> enableHealthChecks() {
    return Optional.ofNullable(enableHealthChecks);
  }

  public boolean isEmpty() {
    return changedKeys().isEmpty();
  }

  /**
   * Lists the dotted keys this update touches, for logging.
   *
   * @return changed keys in a stable order
   */
  public List<String> changedKeys() {
    List<String> keys = new ArrayList<>();
    if (enabled != null) {
      keys.add("enabled");
    }
    if (sampleRate != null) {
      keys.add("tracing.sampleRate");
    }
    if (collectionIntervalMs != null) {
      keys.add("metrics.collectionIntervalMs");
    }
    if (enableCollection != null) {
      keys.add("metrics.enableCollection");
    }
    if (enableHealthChecks != null) {
      keys.add("health.enableHealthChecks");
    }
    return List.copyOf(keys);
  }

  @Override
  public String toString() {
    return "ConfigUpdate" + changedKeys();
  }

  /** Builder validating each field as it is set. */
  public static final class Builder {
    private Boolean enabled;
    private Double sampleRate;
    private Long collectionIntervalMs;
    private Boolean enableCollection;
    private Boolean enableHealthChecks;

    private Builder() {}

    public Builder enabled(boolean value) {
      this.enabled = value;
      return this;
    }

    public Builder sampleRate(double value) {
      this.sampleRate = Numbers.requireFraction("tracing.sampleRate", value);
      return this;
    }

    public Builder collectionIntervalMs(long value) {
      this.collectionIntervalMs = Numbers.requireRange(
          "metrics.collectionIntervalMs", value, MetricsSettings.MIN_INTERVAL_MS, MetricsSettings.MAX_INTERVAL_MS);
      return this;
    }

    public Builder enableCollection(boolean value) {
      this.enableCollection = value;
      return this;
    }

    public Builder enableHealthChecks(boolean value) {
      this.enableHealthChecks = value;
      return this;
    }

    public ConfigUpdate build() {
      return new ConfigUpdate(this);
    }
  }
}
