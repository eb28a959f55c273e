package ca.gc.cra.prism.config;

import ca.gc.cra.prism.validation.Numbers;

/**
 * Tracing knobs; {@code sampleRate} is hot-reloadable and adjusted by self-throttling.
 *
 * @param enableTracing whether spans are created at all
 * @param sampleRate fraction of root traces recorded, {@code [0, 1]}
 * @param maxSpans completed spans retained by the in-memory tracing system
 * @since 0.1.0
 */
public record TracingSettings(boolean enableTracing, double sampleRate, int maxSpans) {
  public static final int MIN_MAX_SPANS = 100;
  public static final int MAX_MAX_SPANS = 1_000_000;

  public TracingSettings {
    Numbers.requireFraction("tracing.sampleRate", sampleRate);
    Numbers.requireRange("tracing.maxSpans", maxSpans, MIN_MAX_SPANS, MAX_MAX_SPANS);
  }

  public static TracingSettings defaults() {
    return new TracingSettings(true, 1.0d, 10_000);
  }
}
