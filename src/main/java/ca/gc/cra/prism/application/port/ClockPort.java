package ca.gc.cra.prism.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock and monotonic time.
 * <p><strong>Why:</strong> Durations, overhead samples, and rate-limit windows all depend on time; tests inject a
 * deterministic clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()} and {@link System#nanoTime()}.
 * @since 0.1.0
 * @see ca.gc.cra.prism.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns a monotonic reading for measuring elapsed time.
   *
   * @return nanoseconds from an arbitrary origin
   */
  default long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Returns the current wall-clock instant.
   *
   * @return instant derived from {@link #nowMillis()}
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }
}
