package ca.gc.cra.prism.logging;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Logging hygiene helpers for operation metadata.
 * <p><strong>Why:</strong> Middlewares log caller-supplied metadata; secrets and oversized values must not reach
 * operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final Set<String> SENSITIVE_FRAGMENTS = Set.of("password", "secret", "token", "apikey", "credential");

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to {@code maxChars}, noting the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return original value when short enough, otherwise a truncated copy
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    return value.substring(0, maxChars) + "... (truncated, " + maxChars + " of " + value.length() + ")";
  }

  /**
   * Returns the standard redaction placeholder.
   *
   * @param value ignored original value
   * @return {@code [REDACTED]}
   */
  public static String redact(Object value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Indicates whether a metadata key names a secret.
   *
   * @param key metadata key
   * @return {@code true} when the key contains a sensitive fragment
   */
  public static boolean isSensitiveKey(String key) {
    if (key == null) {
      return false;
    }
    String normalized = key.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
    for (String fragment : SENSITIVE_FRAGMENTS) {
      if (normalized.contains(fragment)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Renders metadata for a log line with sensitive values redacted and long values truncated.
   *
   * @param metadata metadata to render; may be {@code null}
   * @param maxValueChars per-value character budget
   * @return sorted, sanitized copy
   */
  public static Map<String, String> sanitize(Map<String, ?> metadata, int maxValueChars) {
    Map<String, String> sanitized = new TreeMap<>();
    if (metadata == null) {
      return sanitized;
    }
    metadata.forEach((key, value) -> {
      if (key == null) {
        return;
      }
      sanitized.put(key, isSensitiveKey(key)
          ? redact(value)
          : truncate(value == null ? null : value.toString(), maxValueChars));
    });
    return sanitized;
  }
}
