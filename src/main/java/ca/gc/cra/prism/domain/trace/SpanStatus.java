package ca.gc.cra.prism.domain.trace;

import java.util.Objects;

/**
 * Completion status attached to a span when it is finished or explicitly updated.
 *
 * @param code status code; never {@code null}
 * @param message optional human-readable detail; may be {@code null}
 * @since 0.1.0
 */
public record SpanStatus(Code code, String message) {
  private static final SpanStatus OK = new SpanStatus(Code.OK, null);

  /** Message recorded when the wrapped work was cancelled or interrupted. */
  public static final String CANCELLED_MESSAGE = "cancelled";

  public SpanStatus {
    code = Objects.requireNonNull(code, "code");
  }

  /**
   * Returns the shared success status.
   *
   * @return status with {@link Code#OK}
   */
  public static SpanStatus ok() {
    return OK;
  }

  /**
   * Creates an error status.
   *
   * @param message failure description; may be {@code null}
   * @return status with {@link Code#ERROR}
   */
  public static SpanStatus error(String message) {
    return new SpanStatus(Code.ERROR, message);
  }

  /**
   * Creates the error status used for cancelled work.
   *
   * @return error status carrying {@link #CANCELLED_MESSAGE}
   */
  public static SpanStatus cancelled() {
    return new SpanStatus(Code.ERROR, CANCELLED_MESSAGE);
  }

  public boolean isError() {
    return code == Code.ERROR;
  }

  /** Span status codes. */
  public enum Code {
    OK,
    ERROR
  }
}
