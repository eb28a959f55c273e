package ca.gc.cra.prism.application.middleware;

import ca.gc.cra.prism.domain.trace.TraceContext;
import java.util.Map;

/**
 * Callbacks invoked around every traced operation.
 *
 * <p>Every method defaults to a no-op. A hook may throw; the manager logs the failure and continues with the
 * remaining hooks, so a hook can neither abort the operation nor hide its outcome.</p>
 *
 * @since 0.1.0
 */
public interface MiddlewareHooks {
  /**
   * Runs before the wrapped function.
   *
   * @param context context of the operation; metadata may be annotated
   * @param operation operation name
   * @param metadata caller-supplied metadata, read-only
   * @throws Exception on hook failure; logged and ignored by the manager
   */
  default void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata)
      throws Exception {}

  /**
   * Runs after the wrapped function returned normally.
   *
   * @param context context of the operation
   * @param operation operation name
   * @param result value returned by the function; may be {@code null}
   * @param durationMs elapsed milliseconds
   * @throws Exception on hook failure; logged and ignored by the manager
   */
  default void afterOperation(TraceContext context, String operation, Object result, double durationMs)
      throws Exception {}

  /**
   * Runs after the wrapped function threw.
   *
   * @param context context of the operation
   * @param operation operation name
   * @param error throwable raised by the function
   * @param durationMs elapsed milliseconds
   * @throws Exception on hook failure; logged and ignored by the manager
   */
  default void onError(TraceContext context, String operation, Throwable error, double durationMs)
      throws Exception {}
}
