package ca.gc.cra.prism.application.orchestration;

import ca.gc.cra.prism.domain.trace.TraceContext;

/**
 * Unit of work executed inside a span.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 * @since 0.1.0
 */
@FunctionalInterface
public interface TracedOperation<T, E extends Exception> {
  /**
   * Runs the work.
   *
   * @param context context of the enclosing span; unsampled when no span was recorded
   * @return result
   * @throws E on failure; propagated unchanged to the caller of the traced operation
   */
  T run(TraceContext context) throws E;
}
