package ca.gc.cra.prism.application.orchestration;

import ca.gc.cra.prism.domain.event.AgentEvent;
import ca.gc.cra.prism.domain.event.EventStatus;
import ca.gc.cra.prism.domain.event.ExtensionEvent;
import ca.gc.cra.prism.domain.event.MemoryEvent;
import ca.gc.cra.prism.domain.event.ObservabilityEvent;
import ca.gc.cra.prism.domain.event.PortalEvent;
import ca.gc.cra.prism.domain.event.SystemEvent;
import ca.gc.cra.prism.domain.trace.TraceContext;
import ca.gc.cra.prism.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Higher-order helpers that run caller code through
 * {@link ObservabilityManager#traceOperation(String, TracedOperation, TraceContext, Map)}.
 * <p><strong>Role:</strong> Adapter between plain functional interfaces and the manager's traced execution.</p>
 * <p><strong>Thread-safety:</strong> Stateless; returned wrappers are as thread-safe as the wrapped code.</p>
 *
 * @since 0.1.0
 */
public final class Traced {
  /** Source recorded on the {@code system} events emitted when {@link TracedOptions#recordMetrics()} is set. */
  public static final String EVENT_SOURCE = "traced";

  /** Suffix appended to the operation name of events recorded for failed calls. */
  public static final String ERROR_SUFFIX = "_error";

  private Traced() {}

  /**
   * Wraps a function so every call runs inside a root span.
   *
   * @param manager manager executing the span
   * @param options span name, metric flag, and metadata
   * @param fn function to wrap
   * @param <T> argument type
   * @param <R> result type
   * @return traced function
   */
  public static <T, R> Function<T, R> wrap(ObservabilityManager manager, TracedOptions options, Function<T, R> fn) {
    requireArguments(manager, options, fn);
    return argument -> call(manager, options, null, context -> fn.apply(argument));
  }

  /**
   * Wraps a supplier so every call runs inside a root span.
   *
   * @param manager manager executing the span
   * @param options span name, metric flag, and metadata
   * @param fn supplier to wrap
   * @param <R> result type
   * @return traced supplier
   */
  public static <R> Supplier<R> wrap(ObservabilityManager manager, TracedOptions options, Supplier<R> fn) {
    requireArguments(manager, options, fn);
    return () -> call(manager, options, null, context -> fn.get());
  }

  /**
   * Wraps a traced operation so it runs as a child of the context it is invoked with.
   *
   * @param manager manager executing the span
   * @param options span name, metric flag, and metadata
   * @param fn operation to wrap
   * @param <T> result type
   * @param <E> checked exception thrown by {@code fn}
   * @return operation whose argument becomes the parent of the new span
   */
  public static <T, E extends Exception> TracedOperation<T, E> wrap(
      ObservabilityManager manager, TracedOptions options, TracedOperation<T, E> fn) {
    requireArguments(manager, options, fn);
    return parent -> call(manager, options, parent, fn);
  }

  /**
   * Runs agent work in an {@code agent.<operation>} span and records an {@link AgentEvent} with its outcome.
   *
   * @param manager manager executing the span
   * @param agentId agent id
   * @param operation agent operation, for example {@code "think"}
   * @param fn work to run
   * @param <T> result type
   * @param <E> checked exception thrown by {@code fn}
   * @return result of {@code fn}
   * @throws E the failure raised by {@code fn}
   */
  public static <T, E extends Exception> T traceAgentOperation(
      ObservabilityManager manager, String agentId, String operation, TracedOperation<T, E> fn) throws E {
    String id = Strings.requireNonBlank("agentId", agentId);
    String op = Strings.requireNonBlank("operation", operation);
    return traceEntity(
        manager, "agent." + op, Map.of("agentId", id), fn,
        (durationMs, status) -> new AgentEvent(id, op, durationMs, status, Map.of()));
  }

  /**
   * Runs a portal request in a {@code portal.request} span and records a {@link PortalEvent} with its outcome.
   *
   * @param manager manager executing the span
   * @param portalId portal id
   * @param model model name; may be {@code null}
   * @param fn work to run
   * @param <T> result type
   * @param <E> checked exception thrown by {@code fn}
   * @return result of {@code fn}
   * @throws E the failure raised by {@code fn}
   */
  public static <T, E extends Exception> T tracePortalOperation(
      ObservabilityManager manager, String portalId, String model, TracedOperation<T, E> fn) throws E {
    String id = Strings.requireNonBlank("portalId", portalId);
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put("portalId", id);
    if (model != null) {
      tags.put("model", model);
    }
    return traceEntity(
        manager, "portal.request", tags, fn,
        (durationMs, status) -> new PortalEvent(id, "request", model, durationMs, null, status, Map.of()));
  }

  public static <T, E extends Exception> T traceExtensionOperation(
      ObservabilityManager manager, String extensionId, String operation, TracedOperation<T, E> fn) throws E {
    String id = Strings.requireNonBlank("extensionId", extensionId);
    String op = Strings.requireNonBlank("operation", operation);
    return traceEntity(
        manager, "extension." + op, Map.of("extensionId", id), fn,
        (durationMs, status) -> new ExtensionEvent(id, op, durationMs, status, Map.of()));
  }

  public static <T, E extends Exception> T traceMemoryOperation(
      ObservabilityManager manager, String providerId, String operation, TracedOperation<T, E> fn) throws E {
    String id = Strings.requireNonBlank("providerId", providerId);
    String op = Strings.requireNonBlank("operation", operation);
    return traceEntity(
        manager, "memory." + op, Map.of("providerId", id), fn,
        (durationMs, status) -> new MemoryEvent(id, op, durationMs, null, status, Map.of()));
  }

  private static <T, E extends Exception> T call(
      ObservabilityManager manager, TracedOptions options, TraceContext parent, TracedOperation<T, E> fn) throws E {
    if (!options.recordMetrics()) {
      return manager.traceOperation(options.operationName(), fn, parent, options.metadata());
    }
    long started = System.nanoTime();
    boolean failed = true;
    try {
      T result = manager.traceOperation(options.operationName(), fn, parent, options.metadata());
      failed = false;
      return result;
    } finally {
      String operation = failed ? options.operationName() + ERROR_SUFFIX : options.operationName();
      manager.recordEvent(new SystemEvent(
          EVENT_SOURCE,
          operation,
          elapsedMs(started),
          failed ? EventStatus.FAILED : EventStatus.COMPLETED,
          options.metadata()));
    }
  }

  private static <T, E extends Exception> T traceEntity(
      ObservabilityManager manager,
      String spanName,
      Map<String, Object> tags,
      TracedOperation<T, E> fn,
      BiFunction<Double, EventStatus, ObservabilityEvent> eventFactory) throws E {
    Objects.requireNonNull(manager, "manager");
    Objects.requireNonNull(fn, "fn");
    long started = System.nanoTime();
    EventStatus status = EventStatus.FAILED;
    try {
      T result = manager.traceOperation(spanName, fn, null, tags);
      status = EventStatus.COMPLETED;
      return result;
    } finally {
      manager.recordEvent(eventFactory.apply(elapsedMs(started), status));
    }
  }

  private static void requireArguments(ObservabilityManager manager, TracedOptions options, Object fn) {
    Objects.requireNonNull(manager, "manager");
    Objects.requireNonNull(options, "options");
    Objects.requireNonNull(fn, "fn");
  }

  private static double elapsedMs(long startedNanos) {
    return Math.max(0L, System.nanoTime() - startedNanos) / 1_000_000d;
  }
}
