package ca.gc.cra.prism.application.middleware;

import ca.gc.cra.prism.domain.trace.TraceContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Priority-ordered registry of middlewares invoked around traced operations.
 * <p><strong>Why:</strong> Lets other subsystems observe every operation without the orchestrator depending on
 * them.</p>
 * <p><strong>Ordering:</strong> Ascending priority; equal priorities keep registration order.</p>
 * <p><strong>Isolation:</strong> Each hook failure, {@link Error}s included, is logged at ERROR and skipped; later
 * hooks still run. Only {@link VirtualMachineError}s propagate.</p>
 * <p><strong>Thread-safety:</strong> Registry mutations take one lock; hooks run on a snapshot with no lock
 * held, so hooks may block or register middlewares themselves.</p>
 *
 * @since 0.1.0
 */
public final class MiddlewareManager {
  private static final Logger log = LoggerFactory.getLogger(MiddlewareManager.class);
  private static final Comparator<Middleware> BY_PRIORITY = Comparator.comparingInt(Middleware::priority);

  private final Object lock = new Object();
  private List<Middleware> middlewares = List.of();

  /**
   * Adds a middleware.
   *
   * @param middleware registration
   * @throws IllegalArgumentException if a middleware with the same name is registered
   */
  public void register(Middleware middleware) {
    Objects.requireNonNull(middleware, "middleware");
    synchronized (lock) {
      for (Middleware existing : middlewares) {
        if (existing.name().equals(middleware.name())) {
          throw new IllegalArgumentException("Middleware already registered: " + middleware.name());
        }
      }
      List<Middleware> next = new ArrayList<>(middlewares);
      next.add(middleware);
      next.sort(BY_PRIORITY);
      middlewares = List.copyOf(next);
    }
    log.debug("Middleware {} registered with priority {} (enabled={})",
        middleware.name(), middleware.priority(), middleware.enabled());
  }

  /**
   * Removes a middleware by name.
   *
   * @param name middleware name
   * @return {@code true} when a middleware was removed
   */
  public boolean unregister(String name) {
    synchronized (lock) {
      List<Middleware> next = new ArrayList<>(middlewares);
      boolean removed = next.removeIf(middleware -> middleware.name().equals(name));
      if (!removed) {
        return false;
      }
      middlewares = List.copyOf(next);
    }
    log.debug("Middleware {} unregistered", name);
    return true;
  }

  /**
   * Enables or disables a middleware without changing its position.
   *
   * @param name middleware name
   * @param enabled new state
   * @return {@code true} when the middleware exists
   */
  public boolean setEnabled(String name, boolean enabled) {
    synchronized (lock) {
      List<Middleware> next = new ArrayList<>(middlewares);
      for (int i = 0; i < next.size(); i++) {
        if (next.get(i).name().equals(name)) {
          next.set(i, next.get(i).withEnabled(enabled));
          middlewares = List.copyOf(next);
          return true;
        }
      }
      return false;
    }
  }

  /**
   * Returns the registrations in execution order.
   *
   * @return immutable snapshot
   */
  public List<Middleware> getMiddlewares() {
    synchronized (lock) {
      return middlewares;
    }
  }

  public int size() {
    return getMiddlewares().size();
  }

  public void executeBeforeHooks(TraceContext context, String operation, Map<String, Object> metadata) {
    Map<String, Object> view = hookView(metadata);
    for (Middleware middleware : getMiddlewares()) {
      if (!middleware.enabled()) {
        continue;
      }
      try {
        middleware.hooks().beforeOperation(context, operation, view);
      } catch (VirtualMachineError fatal) {
        throw fatal;
      } catch (Throwable ex) {
        log.error("Middleware {} beforeOperation hook failed for {}", middleware.name(), operation, ex);
      }
    }
  }

  public void executeAfterHooks(TraceContext context, String operation, Object result, double durationMs) {
    for (Middleware middleware : getMiddlewares()) {
      if (!middleware.enabled()) {
        continue;
      }
      try {
        middleware.hooks().afterOperation(context, operation, result, durationMs);
      } catch (VirtualMachineError fatal) {
        throw fatal;
      } catch (Throwable ex) {
        log.error("Middleware {} afterOperation hook failed for {}", middleware.name(), operation, ex);
      }
    }
  }

  public void executeErrorHooks(TraceContext context, String operation, Throwable error, double durationMs) {
    for (Middleware middleware : getMiddlewares()) {
      if (!middleware.enabled()) {
        continue;
      }
      try {
        middleware.hooks().onError(context, operation, error, durationMs);
      } catch (VirtualMachineError fatal) {
        throw fatal;
      } catch (Throwable ex) {
        log.error("Middleware {} onError hook failed for {}", middleware.name(), operation, ex);
      }
    }
  }

  /** Read-only copy of {@code metadata} without null keys or values. */
  private static Map<String, Object> hookView(Map<String, Object> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> view = new LinkedHashMap<>();
    metadata.forEach((key, value) -> {
      if (key != null && value != null) {
        view.put(key, value);
      }
    });
    return Collections.unmodifiableMap(view);
  }
}
