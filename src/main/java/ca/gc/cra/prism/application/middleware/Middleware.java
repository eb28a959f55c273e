package ca.gc.cra.prism.application.middleware;

import ca.gc.cra.prism.validation.Strings;
import java.util.Map;
import java.util.Objects;

/**
 * Registration of a {@link MiddlewareHooks} implementation.
 *
 * @param name unique name
 * @param priority ordering key; lower runs first
 * @param enabled whether hooks are invoked
 * @param hooks callbacks
 * @param config descriptive settings, for status output
 * @since 0.1.0
 */
public record Middleware(
    String name, int priority, boolean enabled, MiddlewareHooks hooks, Map<String, Object> config) {
  /** Priority given to middlewares registered without one. */
  public static final int DEFAULT_PRIORITY = 100;

  public Middleware {
    name = Strings.requirePrintableAscii("middleware name", name, 128);
    Objects.requireNonNull(hooks, "hooks");
    config = config == null ? Map.of() : Map.copyOf(config);
  }

  public static Middleware of(String name, int priority, MiddlewareHooks hooks) {
    return new Middleware(name, priority, true, hooks, Map.of());
  }

  public Middleware withEnabled(boolean value) {
    return value == enabled ? this : new Middleware(name, priority, value, hooks, config);
  }
}
