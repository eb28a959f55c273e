package ca.gc.cra.prism.application.middleware;

import ca.gc.cra.prism.application.port.ClockPort;
import ca.gc.cra.prism.application.trace.TracePropagation;
import ca.gc.cra.prism.config.MiddlewareSettings;
import ca.gc.cra.prism.domain.trace.TraceContext;
import ca.gc.cra.prism.logging.Logs;
import ca.gc.cra.prism.logging.TraceLogScope;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for the built-in middlewares.
 *
 * @since 0.1.0
 */
public final class Middlewares {
  private static final Logger log = LoggerFactory.getLogger(Middlewares.class);

  public static final String PERFORMANCE = "performance-monitor";
  public static final String SECURITY = "security-monitor";
  public static final String RATE_LIMIT = "rate-limit-monitor";
  public static final String LOGGING = "logging-monitor";

  static final String HEAP_BEFORE_KEY = "performance.heapUsedBefore";
  private static final long BYTES_PER_MB = 1024L * 1024L;
  private static final long MINUTE_MS = 60_000L;
  private static final int MAX_LOGGED_VALUE_CHARS = 256;

  private Middlewares() {}

  /**
   * Builds the enabled built-ins described by {@code settings}; disabled ones are registered disabled.
   *
   * @param settings built-in switches and thresholds
   * @param clock clock for the rate-limit window
   * @return registrations in priority order
   */
  public static List<Middleware> builtIns(MiddlewareSettings settings, ClockPort clock) {
    Objects.requireNonNull(settings, "settings");
    List<Middleware> list = new ArrayList<>();
    list.add(security().withEnabled(settings.securityEnabled()));
    list.add(performance(settings.slowOperationMs(), settings.memoryWarningMb())
        .withEnabled(settings.performanceEnabled()));
    list.add(rateLimit(settings.requestsPerMinute(), clock).withEnabled(settings.rateLimitEnabled()));
    list.add(logging().withEnabled(settings.loggingEnabled()));
    return List.copyOf(list);
  }

  public static Middleware performance(long slowOperationMs, long memoryWarningMb) {
    Runtime runtime = Runtime.getRuntime();
    return performance(slowOperationMs, memoryWarningMb, () -> runtime.totalMemory() - runtime.freeMemory());
  }

  /**
   * Logs operations slower than {@code slowOperationMs} and heap growth above {@code memoryWarningMb}.
   *
   * @param slowOperationMs duration threshold
   * @param memoryWarningMb heap growth threshold
   * @param heapUsedBytes heap reading
   * @return registration with priority 50
   */
  public static Middleware performance(long slowOperationMs, long memoryWarningMb, LongSupplier heapUsedBytes) {
    Objects.requireNonNull(heapUsedBytes, "heapUsedBytes");
    MiddlewareHooks hooks = new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        context.annotate(HEAP_BEFORE_KEY, heapUsedBytes.getAsLong());
      }

      @Override
      public void afterOperation(TraceContext context, String operation, Object result, double durationMs) {
        if (durationMs > slowOperationMs) {
          log.warn("Slow operation {} took {} ms (threshold {} ms, {})",
              operation, String.format(Locale.ROOT, "%.1f", durationMs), slowOperationMs,
              TracePropagation.formatForLog(context));
        }
        Object before = context.metadata().get(HEAP_BEFORE_KEY);
        long start = before instanceof Long value ? value : 0L;
        double growthMb = (heapUsedBytes.getAsLong() - start) / (double) BYTES_PER_MB;
        if (growthMb > memoryWarningMb) {
          log.warn("Operation {} grew heap by {} MB (threshold {} MB, {})",
              operation, String.format(Locale.ROOT, "%.1f", growthMb), memoryWarningMb,
              TracePropagation.formatForLog(context));
        }
      }
    };
    Map<String, Object> config = Map.of("slowOperationMs", slowOperationMs, "memoryWarningMb", memoryWarningMb);
    return new Middleware(PERFORMANCE, 50, true, hooks, config);
  }

  /**
   * Audits authentication-related operations.
   *
   * @return registration with priority 25
   */
  public static Middleware security() {
    MiddlewareHooks hooks = new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        if (isSecuritySensitive(operation)) {
          log.info("Security operation {} started ({}) metadata={}",
              operation, TracePropagation.formatForLog(context), Logs.sanitize(metadata, MAX_LOGGED_VALUE_CHARS));
        }
      }

      @Override
      public void onError(TraceContext context, String operation, Throwable error, double durationMs) {
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        if (isSecuritySensitive(operation) || message.contains("auth")) {
          log.error("Security operation {} failed after {} ms ({})",
              operation, String.format(Locale.ROOT, "%.1f", durationMs), TracePropagation.formatForLog(context),
              error);
        }
      }
    };
    return new Middleware(SECURITY, 25, true, hooks, Map.of());
  }

  /**
   * Warns when one operation within one trace runs more than {@code requestsPerMinute} times in a minute.
   *
   * @param requestsPerMinute per-window budget
   * @param clock window clock
   * @return registration with priority 75
   */
  public static Middleware rateLimit(int requestsPerMinute, ClockPort clock) {
    Objects.requireNonNull(clock, "clock");
    if (requestsPerMinute <= 0) {
      throw new IllegalArgumentException("requestsPerMinute must be positive");
    }
    RateLimitHooks hooks = new RateLimitHooks(requestsPerMinute, clock);
    return new Middleware(RATE_LIMIT, 75, true, hooks, Map.of("requestsPerMinute", requestsPerMinute));
  }

  /** Per trace and operation request windows; expired windows are swept at most once a minute. */
  static final class RateLimitHooks implements MiddlewareHooks {
    private final int requestsPerMinute;
    private final ClockPort clock;
    private final Map<String, long[]> windows = new HashMap<>();
    private long nextSweepAt = Long.MIN_VALUE;

    RateLimitHooks(int requestsPerMinute, ClockPort clock) {
      this.requestsPerMinute = requestsPerMinute;
      this.clock = clock;
    }

    @Override
    public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
      String key = context.shortTraceId() + "_" + operation;
      long now = clock.nowMillis();
      long count;
      synchronized (windows) {
        if (now >= nextSweepAt) {
          windows.values().removeIf(window -> now - window[1] > MINUTE_MS);
          nextSweepAt = now + MINUTE_MS;
        }
        long[] window = windows.get(key);
        if (window == null || now - window[1] > MINUTE_MS) {
          window = new long[] {0L, now};
          windows.put(key, window);
        }
        count = ++window[0];
      }
      if (count > requestsPerMinute) {
        log.warn("Rate limit exceeded for operation {}: {} requests in the current minute (limit {}, {})",
            operation, count, requestsPerMinute, TracePropagation.formatForLog(context));
      }
    }

    int trackedWindows() {
      synchronized (windows) {
        return windows.size();
      }
    }
  }

  /**
   * Logs every operation at DEBUG with the trace ids in the MDC.
   *
   * @return registration with priority 100
   */
  public static Middleware logging() {
    MiddlewareHooks hooks = new MiddlewareHooks() {
      @Override
      public void beforeOperation(TraceContext context, String operation, Map<String, Object> metadata) {
        if (!log.isDebugEnabled()) {
          return;
        }
        try (TraceLogScope ignored = TraceLogScope.open(context)) {
          log.debug("Operation {} started metadata={}", operation, Logs.sanitize(metadata, MAX_LOGGED_VALUE_CHARS));
        }
      }

      @Override
      public void afterOperation(TraceContext context, String operation, Object result, double durationMs) {
        if (!log.isDebugEnabled()) {
          return;
        }
        try (TraceLogScope ignored = TraceLogScope.open(context)) {
          log.debug("Operation {} completed in {} ms", operation, String.format(Locale.ROOT, "%.3f", durationMs));
        }
      }

      @Override
      public void onError(TraceContext context, String operation, Throwable error, double durationMs) {
        try (TraceLogScope ignored = TraceLogScope.open(context)) {
          log.debug("Operation {} failed in {} ms: {}",
              operation, String.format(Locale.ROOT, "%.3f", durationMs), error.toString());
        }
      }
    };
    return new Middleware(LOGGING, Middleware.DEFAULT_PRIORITY, true, hooks, Map.of());
  }

  /**
   * Wraps caller-supplied hooks.
   *
   * @param name unique name
   * @param hooks callbacks
   * @param config descriptive settings; may be {@code null}
   * @param priority ordering key
   * @return enabled registration
   */
  public static Middleware custom(String name, MiddlewareHooks hooks, Map<String, Object> config, int priority) {
    return new Middleware(name, priority, true, hooks, config);
  }

  public static Middleware custom(String name, MiddlewareHooks hooks) {
    return custom(name, hooks, Map.of(), Middleware.DEFAULT_PRIORITY);
  }

  static boolean isSecuritySensitive(String operation) {
    if (operation == null) {
      return false;
    }
    String normalized = operation.toLowerCase(Locale.ROOT);
    return normalized.contains("auth") || normalized.contains("login") || normalized.contains("password");
  }
}
