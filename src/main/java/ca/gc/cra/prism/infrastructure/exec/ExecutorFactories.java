package ca.gc.cra.prism.infrastructure.exec;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the background threads PRISM owns.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  /** Name of the metrics collection thread. */
  public static final String METRICS_COLLECTOR_THREAD = "prism-metrics-collector";
  public static final String CONFIG_WATCHER_THREAD = "prism-config-watcher";

  private ExecutorFactories() {}

  /**
   * Builds a single-thread scheduler on a daemon thread so collection never keeps the host process alive.
   *
   * @param name thread name; blank falls back to {@value #METRICS_COLLECTOR_THREAD}
   * @return scheduler owning one daemon thread
   */
  public static ScheduledExecutorService newSingleThreadScheduler(String name) {
    String threadName = (name == null || name.isBlank()) ? METRICS_COLLECTOR_THREAD : name;
    return Executors.newSingleThreadScheduledExecutor(daemonFactory(threadName));
  }

  static ThreadFactory daemonFactory(String prefix) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      int n = index.getAndIncrement();
      thread.setName(n == 0 ? prefix : prefix + "-" + n);
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(
          (t, ex) -> log.error("Uncaught exception on {}", t.getName(), ex));
      return thread;
    };
  }
}
