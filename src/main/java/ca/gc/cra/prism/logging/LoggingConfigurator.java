package ca.gc.cra.prism.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts logging verbosity of the running JVM.
 * <p><strong>Why:</strong> Operators raise verbosity through the {@code verbose} configuration key while
 * troubleshooting without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Delegates to Logback, which synchronizes level changes.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG.
   */
  public static void enableVerboseLogging() {
    setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level level name such as {@code INFO}; unknown names fall back to DEBUG
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setLevel(String loggerName, String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      Level target = Level.toLevel(level, Level.DEBUG);
      if (!target.equals(logger.getLevel())) {
        logger.setLevel(target);
      }
      return true;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
