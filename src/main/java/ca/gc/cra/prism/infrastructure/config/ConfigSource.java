package ca.gc.cra.prism.infrastructure.config;

import ca.gc.cra.prism.config.ObservabilityConfig;
import java.io.IOException;

/**
 * Produces a fully merged configuration from its backing file.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ConfigSource {
  /**
   * Loads and validates the configuration.
   *
   * @return merged configuration
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if a value is invalid
   */
  ObservabilityConfig load() throws IOException;
}
