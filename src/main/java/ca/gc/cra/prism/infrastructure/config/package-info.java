/**
 * Hot reload of the YAML configuration file.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.config;
