/**
 * JVM readings for the scheduled metrics pull.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.performance;
