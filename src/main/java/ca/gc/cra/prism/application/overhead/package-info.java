/**
 * Self-monitoring of instrumentation cost.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.overhead;
