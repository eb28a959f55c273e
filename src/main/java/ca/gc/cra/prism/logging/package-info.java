/**
 * Logging helpers: verbosity switch, metadata hygiene, and MDC trace scopes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.logging;
