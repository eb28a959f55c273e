/**
 * JSON rendering of metrics views, backed by Jackson databind.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.export;
