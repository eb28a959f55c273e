/**
 * Ordered middleware pipeline invoked around traced operations, plus the built-in middlewares.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.middleware;
