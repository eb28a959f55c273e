/**
 * Argument validation helpers shared by configuration parsing and public entry points.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.validation;
