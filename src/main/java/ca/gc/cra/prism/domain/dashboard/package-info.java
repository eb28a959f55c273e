/**
 * Dashboard bundle and insight values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.domain.dashboard;
