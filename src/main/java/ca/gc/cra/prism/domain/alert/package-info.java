/**
 * Alert values exchanged with the alerting port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.domain.alert;
