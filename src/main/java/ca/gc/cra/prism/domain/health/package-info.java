/**
 * Health probe registration and result values exchanged with the health registry port.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.domain.health;
