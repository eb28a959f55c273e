/**
 * Ports through which the observability layer reaches its collaborators.
 * <p><strong>Role:</strong> Application boundary; adapters live in {@code ca.gc.cra.prism.infrastructure}.</p>
 * <p><strong>Conventions:</strong> Ports with an obvious inert behaviour expose a {@code NO_OP} (or {@code NONE})
 * constant for tests and partial deployments.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.port;
