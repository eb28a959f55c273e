/**
 * Observability orchestration: lifecycle, event ingestion, traced execution, self-throttling, and exports.
 * <p><strong>Role:</strong> Application layer; depends on ports and sibling application services only.</p>
 * <p><strong>Entry points:</strong> {@link ca.gc.cra.prism.application.orchestration.ObservabilityManager} and the
 * {@link ca.gc.cra.prism.application.orchestration.Traced} helpers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.orchestration;
