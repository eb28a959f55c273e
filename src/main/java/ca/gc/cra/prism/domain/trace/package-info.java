/**
 * Trace identity values shared by the tracing port, the propagation helpers, and the orchestrator.
 * <p><strong>Role:</strong> Domain layer; no I/O and no framework dependencies.</p>
 * <p><strong>Concurrency:</strong> Values are immutable apart from {@code TraceContext} metadata annotations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.domain.trace;
