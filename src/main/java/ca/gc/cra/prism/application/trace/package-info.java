/**
 * Trace context creation and header propagation.
 * <p><strong>Role:</strong> Pure data transformations used by the orchestrator, the tracing adapter, and
 * callers that cross process boundaries.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.application.trace;
