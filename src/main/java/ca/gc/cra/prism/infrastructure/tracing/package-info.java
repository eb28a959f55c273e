/**
 * In-process tracing backend for the tracing port.
 * <p><strong>Role:</strong> Infrastructure adapter; swap for an exporter-backed tracer by implementing
 * {@link ca.gc.cra.prism.application.port.TracingPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.infrastructure.tracing;
