/**
 * Thread factories for PRISM background work.
 * <p><strong>Concurrency:</strong> Threads are daemons named after their role so thread dumps stay readable.</p>
 */
package ca.gc.cra.prism.infrastructure.exec;
