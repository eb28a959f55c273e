/**
 * Closed union of observability events and their status vocabulary.
 *
 * @since 0.1.0
 */
package ca.gc.cra.prism.domain.event;
