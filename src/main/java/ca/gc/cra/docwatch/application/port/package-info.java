/**
 * <strong>Purpose:</strong> Ports between DOCWATCH use cases and their adapters (documents, clock, metrics,
 * mail relays, report and state persistence).
 * <p><strong>Concurrency:</strong> Ports are invoked from a single run thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.application.port;
