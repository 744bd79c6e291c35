/**
 * <strong>Purpose:</strong> Multi-relay notification delivery with classified failover and remediation hints.
 * <p><strong>Concurrency:</strong> Relays are attempted sequentially on the calling thread.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.application.delivery;
