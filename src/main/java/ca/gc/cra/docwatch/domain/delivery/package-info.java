/**
 * Relay, recipient, message, and attempt types used by notification delivery.
 */
package ca.gc.cra.docwatch.domain.delivery;
