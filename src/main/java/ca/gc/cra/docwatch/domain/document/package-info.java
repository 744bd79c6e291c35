/**
 * Roster documents, their computed expiry status, and reminder thresholds.
 */
package ca.gc.cra.docwatch.domain.document;
