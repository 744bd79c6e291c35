/**
 * CSV adapters: roster ingestion, status report, and sample data.
 */
package ca.gc.cra.docwatch.infrastructure.csv;
