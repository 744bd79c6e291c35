/**
 * Scheduler state persistence.
 */
package ca.gc.cra.docwatch.infrastructure.state;
