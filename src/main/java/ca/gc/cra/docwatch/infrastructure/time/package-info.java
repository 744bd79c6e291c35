/**
 * Clock adapters.
 */
package ca.gc.cra.docwatch.infrastructure.time;
