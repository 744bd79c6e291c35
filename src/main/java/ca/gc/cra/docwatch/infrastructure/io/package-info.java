/**
 * File output helpers.
 */
package ca.gc.cra.docwatch.infrastructure.io;
