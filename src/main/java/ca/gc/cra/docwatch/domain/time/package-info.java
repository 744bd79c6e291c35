/**
 * Date parsing, day arithmetic, and formatting shared by every pipeline stage.
 */
package ca.gc.cra.docwatch.domain.time;
