/**
 * <strong>Purpose:</strong> Expiry classification, reminder selection, summaries, and report rows.
 * <p><strong>Concurrency:</strong> Stages run sequentially over one batch; documents are updated in place.
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.application.reminder;
