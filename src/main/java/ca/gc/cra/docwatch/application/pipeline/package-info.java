/**
 * Use cases composing the reminder pipeline: reminder run, status report, test email, and scheduled runs.
 * <p><strong>Observability:</strong> Every run binds an MDC {@code runId} that is removed when the run ends.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.docwatch.application.pipeline;
