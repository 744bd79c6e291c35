package ca.gc.cra.docwatch.application.pipeline;

import ca.gc.cra.docwatch.domain.document.DocumentStatus;
import java.nio.file.Path;
import java.util.Map;

/**
 * Result of a status report run.
 *
 * @param file written report file
 * @param rowCount number of data rows written
 * @param statusCounts documents per status
 * @param reminderCount documents flagged as needing a reminder
 * @since 0.1.0
 */
public record ReportOutcome(Path file, int rowCount, Map<DocumentStatus, Integer> statusCounts, int reminderCount) {
  public ReportOutcome {
    statusCounts = Map.copyOf(statusCounts);
  }
}
