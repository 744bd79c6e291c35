package ca.gc.cra.docwatch.application.reminder;

import ca.gc.cra.docwatch.domain.document.DocumentStatus;

/**
 * One line of the status report, already formatted for output.
 *
 * @param personName person
 * @param documentType document kind
 * @param startDate formatted start date, empty when absent
 * @param expiryDate formatted expiry date, empty when absent
 * @param remarks remarks
 * @param daysLeft signed days left, {@code null} when unknown
 * @param status computed status
 * @param needsReminder whether a reminder is due
 * @since 0.1.0
 */
public record ReportRow(
    String personName,
    String documentType,
    String startDate,
    String expiryDate,
    String remarks,
    Integer daysLeft,
    DocumentStatus status,
    boolean needsReminder) {

  public String statusLabel() {
    return status.label();
  }
}
