package ca.gc.cra.docwatch.application.reminder;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.time.DateResolver;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Builds status report rows ordered by status priority, then ascending {@code daysLeft} with unknown
 * values last.
 *
 * @since 0.1.0
 */
public final class ReportBuilder {
  static final Comparator<ReportRow> REPORT_ORDER =
      Comparator.<ReportRow>comparingInt(row -> row.status().reportPriority())
          .thenComparing(ReportRow::daysLeft, Comparator.nullsLast(Comparator.naturalOrder()));

  /**
   * Converts classified documents into sorted report rows.
   *
   * @param documents classified and filtered documents
   * @return sorted rows
   * @throws IllegalStateException if a document has not been classified
   */
  public List<ReportRow> build(List<DocumentRecord> documents) {
    Objects.requireNonNull(documents, "documents");
    return documents.stream()
        .map(ReportBuilder::toRow)
        .sorted(REPORT_ORDER)
        .toList();
  }

  private static ReportRow toRow(DocumentRecord document) {
    if (document.status() == null) {
      throw new IllegalStateException("document must be classified before reporting: " + document);
    }
    return new ReportRow(
        document.personName(),
        document.documentType(),
        DateResolver.format(document.startDate()),
        DateResolver.format(document.expiryDate()),
        document.remarks(),
        document.daysLeft(),
        document.status(),
        document.needsReminder());
  }
}
