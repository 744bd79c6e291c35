package ca.gc.cra.docwatch.infrastructure.csv;

import ca.gc.cra.docwatch.application.port.ReportWriter;
import ca.gc.cra.docwatch.application.reminder.ReportRow;
import ca.gc.cra.docwatch.infrastructure.io.AtomicFileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the status report as CSV, replacing the target atomically.
 *
 * @since 0.1.0
 */
public final class CsvReportWriter implements ReportWriter {
  private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

  static final String[] HEADER = {
      "person_name", "document_type", "start_date", "expiry_date", "remarks",
      "days_left", "status", "needs_reminder"
  };

  @Override
  public void write(Path target, List<ReportRow> rows) throws IOException {
    List<String[]> lines = new ArrayList<>(rows.size());
    for (ReportRow row : rows) {
      lines.add(new String[] {
          row.personName(),
          row.documentType(),
          row.startDate(),
          row.expiryDate(),
          row.remarks(),
          row.daysLeft() == null ? "" : row.daysLeft().toString(),
          row.statusLabel(),
          row.needsReminder() ? "是" : "否"
      });
    }
    AtomicFileWriter.write(target, out -> CsvSupport.writeRows(out, HEADER, lines));
    log.info("Wrote status report {} ({} rows)", target, rows.size());
  }
}
