package ca.gc.cra.docwatch.application.port;

import ca.gc.cra.docwatch.application.reminder.ReportRow;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Port persisting the status report.
 *
 * @since 0.1.0
 */
public interface ReportWriter {
  /**
   * Writes {@code rows} to {@code target}, replacing any previous content.
   *
   * @param target destination file
   * @param rows report rows in final order
   * @throws IOException when the report cannot be written
   */
  void write(Path target, List<ReportRow> rows) throws IOException;
}
