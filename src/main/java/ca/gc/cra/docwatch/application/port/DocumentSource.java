package ca.gc.cra.docwatch.application.port;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import java.io.IOException;
import java.util.List;

/**
 * Port supplying the roster of documents for one run.
 *
 * @since 0.1.0
 */
public interface DocumentSource {
  /**
   * Reads every document, in source order.
   *
   * @return unclassified documents; empty when the roster has no data rows
   * @throws IOException when the roster cannot be read
   * @throws ca.gc.cra.docwatch.domain.document.DocumentValidationException when a row is malformed
   */
  List<DocumentRecord> load() throws IOException;

  /**
   * Short description of where documents come from, for logs.
   *
   * @return description such as a file path
   */
  String describe();
}
