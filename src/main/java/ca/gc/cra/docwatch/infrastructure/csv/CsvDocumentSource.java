package ca.gc.cra.docwatch.infrastructure.csv;

import ca.gc.cra.docwatch.application.port.DocumentSource;
import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.document.DocumentValidationException;
import ca.gc.cra.docwatch.domain.time.DateResolver;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads the document roster from a CSV file.
 * <p><strong>Format:</strong> header row with {@code person_name}, {@code document_type}, {@code expiry_date}
 * (required) and {@code start_date}, {@code remarks} (optional); UTF-8 with optional BOM, or GBK. Row numbers
 * in errors count the header as row 1.</p>
 * <p><strong>Validation:</strong> blank person or document kind and unparsable dates abort the load with
 * {@link DocumentValidationException}. A blank expiry cell yields a document with unknown status.</p>
 *
 * @since 0.1.0
 */
public final class CsvDocumentSource implements DocumentSource {
  private static final Logger log = LoggerFactory.getLogger(CsvDocumentSource.class);

  static final String PERSON_NAME = "person_name";
  static final String DOCUMENT_TYPE = "document_type";
  static final String START_DATE = "start_date";
  static final String EXPIRY_DATE = "expiry_date";
  static final String REMARKS = "remarks";
  static final List<String> REQUIRED_COLUMNS = List.of(PERSON_NAME, DOCUMENT_TYPE, EXPIRY_DATE);

  private final Path file;

  public CsvDocumentSource(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public List<DocumentRecord> load() throws IOException {
    if (!Files.exists(file)) {
      throw new NoSuchFileException(file.toString(), null, "roster CSV not found (run 'docwatch sample' to create one)");
    }
    log.info("Reading documents from {}", file);
    CsvSupport.Decoded decoded = CsvSupport.decode(Files.readAllBytes(file));
    log.debug("Decoded {} as {}", file, decoded.charset());
    List<String[]> rows = CsvSupport.readRows(decoded.text());
    if (rows.isEmpty()) {
      throw new DocumentValidationException("CSV file " + file + " has no header row");
    }
    Map<String, Integer> columns = columns(rows.get(0));
    List<String> missing = REQUIRED_COLUMNS.stream().filter(c -> !columns.containsKey(c)).toList();
    if (!missing.isEmpty()) {
      throw new DocumentValidationException("CSV file " + file + " is missing required column(s) " + missing);
    }

    List<DocumentRecord> documents = new ArrayList<>(rows.size() - 1);
    for (int i = 1; i < rows.size(); i++) {
      String[] row = rows.get(i);
      if (isBlank(row)) {
        continue;
      }
      documents.add(toRecord(row, columns, i + 1));
    }
    if (documents.isEmpty()) {
      log.warn("CSV file {} contains no document rows", file);
    } else {
      log.info("Read {} documents from {}", documents.size(), file);
    }
    return documents;
  }

  @Override
  public String describe() {
    return file.toString();
  }

  private DocumentRecord toRecord(String[] row, Map<String, Integer> columns, int rowNumber) {
    String person = required(row, columns, PERSON_NAME, rowNumber);
    String kind = required(row, columns, DOCUMENT_TYPE, rowNumber);
    LocalDate expiry = date(row, columns, EXPIRY_DATE, rowNumber);
    LocalDate start = date(row, columns, START_DATE, rowNumber);
    String remarks = cell(row, columns, REMARKS);
    if (start != null && expiry != null && !start.isBefore(expiry)) {
      log.warn("Row {}: start_date {} is not before expiry_date {} ({} / {})", rowNumber, start, expiry, person, kind);
    }
    return new DocumentRecord(person, kind, start, expiry, remarks, rowNumber);
  }

  private static String required(String[] row, Map<String, Integer> columns, String column, int rowNumber) {
    String value = cell(row, columns, column);
    if (value.isEmpty()) {
      throw new DocumentValidationException("row " + rowNumber + ": '" + column + "' must not be blank");
    }
    return value;
  }

  private static LocalDate date(String[] row, Map<String, Integer> columns, String column, int rowNumber) {
    String value = cell(row, columns, column);
    if (value.isEmpty()) {
      return null;
    }
    return DateResolver.parse(value).orElseThrow(() -> new DocumentValidationException(
        "row " + rowNumber + ": invalid " + column + " '" + value + "'"));
  }

  private static String cell(String[] row, Map<String, Integer> columns, String column) {
    Integer index = columns.get(column);
    if (index == null || index >= row.length || row[index] == null) {
      return "";
    }
    return row[index].trim();
  }

  private static Map<String, Integer> columns(String[] header) {
    Map<String, Integer> columns = new HashMap<>();
    for (int i = 0; i < header.length; i++) {
      String name = header[i] == null ? "" : header[i].trim().toLowerCase(Locale.ROOT);
      if (!name.isEmpty()) {
        columns.putIfAbsent(name, i);
      }
    }
    return columns;
  }

  private static boolean isBlank(String[] row) {
    for (String cell : row) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }
}
