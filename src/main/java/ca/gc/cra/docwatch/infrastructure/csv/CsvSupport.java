package ca.gc.cra.docwatch.infrastructure.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared CSV reading and writing on top of Jackson's CSV dataformat.
 *
 * <p>Rows are handled as plain string arrays; headers are interpreted by the callers.</p>
 *
 * @since 0.1.0
 */
final class CsvSupport {
  static final Charset GBK = Charset.forName("GBK");

  private static final char BOM = '\uFEFF';
  private static final CsvMapper MAPPER = CsvMapper.builder()
      .enable(CsvParser.Feature.WRAP_AS_ARRAY)
      .build();

  private CsvSupport() {}

  /**
   * Decodes file bytes as UTF-8 (dropping a leading BOM), falling back to GBK for legacy exports.
   *
   * @param bytes raw file content
   * @return decoded text and the charset that worked
   * @throws CharacterCodingException when neither charset decodes the content
   */
  static Decoded decode(byte[] bytes) throws CharacterCodingException {
    try {
      return new Decoded(stripBom(strict(StandardCharsets.UTF_8, bytes)), StandardCharsets.UTF_8);
    } catch (CharacterCodingException ex) {
      return new Decoded(stripBom(strict(GBK, bytes)), GBK);
    }
  }

  /**
   * Parses CSV text into rows of cells (RFC 4180 quoting).
   *
   * @param text CSV text
   * @return rows including the header row
   * @throws IOException when the text is not valid CSV
   */
  static List<String[]> readRows(String text) throws IOException {
    List<String[]> rows = new ArrayList<>();
    try (MappingIterator<String[]> it = MAPPER.readerFor(String[].class)
        .with(CsvSchema.emptySchema())
        .readValues(text)) {
      while (it.hasNextValue()) {
        rows.add(it.nextValue());
      }
    }
    return rows;
  }

  /**
   * Writes a header and rows as UTF-8 CSV with a BOM so spreadsheet tools detect the encoding.
   *
   * @param out destination stream; closed on return
   * @param header column names
   * @param rows data rows
   * @throws IOException when writing fails
   */
  static void writeRows(OutputStream out, String[] header, List<String[]> rows) throws IOException {
    Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
    writer.write(BOM);
    try (SequenceWriter sequence = MAPPER.writerFor(String[].class)
        .with(CsvSchema.emptySchema())
        .writeValues(writer)) {
      sequence.write(header);
      for (String[] row : rows) {
        sequence.write(row);
      }
    }
  }

  private static String strict(Charset charset, byte[] bytes) throws CharacterCodingException {
    return charset.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT)
        .decode(ByteBuffer.wrap(bytes))
        .toString();
  }

  private static String stripBom(String text) {
    return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
  }

  record Decoded(String text, Charset charset) {}
}
