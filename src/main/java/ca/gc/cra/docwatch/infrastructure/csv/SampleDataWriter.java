package ca.gc.cra.docwatch.infrastructure.csv;

import ca.gc.cra.docwatch.domain.time.DateResolver;
import ca.gc.cra.docwatch.infrastructure.io.AtomicFileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a five-row demonstration roster with dates relative to a given day.
 *
 * @since 0.1.0
 */
public final class SampleDataWriter {
  private static final Logger log = LoggerFactory.getLogger(SampleDataWriter.class);

  static final String[] HEADER = {"person_name", "document_type", "start_date", "expiry_date", "remarks"};

  private record Sample(String person, String kind, int startOffset, int expiryOffset, String remarks) {}

  private static final List<Sample> SAMPLES = List.of(
      new Sample("张三", "身份证", -3650, 365, "研发部"),
      new Sample("李四", "护照", -1825, 30, "市场部"),
      new Sample("王五", "驾驶证", -2190, 7, "行政部"),
      new Sample("赵六", "工作许可证", -365, -5, "技术部"),
      new Sample("钱七", "健康证", -300, 60, "食堂"));

  /**
   * Writes the sample roster.
   *
   * @param target destination CSV
   * @param today reference day for the relative dates
   * @return number of rows written
   * @throws IOException when the file cannot be written
   */
  public int write(Path target, LocalDate today) throws IOException {
    List<String[]> rows = new ArrayList<>(SAMPLES.size());
    for (Sample sample : SAMPLES) {
      rows.add(new String[] {
          sample.person(),
          sample.kind(),
          DateResolver.format(today.plusDays(sample.startOffset())),
          DateResolver.format(today.plusDays(sample.expiryOffset())),
          sample.remarks()
      });
    }
    AtomicFileWriter.write(target, out -> CsvSupport.writeRows(out, HEADER, rows));
    log.info("Wrote sample roster {} ({} rows)", target, rows.size());
    return rows.size();
  }
}
