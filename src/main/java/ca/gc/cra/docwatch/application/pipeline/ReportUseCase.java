package ca.gc.cra.docwatch.application.pipeline;

import ca.gc.cra.docwatch.application.port.ClockPort;
import ca.gc.cra.docwatch.application.port.DocumentSource;
import ca.gc.cra.docwatch.application.port.MetricsPort;
import ca.gc.cra.docwatch.application.port.ReportWriter;
import ca.gc.cra.docwatch.application.reminder.ReminderFilter;
import ca.gc.cra.docwatch.application.reminder.ReportBuilder;
import ca.gc.cra.docwatch.application.reminder.ReportRow;
import ca.gc.cra.docwatch.application.reminder.StatusEngine;
import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.document.DocumentStatus;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the status report: every document with its status, days left, and reminder flag.
 *
 * <p>Rows are ordered expired first, then expiring soon, then the rest; ties by days left ascending with
 * missing values last.</p>
 *
 * @since 0.1.0
 */
public final class ReportUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReportUseCase.class);

  private final DocumentSource source;
  private final StatusEngine statusEngine;
  private final int expiringThreshold;
  private final ReminderFilter filter;
  private final ReportBuilder reportBuilder;
  private final ReportWriter writer;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public ReportUseCase(
      DocumentSource source,
      StatusEngine statusEngine,
      int expiringThreshold,
      ReminderFilter filter,
      ReportBuilder reportBuilder,
      ReportWriter writer,
      ClockPort clock,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.statusEngine = Objects.requireNonNull(statusEngine, "statusEngine");
    if (expiringThreshold < 0) {
      throw new IllegalArgumentException("expiringThreshold must be >= 0");
    }
    this.expiringThreshold = expiringThreshold;
    this.filter = Objects.requireNonNull(filter, "filter");
    this.reportBuilder = Objects.requireNonNull(reportBuilder, "reportBuilder");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Generates the report.
   *
   * @param target target file, or a function of today's date yielding it
   * @return report outcome
   * @throws IOException when reading the source or writing the report fails
   */
  public ReportOutcome run(Function<LocalDate, Path> target) throws IOException {
    Objects.requireNonNull(target, "target");
    try (RunContext context = RunContext.open()) {
      LocalDate today = clock.today();
      List<DocumentRecord> documents = source.load();
      Map<DocumentStatus, Integer> counts = statusEngine.classify(documents, today, expiringThreshold);
      int reminders = filter.apply(documents).size();
      List<ReportRow> rows = reportBuilder.build(documents);
      Path file = target.apply(today);
      writer.write(file, rows);
      metrics.increment("report.generated");
      log.info("Status report written to {} ({} rows, {} needing reminder, run {})",
          file, rows.size(), reminders, context.runId());
      return new ReportOutcome(file, rows.size(), counts, reminders);
    }
  }
}
