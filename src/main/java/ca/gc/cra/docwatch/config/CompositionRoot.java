package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.application.delivery.DeliveryDispatcher;
import ca.gc.cra.docwatch.application.notify.NotificationComposer;
import ca.gc.cra.docwatch.application.pipeline.ReminderUseCase;
import ca.gc.cra.docwatch.application.pipeline.ReportUseCase;
import ca.gc.cra.docwatch.application.pipeline.ScheduledRunUseCase;
import ca.gc.cra.docwatch.application.pipeline.TestEmailUseCase;
import ca.gc.cra.docwatch.application.port.AttemptLogWriter;
import ca.gc.cra.docwatch.application.port.ClockPort;
import ca.gc.cra.docwatch.application.port.DocumentSource;
import ca.gc.cra.docwatch.application.port.LastSuccessStore;
import ca.gc.cra.docwatch.application.port.MailTransport;
import ca.gc.cra.docwatch.application.port.MetricsPort;
import ca.gc.cra.docwatch.application.reminder.ReminderFilter;
import ca.gc.cra.docwatch.application.reminder.ReportBuilder;
import ca.gc.cra.docwatch.application.reminder.StatusEngine;
import ca.gc.cra.docwatch.application.reminder.SummaryBuilder;
import ca.gc.cra.docwatch.infrastructure.csv.CsvDocumentSource;
import ca.gc.cra.docwatch.infrastructure.csv.CsvReportWriter;
import ca.gc.cra.docwatch.infrastructure.delivery.NdjsonAttemptLogWriter;
import ca.gc.cra.docwatch.infrastructure.mail.JakartaMailTransport;
import ca.gc.cra.docwatch.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.docwatch.infrastructure.state.FileLastSuccessStore;
import ca.gc.cra.docwatch.infrastructure.time.SystemClockAdapter;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires DOCWATCH use cases to concrete adapters for one loaded {@link AppConfig}.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so CLIs only translate arguments.</p>
 * <p><strong>Role:</strong> Composition root spanning ingest -> classify -> notify -> deliver.</p>
 * <p><strong>Thread-safety:</strong> Factory methods build fresh graphs and are not synchronized.</p>
 * <p><strong>Observability:</strong> Owns the metrics adapter; {@link #close()} flushes it.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final AppConfig config;
  private final MailTransport transport;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates a composition root using Jakarta Mail, the system clock, and OpenTelemetry metrics.
   *
   * @param config loaded configuration; must not be {@code null}
   */
  public CompositionRoot(AppConfig config) {
    this(config, new JakartaMailTransport(), new SystemClockAdapter(), new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with explicit adapters (used by tests).
   *
   * @param config loaded configuration
   * @param transport mail transport
   * @param clock clock
   * @param metrics metrics sink
   */
  public CompositionRoot(AppConfig config, MailTransport transport, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public AppConfig config() {
    return config;
  }

  public ClockPort clock() {
    return clock;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public DocumentSource documentSource() {
    return new CsvDocumentSource(config.dataFilePath());
  }

  public ReminderFilter reminderFilter() {
    return new ReminderFilter(config.reminder().thresholds(), config.reminder().handledRemark(),
        LoggerFactory.getLogger(ReminderFilter.class));
  }

  public NotificationComposer notificationComposer() {
    MailTemplateConfig templates = config.mailTemplate();
    return new NotificationComposer(templates.subject(), templates.bodyHtml(), templates.tableRowHtml());
  }

  public DeliveryDispatcher deliveryDispatcher() {
    return new DeliveryDispatcher(config.email().relays(), transport, metrics);
  }

  /**
   * Attempt log writer for {@code file}, or {@link AttemptLogWriter#NONE} when {@code file} is {@code null}.
   *
   * @param file NDJSON target
   * @return writer
   */
  public AttemptLogWriter attemptLogWriter(Path file) {
    return file == null ? AttemptLogWriter.NONE : new NdjsonAttemptLogWriter(file, clock);
  }

  public ReminderUseCase reminderUseCase(AttemptLogWriter attemptLog) {
    return new ReminderUseCase(
        documentSource(),
        new StatusEngine(),
        config.report().expiringThreshold(),
        reminderFilter(),
        new SummaryBuilder(),
        notificationComposer(),
        deliveryDispatcher(),
        config.email().recipients(),
        clock,
        attemptLog,
        metrics);
  }

  public ReportUseCase reportUseCase() {
    return new ReportUseCase(
        documentSource(),
        new StatusEngine(),
        config.report().expiringThreshold(),
        reminderFilter(),
        new ReportBuilder(),
        new CsvReportWriter(),
        clock,
        metrics);
  }

  public TestEmailUseCase testEmailUseCase(AttemptLogWriter attemptLog) {
    return new TestEmailUseCase(
        deliveryDispatcher(),
        config.email().recipients(),
        ClasspathTemplates.load(ClasspathTemplates.TEST_EMAIL),
        clock,
        attemptLog);
  }

  /**
   * Scheduler wrapper around the reminder use case.
   *
   * @param stateFile last-success file; {@code null} selects {@link FileLastSuccessStore#DEFAULT_PATH}
   * @param attemptLog attempt log sink for the wrapped reminder run
   * @return scheduled run use case
   */
  public ScheduledRunUseCase scheduledRunUseCase(Path stateFile, AttemptLogWriter attemptLog) {
    LastSuccessStore store =
        new FileLastSuccessStore(stateFile == null ? FileLastSuccessStore.DEFAULT_PATH : stateFile);
    return new ScheduledRunUseCase(reminderUseCase(attemptLog)::run, store, clock);
  }

  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
