package ca.gc.cra.docwatch.application.pipeline;

import ca.gc.cra.docwatch.application.delivery.DeliveryDispatcher;
import ca.gc.cra.docwatch.application.notify.ComposedNotification;
import ca.gc.cra.docwatch.application.notify.NotificationComposer;
import ca.gc.cra.docwatch.application.port.AttemptLogWriter;
import ca.gc.cra.docwatch.application.port.ClockPort;
import ca.gc.cra.docwatch.application.port.DocumentSource;
import ca.gc.cra.docwatch.application.port.MetricsPort;
import ca.gc.cra.docwatch.application.reminder.ReminderFilter;
import ca.gc.cra.docwatch.application.reminder.ReminderSummary;
import ca.gc.cra.docwatch.application.reminder.StatusEngine;
import ca.gc.cra.docwatch.application.reminder.SummaryBuilder;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import ca.gc.cra.docwatch.domain.delivery.OutgoingMessage;
import ca.gc.cra.docwatch.domain.delivery.RecipientSet;
import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> End-to-end reminder run: load, classify, filter, summarize, compose, dispatch.
 * <p><strong>Why:</strong> Keeps the batch sequence in one place so the CLI and the scheduler run the same job.</p>
 * <p><strong>Role:</strong> Application-layer use case.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Read "today" once from the clock and use it for every document.</li>
 *   <li>Skip sending when the roster is empty or no document is due.</li>
 *   <li>Hand the attempt log to the {@link AttemptLogWriter} after dispatch.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run at a time.</p>
 * <p><strong>Observability:</strong> Binds MDC {@code runId}; increments {@code reminder.candidates}.</p>
 *
 * @since 0.1.0
 */
public final class ReminderUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReminderUseCase.class);

  private final DocumentSource source;
  private final StatusEngine statusEngine;
  private final int expiringThreshold;
  private final ReminderFilter filter;
  private final SummaryBuilder summaries;
  private final NotificationComposer composer;
  private final DeliveryDispatcher dispatcher;
  private final RecipientSet recipients;
  private final ClockPort clock;
  private final AttemptLogWriter attemptLog;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param source document source
   * @param statusEngine status engine
   * @param expiringThreshold expiring-soon threshold in days
   * @param filter reminder filter
   * @param summaries summary builder
   * @param composer notification composer
   * @param dispatcher relay dispatcher
   * @param recipients notification recipients
   * @param clock clock providing "today"
   * @param attemptLog attempt log sink; {@link AttemptLogWriter#NONE} to disable
   * @param metrics metrics sink
   */
  public ReminderUseCase(
      DocumentSource source,
      StatusEngine statusEngine,
      int expiringThreshold,
      ReminderFilter filter,
      SummaryBuilder summaries,
      NotificationComposer composer,
      DeliveryDispatcher dispatcher,
      RecipientSet recipients,
      ClockPort clock,
      AttemptLogWriter attemptLog,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.statusEngine = Objects.requireNonNull(statusEngine, "statusEngine");
    if (expiringThreshold < 0) {
      throw new IllegalArgumentException("expiringThreshold must be >= 0");
    }
    this.expiringThreshold = expiringThreshold;
    this.filter = Objects.requireNonNull(filter, "filter");
    this.summaries = Objects.requireNonNull(summaries, "summaries");
    this.composer = Objects.requireNonNull(composer, "composer");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.recipients = Objects.requireNonNull(recipients, "recipients");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Executes one reminder run.
   *
   * @return run outcome
   * @throws IOException when the document source cannot be read
   */
  public ReminderOutcome run() throws IOException {
    try (RunContext context = RunContext.open()) {
      LocalDate today = clock.today();
      log.info("Reminder run started for {} using {}", today, source.describe());
      List<DocumentRecord> documents = source.load();
      if (documents.isEmpty()) {
        log.info("No documents found in {}; nothing to send", source.describe());
        return new ReminderOutcome(context.runId(), 0, List.of(), ReminderSummary.empty(), Optional.empty());
      }

      statusEngine.classify(documents, today, expiringThreshold);
      List<DocumentRecord> candidates = filter.apply(documents);
      ReminderSummary summary = summaries.build(candidates);
      for (int i = 0; i < candidates.size(); i++) {
        metrics.increment("reminder.candidates");
      }
      if (candidates.isEmpty()) {
        log.info("No documents require a reminder today ({} checked)", documents.size());
        return new ReminderOutcome(context.runId(), documents.size(), candidates, summary, Optional.empty());
      }
      log.info("{} document(s) require a reminder: {} expired, {} expiring",
          summary.total(), summary.expiredCount(), summary.expiringCount());

      ComposedNotification notification = composer.compose(candidates, today);
      DeliveryResult result = dispatcher.dispatch(
          OutgoingMessage.of(notification.subject(), notification.htmlBody(), recipients));
      writeAttemptLog(context.runId(), result);
      if (result.delivered()) {
        log.info("Reminder delivered via {} to {} recipient(s)",
            result.deliveredVia().orElse("?"), recipients.size());
      } else {
        log.error("Reminder could not be delivered; {} relay(s) tried", result.attempts().size());
      }
      return new ReminderOutcome(context.runId(), documents.size(), candidates, summary, Optional.of(result));
    }
  }

  private void writeAttemptLog(String runId, DeliveryResult result) {
    try {
      attemptLog.write(runId, result);
    } catch (IOException ex) {
      log.warn("Failed to write delivery attempt log: {}", ex.getMessage(), ex);
    }
  }
}
