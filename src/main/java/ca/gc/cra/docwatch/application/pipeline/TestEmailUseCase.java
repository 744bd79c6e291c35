package ca.gc.cra.docwatch.application.pipeline;

import ca.gc.cra.docwatch.application.delivery.DeliveryDispatcher;
import ca.gc.cra.docwatch.application.notify.ComposedNotification;
import ca.gc.cra.docwatch.application.notify.NotificationComposer;
import ca.gc.cra.docwatch.application.port.AttemptLogWriter;
import ca.gc.cra.docwatch.application.port.ClockPort;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import ca.gc.cra.docwatch.domain.delivery.OutgoingMessage;
import ca.gc.cra.docwatch.domain.delivery.RecipientSet;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a fixed test message through the configured relay chain to verify mail settings.
 *
 * @since 0.1.0
 */
public final class TestEmailUseCase {
  private static final Logger log = LoggerFactory.getLogger(TestEmailUseCase.class);

  /** Subject of the configuration check message. */
  public static final String SUBJECT = "证件管理系统 - 测试邮件";

  private final DeliveryDispatcher dispatcher;
  private final RecipientSet recipients;
  private final String bodyTemplate;
  private final ClockPort clock;
  private final AttemptLogWriter attemptLog;

  public TestEmailUseCase(
      DeliveryDispatcher dispatcher,
      RecipientSet recipients,
      String bodyTemplate,
      ClockPort clock,
      AttemptLogWriter attemptLog) {
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    this.recipients = Objects.requireNonNull(recipients, "recipients");
    this.bodyTemplate = Objects.requireNonNull(bodyTemplate, "bodyTemplate");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.attemptLog = Objects.requireNonNull(attemptLog, "attemptLog");
  }

  /**
   * Composes and dispatches the test message.
   *
   * @return dispatch result
   */
  public DeliveryResult run() {
    try (RunContext context = RunContext.open()) {
      ComposedNotification notification =
          NotificationComposer.composeTest(SUBJECT, bodyTemplate, clock.now().toLocalDateTime());
      log.info("Sending test email to {} recipient(s) via {} relay(s)",
          recipients.size(), dispatcher.relays().size());
      DeliveryResult result = dispatcher.dispatch(
          OutgoingMessage.of(notification.subject(), notification.htmlBody(), recipients));
      try {
        attemptLog.write(context.runId(), result);
      } catch (IOException ex) {
        log.warn("Failed to write delivery attempt log: {}", ex.getMessage(), ex);
      }
      return result;
    }
  }
}
