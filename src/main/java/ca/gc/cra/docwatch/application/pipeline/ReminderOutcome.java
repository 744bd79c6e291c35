package ca.gc.cra.docwatch.application.pipeline;

import ca.gc.cra.docwatch.application.reminder.ReminderSummary;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one reminder run.
 *
 * @param runId MDC run identifier
 * @param documentCount documents read from the source
 * @param candidates documents that needed a reminder, in display order
 * @param summary aggregate counts over {@code candidates}
 * @param delivery dispatch result; empty when nothing was sent
 * @since 0.1.0
 */
public record ReminderOutcome(
    String runId,
    int documentCount,
    List<DocumentRecord> candidates,
    ReminderSummary summary,
    Optional<DeliveryResult> delivery) {

  public ReminderOutcome {
    Objects.requireNonNull(runId, "runId");
    candidates = List.copyOf(candidates);
    Objects.requireNonNull(summary, "summary");
    Objects.requireNonNull(delivery, "delivery");
  }

  /** Whether a notification was dispatched. */
  public boolean sent() {
    return delivery.isPresent();
  }

  /**
   * Whether the run completed its job: nothing to send, or a relay accepted the notification.
   *
   * @return {@code false} only when every relay failed
   */
  public boolean succeeded() {
    return delivery.map(DeliveryResult::delivered).orElse(true);
  }
}
