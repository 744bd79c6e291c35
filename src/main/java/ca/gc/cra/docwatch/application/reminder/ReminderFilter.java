package ca.gc.cra.docwatch.application.reminder;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.document.DocumentStatus;
import ca.gc.cra.docwatch.domain.document.ReminderThresholds;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decides which classified documents need a reminder and orders them for the mail.
 * <p><strong>Rules, first match wins:</strong>
 * <ol>
 *   <li>trimmed remarks equal the handled sentinel: no reminder;</li>
 *   <li>unknown status: no reminder;</li>
 *   <li>expired: reminder;</li>
 *   <li>no thresholds configured: no reminder;</li>
 *   <li>otherwise remind when {@code daysLeft <= max(thresholds)}.</li>
 * </ol>
 * <p><strong>Ordering:</strong> ascending {@code daysLeft}; a missing value sorts as {@link Integer#MIN_VALUE},
 * so such documents would lead the list. Unknown documents never qualify today, so the rule only matters
 * if that changes.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class ReminderFilter {
  /** Remark marking a document as already handled. */
  public static final String DEFAULT_HANDLED_REMARK = "已办理";

  static final Comparator<DocumentRecord> BY_DAYS_LEFT =
      Comparator.comparingInt(ReminderFilter::sortKey);

  private final ReminderThresholds thresholds;
  private final String handledRemark;
  private final Logger log;

  /**
   * Creates a filter with the default sentinel and class logger.
   *
   * @param thresholds reminder thresholds; must not be {@code null}
   */
  public ReminderFilter(ReminderThresholds thresholds) {
    this(thresholds, DEFAULT_HANDLED_REMARK, LoggerFactory.getLogger(ReminderFilter.class));
  }

  /**
   * Creates a filter.
   *
   * @param thresholds reminder thresholds; must not be {@code null}
   * @param handledRemark sentinel remark; blank falls back to {@link #DEFAULT_HANDLED_REMARK}
   * @param log run-scoped logger; must not be {@code null}
   */
  public ReminderFilter(ReminderThresholds thresholds, String handledRemark, Logger log) {
    this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    this.handledRemark =
        handledRemark == null || handledRemark.isBlank() ? DEFAULT_HANDLED_REMARK : handledRemark.trim();
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Evaluates the reminder rule for one classified document without mutating it.
   *
   * @param document classified document
   * @return whether a reminder is due
   * @throws IllegalStateException if the document has not been classified
   */
  public boolean isDue(DocumentRecord document) {
    DocumentStatus status = document.status();
    if (status == null) {
      throw new IllegalStateException("document must be classified before filtering: " + document);
    }
    if (handledRemark.equals(document.remarks().trim())) {
      return false;
    }
    if (status == DocumentStatus.UNKNOWN || document.daysLeft() == null) {
      return false;
    }
    if (status == DocumentStatus.EXPIRED) {
      return true;
    }
    OptionalInt max = thresholds.max();
    if (max.isEmpty()) {
      return false;
    }
    return document.daysLeft() <= max.getAsInt();
  }

  /**
   * Marks every document and returns the reminder candidates.
   *
   * @param documents classified batch; updated in place
   * @return candidates sorted by ascending {@code daysLeft}
   */
  public List<DocumentRecord> apply(List<DocumentRecord> documents) {
    Objects.requireNonNull(documents, "documents");
    List<DocumentRecord> candidates = new ArrayList<>();
    int handled = 0;
    for (DocumentRecord document : documents) {
      boolean due = isDue(document);
      document.markReminder(due);
      if (due) {
        candidates.add(document);
      } else if (handledRemark.equals(document.remarks().trim())) {
        handled++;
      }
    }
    candidates.sort(BY_DAYS_LEFT);
    log.info(
        "{} of {} documents need a reminder ({} marked '{}'), thresholds={}",
        candidates.size(),
        documents.size(),
        handled,
        handledRemark,
        thresholds.days());
    return candidates;
  }

  public String handledRemark() {
    return handledRemark;
  }

  private static int sortKey(DocumentRecord document) {
    Integer daysLeft = document.daysLeft();
    return daysLeft == null ? Integer.MIN_VALUE : daysLeft;
  }
}
