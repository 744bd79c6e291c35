package ca.gc.cra.docwatch.application.reminder;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.document.DocumentStatus;
import ca.gc.cra.docwatch.domain.time.DateResolver;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assigns {@code daysLeft} and a {@link DocumentStatus} to every document of a batch.
 * <p><strong>Why:</strong> Reminders, summaries, and reports all read the computed fields; computing them once
 * against a single "today" keeps a batch internally consistent.</p>
 * <p><strong>Role:</strong> Application service; first stage after ingestion.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected logger; safe to share.</p>
 * <p><strong>Observability:</strong> Logs the status distribution at INFO and each document at TRACE.</p>
 *
 * @since 0.1.0
 */
public final class StatusEngine {
  private final Logger log;

  /** Creates an engine logging through its class logger. */
  public StatusEngine() {
    this(LoggerFactory.getLogger(StatusEngine.class));
  }

  /**
   * Creates an engine logging through {@code log}.
   *
   * @param log run-scoped logger; must not be {@code null}
   */
  public StatusEngine(Logger log) {
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Classifies a single expiry date.
   *
   * @param expiryDate expiry date, may be {@code null}
   * @param today reference day
   * @param expiringThreshold inclusive upper bound of the expiring-soon window, {@code >= 0}
   * @return computed status
   */
  public static DocumentStatus statusFor(LocalDate expiryDate, LocalDate today, int expiringThreshold) {
    if (expiryDate == null) {
      return DocumentStatus.UNKNOWN;
    }
    return statusForDays(DateResolver.daysBetween(today, expiryDate), expiringThreshold);
  }

  static DocumentStatus statusForDays(int daysLeft, int expiringThreshold) {
    if (daysLeft < 0) {
      return DocumentStatus.EXPIRED;
    }
    if (daysLeft <= expiringThreshold) {
      return DocumentStatus.EXPIRING_SOON;
    }
    return DocumentStatus.VALID;
  }

  /**
   * Computes the status fields of every document in place.
   *
   * @param documents batch to classify; must not be {@code null}
   * @param today reference day, read once by the caller for the whole batch
   * @param expiringThreshold inclusive expiring-soon window in days
   * @return count of documents per status, in enum order
   * @throws IllegalArgumentException if {@code expiringThreshold} is negative
   */
  public Map<DocumentStatus, Integer> classify(
      List<DocumentRecord> documents, LocalDate today, int expiringThreshold) {
    Objects.requireNonNull(documents, "documents");
    Objects.requireNonNull(today, "today");
    if (expiringThreshold < 0) {
      throw new IllegalArgumentException("expiringThreshold must be >= 0");
    }
    Map<DocumentStatus, Integer> distribution = new EnumMap<>(DocumentStatus.class);
    for (DocumentStatus status : DocumentStatus.values()) {
      distribution.put(status, 0);
    }
    for (DocumentRecord document : documents) {
      LocalDate expiry = document.expiryDate();
      if (expiry == null) {
        document.classify(null, DocumentStatus.UNKNOWN);
      } else {
        int daysLeft = DateResolver.daysBetween(today, expiry);
        document.classify(daysLeft, statusForDays(daysLeft, expiringThreshold));
      }
      distribution.merge(document.status(), 1, Integer::sum);
      log.trace("Classified {}", document);
    }
    log.info(
        "Classified {} documents as of {}: expired={}, expiringSoon={}, valid={}, unknown={}",
        documents.size(),
        today,
        distribution.get(DocumentStatus.EXPIRED),
        distribution.get(DocumentStatus.EXPIRING_SOON),
        distribution.get(DocumentStatus.VALID),
        distribution.get(DocumentStatus.UNKNOWN));
    return distribution;
  }
}
