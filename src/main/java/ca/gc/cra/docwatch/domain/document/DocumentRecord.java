package ca.gc.cra.docwatch.domain.document;

import java.time.LocalDate;
import java.util.Objects;

/**
 * <strong>What:</strong> One roster entry: a person's document with its validity window and remarks.
 * <p><strong>Why:</strong> The status engine and reminder filter annotate entries in place so that
 * summaries, mail rows, and reports all read one consistent set of computed fields.</p>
 * <p><strong>Role:</strong> Domain entity created once per ingestion batch and discarded at process exit.</p>
 * <p><strong>Invariant:</strong> {@code status == UNKNOWN} iff {@code expiryDate == null}; in that case
 * {@code daysLeft == null} and {@code needsReminder == false}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; pipeline stages run sequentially over a batch.</p>
 *
 * @since 0.1.0
 */
public final class DocumentRecord {
  private final String personName;
  private final String documentType;
  private final LocalDate startDate;
  private final LocalDate expiryDate;
  private final String remarks;
  private final int sourceRow;

  private Integer daysLeft;
  private DocumentStatus status;
  private boolean needsReminder;

  /**
   * Creates a record as read from the roster.
   *
   * @param personName person identifier; must not be {@code null}
   * @param documentType document kind; must not be {@code null}
   * @param startDate optional start of validity
   * @param expiryDate optional end of validity
   * @param remarks free text; {@code null} is stored as empty
   * @param sourceRow 1-based row in the source file (header is row 1); {@code 0} when synthetic
   */
  public DocumentRecord(
      String personName,
      String documentType,
      LocalDate startDate,
      LocalDate expiryDate,
      String remarks,
      int sourceRow) {
    this.personName = Objects.requireNonNull(personName, "personName");
    this.documentType = Objects.requireNonNull(documentType, "documentType");
    this.startDate = startDate;
    this.expiryDate = expiryDate;
    this.remarks = remarks == null ? "" : remarks;
    this.sourceRow = sourceRow;
  }

  /**
   * Creates a synthetic record with no source row.
   *
   * @param personName person identifier
   * @param documentType document kind
   * @param startDate optional start of validity
   * @param expiryDate optional end of validity
   * @param remarks free text
   */
  public DocumentRecord(
      String personName, String documentType, LocalDate startDate, LocalDate expiryDate, String remarks) {
    this(personName, documentType, startDate, expiryDate, remarks, 0);
  }

  public String personName() {
    return personName;
  }

  public String documentType() {
    return documentType;
  }

  public LocalDate startDate() {
    return startDate;
  }

  public LocalDate expiryDate() {
    return expiryDate;
  }

  public String remarks() {
    return remarks;
  }

  public int sourceRow() {
    return sourceRow;
  }

  /**
   * Signed calendar days until expiry, or {@code null} when the expiry date is absent or the record
   * has not been classified yet.
   *
   * @return days left
   */
  public Integer daysLeft() {
    return daysLeft;
  }

  /**
   * Computed status, or {@code null} before classification.
   *
   * @return status
   */
  public DocumentStatus status() {
    return status;
  }

  public boolean needsReminder() {
    return needsReminder;
  }

  /**
   * Records the status engine's result.
   *
   * @param daysLeft signed days left; {@code null} only with {@link DocumentStatus#UNKNOWN}
   * @param status computed status; must not be {@code null}
   */
  public void classify(Integer daysLeft, DocumentStatus status) {
    Objects.requireNonNull(status, "status");
    if ((status == DocumentStatus.UNKNOWN) != (daysLeft == null)) {
      throw new IllegalArgumentException("daysLeft must be null exactly when status is UNKNOWN");
    }
    this.daysLeft = daysLeft;
    this.status = status;
    if (status == DocumentStatus.UNKNOWN) {
      this.needsReminder = false;
    }
  }

  /**
   * Records the reminder filter's decision. Unknown documents are always forced to {@code false}.
   *
   * @param needsReminder whether a reminder should be sent
   */
  public void markReminder(boolean needsReminder) {
    this.needsReminder = needsReminder && daysLeft != null;
  }

  @Override
  public String toString() {
    return "DocumentRecord{"
        + "person=" + personName
        + ", type=" + documentType
        + ", expiry=" + expiryDate
        + ", daysLeft=" + daysLeft
        + ", status=" + status
        + ", needsReminder=" + needsReminder
        + '}';
  }
}
