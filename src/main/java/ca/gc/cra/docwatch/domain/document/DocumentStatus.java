package ca.gc.cra.docwatch.domain.document;

/**
 * Expiry classification assigned to a {@link DocumentRecord} by the status engine.
 *
 * <p>Each constant carries the label written to reports and the priority used to order report rows
 * (lower sorts first).</p>
 *
 * @since 0.1.0
 */
public enum DocumentStatus {
  /** Expiry date lies in the past. */
  EXPIRED("已过期", 0),
  /** Expiry date is today or within the expiring-soon threshold. */
  EXPIRING_SOON("即将过期", 1),
  /** Expiry date lies beyond the expiring-soon threshold. */
  VALID("有效", 2),
  /** No expiry date recorded. */
  UNKNOWN("未知", 2);

  private final String label;
  private final int reportPriority;

  DocumentStatus(String label, int reportPriority) {
    this.label = label;
    this.reportPriority = reportPriority;
  }

  /**
   * Returns the human-readable label used in reports.
   *
   * @return display label
   */
  public String label() {
    return label;
  }

  /**
   * Returns the report ordering priority; {@code EXPIRED < EXPIRING_SOON < everything else}.
   *
   * @return priority bucket
   */
  public int reportPriority() {
    return reportPriority;
  }
}
