package ca.gc.cra.docwatch.application.port;

import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import java.util.Objects;

/**
 * Checked failure raised by a {@link RelayConnection} or {@link MailTransport}.
 *
 * <p>The dispatcher recovers from every instance by moving to the next relay.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryException extends Exception {
  private static final long serialVersionUID = 1L;

  private final FailureClassification classification;

  /**
   * Creates a classified delivery failure.
   *
   * @param classification failure class; must not be {@code null}
   * @param message human-readable detail
   * @param cause underlying transport exception, may be {@code null}
   */
  public DeliveryException(FailureClassification classification, String message, Throwable cause) {
    super(message, cause);
    this.classification = Objects.requireNonNull(classification, "classification");
  }

  /**
   * Creates a classified delivery failure without a cause.
   *
   * @param classification failure class
   * @param message human-readable detail
   */
  public DeliveryException(FailureClassification classification, String message) {
    this(classification, message, null);
  }

  public FailureClassification classification() {
    return classification;
  }
}
