package ca.gc.cra.docwatch.domain.delivery;

import java.util.Objects;

/**
 * Immutable HTML message handed to a relay connection.
 *
 * <p>The dispatcher derives one copy per relay via {@link #fromSender(String)} so that the header
 * sender always matches the account that authenticated.</p>
 *
 * @param subject subject line
 * @param htmlBody HTML body
 * @param senderAddress header and envelope sender; empty until bound to a relay
 * @param recipients recipients, submitted together
 * @since 0.1.0
 */
public record OutgoingMessage(
    String subject, String htmlBody, String senderAddress, RecipientSet recipients) {

  public OutgoingMessage {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(htmlBody, "htmlBody");
    senderAddress = senderAddress == null ? "" : senderAddress;
    Objects.requireNonNull(recipients, "recipients");
  }

  /**
   * Creates an unbound message.
   *
   * @param subject subject line
   * @param htmlBody HTML body
   * @param recipients recipients
   * @return message with no sender yet
   */
  public static OutgoingMessage of(String subject, String htmlBody, RecipientSet recipients) {
    return new OutgoingMessage(subject, htmlBody, "", recipients);
  }

  /**
   * Returns a copy whose sender is the given bare address.
   *
   * @param address relay username
   * @return per-relay copy
   */
  public OutgoingMessage fromSender(String address) {
    return new OutgoingMessage(subject, htmlBody, Objects.requireNonNull(address, "address"), recipients);
  }
}
