package ca.gc.cra.docwatch.infrastructure.mail;

import ca.gc.cra.docwatch.application.port.DeliveryException;
import ca.gc.cra.docwatch.application.port.RelayConnection;
import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import ca.gc.cra.docwatch.domain.delivery.OutgoingMessage;
import ca.gc.cra.docwatch.domain.delivery.RecipientSet;
import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One Jakarta Mail {@link Transport} bound to a relay.
 *
 * <p>{@link #authenticate()} also opens the socket, so DNS, refused and timeout failures surface there as
 * {@code CONNECT_FAILURE}.</p>
 *
 * @since 0.1.0
 */
final class JakartaRelayConnection implements RelayConnection {
  private static final Logger log = LoggerFactory.getLogger(JakartaRelayConnection.class);

  private final RelayConfig relay;
  private final Session session;
  private final Transport transport;

  JakartaRelayConnection(RelayConfig relay, Session session, Transport transport) {
    this.relay = relay;
    this.session = session;
    this.transport = transport;
  }

  @Override
  public void authenticate() throws DeliveryException {
    try {
      transport.connect(relay.host(), relay.port(), relay.username(), relay.password());
      log.debug("Authenticated to relay {} as {}", relay.name(), relay.username());
    } catch (MessagingException ex) {
      throw MailFailureClassifier.toDeliveryException("authenticate", relay.name(), ex);
    } catch (IllegalStateException ex) {
      throw new DeliveryException(FailureClassification.PROTOCOL_ERROR,
          "authenticate via relay " + relay.name() + " failed: " + ex.getMessage(), ex);
    }
  }

  @Override
  public void send(OutgoingMessage message, RecipientSet recipients) throws DeliveryException {
    if (!transport.isConnected()) {
      throw new DeliveryException(FailureClassification.CONNECTION_DROPPED,
          "relay " + relay.name() + " is not connected");
    }
    try {
      Address[] to = addresses(recipients.addresses());
      MimeMessage mime = new MimeMessage(session);
      mime.setFrom(sender(message.senderAddress()));
      mime.setRecipients(Message.RecipientType.TO, to);
      mime.setSubject(message.subject(), StandardCharsets.UTF_8.name());
      mime.setText(message.htmlBody(), StandardCharsets.UTF_8.name(), "html");
      mime.setSentDate(new Date());
      mime.saveChanges();
      transport.sendMessage(mime, to);
      log.debug("Relay {} accepted message for {} recipient(s)", relay.name(), to.length);
    } catch (MessagingException ex) {
      throw MailFailureClassifier.toDeliveryException("send", relay.name(), ex);
    }
  }

  @Override
  public void close() {
    if (!transport.isConnected()) {
      return;
    }
    try {
      transport.close();
    } catch (MessagingException ex) {
      log.warn("Error closing connection to relay {}: {}", relay.name(), ex.getMessage());
    }
  }

  // smtp_user is sent as-is; relay logins need not be full mailboxes.
  private InternetAddress sender(String address) throws DeliveryException {
    try {
      return new InternetAddress(address);
    } catch (AddressException ex) {
      throw new DeliveryException(FailureClassification.PROTOCOL_ERROR,
          "send via relay " + relay.name() + " failed: smtp_user '" + address
              + "' cannot be used as the From address (" + ex.getMessage() + ")", ex);
    }
  }

  private static Address[] addresses(List<String> recipients) throws MessagingException {
    Address[] parsed = new Address[recipients.size()];
    for (int i = 0; i < recipients.size(); i++) {
      parsed[i] = new InternetAddress(recipients.get(i), true);
    }
    return parsed;
  }
}
