package ca.gc.cra.docwatch.infrastructure.mail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.application.port.DeliveryException;
import ca.gc.cra.docwatch.application.port.RelayConnection;
import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import ca.gc.cra.docwatch.domain.delivery.OutgoingMessage;
import ca.gc.cra.docwatch.domain.delivery.RecipientSet;
import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import ca.gc.cra.docwatch.domain.delivery.TlsMode;
import jakarta.mail.Address;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.URLName;
import jakarta.mail.internet.InternetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class JakartaRelayConnectionTest {
  private static final OutgoingMessage MESSAGE = OutgoingMessage.of(
      "subject", "<p>body</p>", RecipientSet.parse("ops@example.com")).fromSender("sender@example.com");

  @Test
  void sendBeforeAuthenticateIsDroppedConnection() throws Exception {
    RelayConnection connection = new JakartaMailTransport(Duration.ofSeconds(2)).connect(relay(25));

    DeliveryException ex = assertThrows(DeliveryException.class,
        () -> connection.send(MESSAGE, MESSAGE.recipients()));

    assertEquals(FailureClassification.CONNECTION_DROPPED, ex.classification());
    connection.close();
  }

  @Test
  void refusedPortIsConnectFailure() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }
    RelayConnection connection = new JakartaMailTransport(Duration.ofSeconds(2)).connect(relay(port));

    DeliveryException ex = assertThrows(DeliveryException.class, connection::authenticate);

    assertEquals(FailureClassification.CONNECT_FAILURE, ex.classification());
    connection.close();
  }

  @Test
  void loginWithoutDomainIsSentAsFromAddress() throws Exception {
    Session session = Session.getInstance(new Properties());
    RecordingTransport transport = new RecordingTransport(session);
    RelayConfig corporate = new RelayConfig(
        "corp", "mail.corp.example", 25, "svc-docwatch", "pw", "", TlsMode.PLAIN, 0);
    RelayConnection connection = new JakartaRelayConnection(corporate, session, transport);

    connection.send(MESSAGE.fromSender("svc-docwatch"), MESSAGE.recipients());

    InternetAddress from = (InternetAddress) transport.sent.getFrom()[0];
    assertEquals("svc-docwatch", from.getAddress());
    assertEquals("ops@example.com", ((InternetAddress) transport.recipients[0]).getAddress());
  }

  @Test
  void unparsableSenderIsProtocolErrorNotRecipientRejection() {
    Session session = Session.getInstance(new Properties());
    RecordingTransport transport = new RecordingTransport(session);
    RelayConfig corporate = new RelayConfig(
        "corp", "mail.corp.example", 25, "svc<docwatch", "pw", "", TlsMode.PLAIN, 0);
    RelayConnection connection = new JakartaRelayConnection(corporate, session, transport);

    DeliveryException ex = assertThrows(DeliveryException.class,
        () -> connection.send(MESSAGE.fromSender("svc<docwatch"), MESSAGE.recipients()));

    assertEquals(FailureClassification.PROTOCOL_ERROR, ex.classification());
    assertTrue(ex.getMessage().contains("smtp_user"), ex.getMessage());
    assertNull(transport.sent);
  }

  private static final class RecordingTransport extends Transport {
    private Message sent;
    private Address[] recipients;

    RecordingTransport(Session session) {
      super(session, new URLName("smtp", "127.0.0.1", 25, null, null, null));
    }

    @Override
    public boolean isConnected() {
      return true;
    }

    @Override
    public void sendMessage(Message message, Address[] addresses) {
      sent = message;
      recipients = addresses;
    }

    @Override
    public void close() {
      // nothing to release
    }
  }

  private static RelayConfig relay(int port) {
    return new RelayConfig("local", "127.0.0.1", port, "sender@example.com", "pw", "", TlsMode.PLAIN, 0);
  }
}
