package ca.gc.cra.docwatch.infrastructure.mail;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.application.port.DeliveryException;
import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import java.io.EOFException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import javax.net.ssl.SSLHandshakeException;
import org.junit.jupiter.api.Test;

class MailFailureClassifierTest {
  @Test
  void authenticationRejected() {
    assertEquals(FailureClassification.AUTH_FAILURE,
        MailFailureClassifier.classify(new AuthenticationFailedException("535 Login Fail")));
  }

  @Test
  void recipientRejectionNeedsInvalidAddresses() throws AddressException {
    SendFailedException rejected = new SendFailedException(
        "550 Invalid", null, new Address[0], new Address[0], new Address[] {new InternetAddress("x@y.com")});
    SendFailedException bare = new SendFailedException("554 spam");

    assertEquals(FailureClassification.RECIPIENT_REJECTED, MailFailureClassifier.classify(rejected));
    assertEquals(FailureClassification.PROTOCOL_ERROR, MailFailureClassifier.classify(bare));
    assertEquals(FailureClassification.RECIPIENT_REJECTED,
        MailFailureClassifier.classify(new AddressException("Illegal address")));
  }

  @Test
  void causeChainDecidesNetworkFailures() {
    assertEquals(FailureClassification.CONNECT_FAILURE, MailFailureClassifier.classify(
        new MessagingException("Couldn't connect to host", new UnknownHostException("smtp.nowhere"))));
    assertEquals(FailureClassification.CONNECT_FAILURE, MailFailureClassifier.classify(
        new MessagingException("Couldn't connect", new ConnectException("Connection refused"))));
    assertEquals(FailureClassification.CONNECT_FAILURE, MailFailureClassifier.classify(
        new MessagingException("x", new SocketTimeoutException("Connect timed out"))));
    assertEquals(FailureClassification.CONNECTION_DROPPED, MailFailureClassifier.classify(
        new MessagingException("x", new SocketTimeoutException("Read timed out"))));
    assertEquals(FailureClassification.CONNECTION_DROPPED, MailFailureClassifier.classify(
        new MessagingException("x", new EOFException())));
    assertEquals(FailureClassification.CONNECTION_DROPPED, MailFailureClassifier.classify(
        new MessagingException("x", new SocketException("Connection reset"))));
    assertEquals(FailureClassification.NETWORK_ERROR, MailFailureClassifier.classify(
        new MessagingException("x", new SSLHandshakeException("PKIX path building failed"))));
  }

  @Test
  void messageTextFallback() {
    assertEquals(FailureClassification.CONNECTION_DROPPED,
        MailFailureClassifier.classify(new MessagingException("[EOF]")));
    assertEquals(FailureClassification.PROTOCOL_ERROR,
        MailFailureClassifier.classify(new MessagingException("421 too many connections")));
    assertEquals(FailureClassification.UNKNOWN,
        MailFailureClassifier.classify(new IllegalArgumentException("?")));
  }

  @Test
  void wrapsWithStageAndRelay() {
    AuthenticationFailedException cause = new AuthenticationFailedException("535 denied");

    DeliveryException ex = MailFailureClassifier.toDeliveryException("authenticate", "primary", cause);

    assertEquals(FailureClassification.AUTH_FAILURE, ex.classification());
    assertEquals("authenticate via relay primary failed: 535 denied", ex.getMessage());
    assertSame(cause, ex.getCause());
  }

  @Test
  void missingMessageFallsBackToType() {
    DeliveryException ex = MailFailureClassifier.toDeliveryException("send", "b", new MessagingException());

    assertTrue(ex.getMessage().endsWith("failed: MessagingException"));
  }
}
