package ca.gc.cra.docwatch.infrastructure.mail;

import ca.gc.cra.docwatch.application.port.DeliveryException;
import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.internet.AddressException;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import javax.net.ssl.SSLException;

/**
 * Maps Jakarta Mail and socket exceptions onto {@link FailureClassification}.
 *
 * <p>The outermost mail exception type wins (authentication, recipient refusal); otherwise the cause chain
 * decides between connect, dropped-connection, and network failures.</p>
 *
 * @since 0.1.0
 */
public final class MailFailureClassifier {
  private static final int MAX_CAUSE_DEPTH = 8;

  private MailFailureClassifier() {}

  /**
   * Classifies a failure raised while talking to a relay.
   *
   * @param failure exception thrown by Jakarta Mail or the socket layer
   * @return classification; {@link FailureClassification#UNKNOWN} when nothing matches
   */
  public static FailureClassification classify(Throwable failure) {
    if (failure instanceof AuthenticationFailedException) {
      return FailureClassification.AUTH_FAILURE;
    }
    if (failure instanceof SendFailedException sendFailed) {
      Address[] invalid = sendFailed.getInvalidAddresses();
      return invalid != null && invalid.length > 0
          ? FailureClassification.RECIPIENT_REJECTED
          : FailureClassification.PROTOCOL_ERROR;
    }
    if (failure instanceof AddressException) {
      return FailureClassification.RECIPIENT_REJECTED;
    }
    FailureClassification fromCause = fromCauseChain(failure);
    if (fromCause != null) {
      return fromCause;
    }
    if (failure instanceof MessagingException messaging) {
      return looksDropped(messaging.getMessage())
          ? FailureClassification.CONNECTION_DROPPED
          : FailureClassification.PROTOCOL_ERROR;
    }
    return FailureClassification.UNKNOWN;
  }

  /**
   * Wraps {@code failure} into a classified {@link DeliveryException}.
   *
   * @param stage what was being attempted ({@code connect}, {@code send}, ...)
   * @param relayName relay name for the message
   * @param failure underlying exception
   * @return classified exception
   */
  public static DeliveryException toDeliveryException(String stage, String relayName, Throwable failure) {
    String detail = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    return new DeliveryException(
        classify(failure), stage + " via relay " + relayName + " failed: " + detail, failure);
  }

  private static FailureClassification fromCauseChain(Throwable failure) {
    Throwable current = failure;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof UnknownHostException
          || current instanceof ConnectException
          || current instanceof NoRouteToHostException) {
        return FailureClassification.CONNECT_FAILURE;
      }
      if (current instanceof SocketTimeoutException) {
        String message = current.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("connect")
            ? FailureClassification.CONNECT_FAILURE
            : FailureClassification.CONNECTION_DROPPED;
      }
      if (current instanceof EOFException) {
        return FailureClassification.CONNECTION_DROPPED;
      }
      if (current instanceof SocketException && looksDropped(current.getMessage())) {
        return FailureClassification.CONNECTION_DROPPED;
      }
      if (current instanceof SSLException || current instanceof IOException) {
        return FailureClassification.NETWORK_ERROR;
      }
      Throwable next = current.getCause();
      if (next == current) {
        break;
      }
      current = next;
    }
    return null;
  }

  private static boolean looksDropped(String message) {
    if (message == null) {
      return false;
    }
    String lower = message.toLowerCase(Locale.ROOT);
    return lower.contains("[eof]")
        || lower.contains("connection reset")
        || lower.contains("broken pipe")
        || lower.contains("connection closed")
        || lower.contains("not connected");
  }
}
