package ca.gc.cra.docwatch.application.port;

import ca.gc.cra.docwatch.domain.delivery.OutgoingMessage;
import ca.gc.cra.docwatch.domain.delivery.RecipientSet;

/**
 * <strong>What:</strong> Open session with one relay.
 * <p><strong>Lifecycle:</strong> {@link #authenticate()} once, {@link #send(OutgoingMessage, RecipientSet)} at
 * most once, then {@link #close()}. The dispatcher closes the connection on every exit path.</p>
 *
 * @since 0.1.0
 */
public interface RelayConnection extends AutoCloseable {
  /**
   * Connects to the relay and logs in with the relay's credentials.
   *
   * @throws DeliveryException when connect or login fails
   */
  void authenticate() throws DeliveryException;

  /**
   * Submits {@code message} to every recipient as a single transaction.
   *
   * @param message per-relay copy with its sender already bound
   * @param recipients full recipient list
   * @throws DeliveryException when the relay refuses the submission
   */
  void send(OutgoingMessage message, RecipientSet recipients) throws DeliveryException;

  /**
   * Releases the session. Close failures are logged, never thrown.
   */
  @Override
  void close();
}
