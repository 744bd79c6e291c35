package ca.gc.cra.docwatch.application.port;

import ca.gc.cra.docwatch.domain.delivery.RelayConfig;

/**
 * Port opening {@link RelayConnection}s to configured relays.
 *
 * @since 0.1.0
 */
public interface MailTransport {
  /**
   * Prepares a connection to {@code relay} honouring its TLS mode and the transport timeouts.
   *
   * @param relay relay to open
   * @return unauthenticated connection; caller must close it
   * @throws DeliveryException when the session cannot be prepared
   */
  RelayConnection connect(RelayConfig relay) throws DeliveryException;
}
