package ca.gc.cra.docwatch.infrastructure.mail;

import ca.gc.cra.docwatch.application.port.DeliveryException;
import ca.gc.cra.docwatch.application.port.MailTransport;
import ca.gc.cra.docwatch.application.port.RelayConnection;
import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import ca.gc.cra.docwatch.domain.delivery.TlsMode;
import jakarta.mail.Authenticator;
import jakarta.mail.NoSuchProviderException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MailTransport} backed by Jakarta Mail (Eclipse Angus provider).
 * <p><strong>TLS:</strong> {@code SSL} uses the {@code smtps} transport (implicit TLS); {@code STARTTLS} uses
 * {@code smtp} with STARTTLS required; {@code PLAIN} uses {@code smtp} without TLS.</p>
 * <p><strong>Timeouts:</strong> connect, read, and write timeouts all default to 30 seconds.</p>
 * <p><strong>Thread-safety:</strong> Stateless; each call builds its own {@link Session}.</p>
 *
 * @since 0.1.0
 */
public final class JakartaMailTransport implements MailTransport {
  private static final Logger log = LoggerFactory.getLogger(JakartaMailTransport.class);

  /** Default connect/read/write timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  private final Duration timeout;

  public JakartaMailTransport() {
    this(DEFAULT_TIMEOUT);
  }

  /**
   * Creates a transport with an explicit socket timeout.
   *
   * @param timeout connect, read, and write timeout; must be positive
   */
  public JakartaMailTransport(Duration timeout) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  @Override
  public RelayConnection connect(RelayConfig relay) throws DeliveryException {
    String protocol = protocolFor(relay.tlsMode());
    Session session = Session.getInstance(sessionProperties(relay, timeout), new RelayAuthenticator(relay));
    try {
      Transport transport = session.getTransport(protocol);
      log.debug("Prepared {} transport for relay {} ({}:{})", protocol, relay.name(), relay.host(), relay.port());
      return new JakartaRelayConnection(relay, session, transport);
    } catch (NoSuchProviderException ex) {
      throw MailFailureClassifier.toDeliveryException("connect", relay.name(), ex);
    }
  }

  static String protocolFor(TlsMode mode) {
    return mode == TlsMode.SSL ? "smtps" : "smtp";
  }

  static Properties sessionProperties(RelayConfig relay, Duration timeout) {
    String protocol = protocolFor(relay.tlsMode());
    String prefix = "mail." + protocol + ".";
    String millis = Long.toString(timeout.toMillis());
    Properties props = new Properties();
    props.setProperty("mail.transport.protocol", protocol);
    props.setProperty(prefix + "host", relay.host());
    props.setProperty(prefix + "port", Integer.toString(relay.port()));
    props.setProperty(prefix + "auth", "true");
    props.setProperty(prefix + "from", relay.username());
    props.setProperty(prefix + "connectiontimeout", millis);
    props.setProperty(prefix + "timeout", millis);
    props.setProperty(prefix + "writetimeout", millis);
    switch (relay.tlsMode()) {
      case SSL -> {
        props.setProperty(prefix + "ssl.enable", "true");
        props.setProperty(prefix + "ssl.checkserveridentity", "true");
      }
      case STARTTLS -> {
        props.setProperty(prefix + "starttls.enable", "true");
        props.setProperty(prefix + "starttls.required", "true");
        props.setProperty(prefix + "ssl.checkserveridentity", "true");
      }
      case PLAIN -> props.setProperty(prefix + "starttls.enable", "false");
    }
    return props;
  }

  private static final class RelayAuthenticator extends Authenticator {
    private final PasswordAuthentication credentials;

    RelayAuthenticator(RelayConfig relay) {
      this.credentials = new PasswordAuthentication(relay.username(), relay.password());
    }

    @Override
    protected PasswordAuthentication getPasswordAuthentication() {
      return credentials;
    }
  }
}
