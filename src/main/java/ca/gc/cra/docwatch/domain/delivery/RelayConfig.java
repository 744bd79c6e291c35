package ca.gc.cra.docwatch.domain.delivery;

import java.util.Objects;

/**
 * <strong>What:</strong> One outbound mail-submission endpoint.
 * <p><strong>Why:</strong> The dispatcher walks an ordered list of these; ordinal {@code 0} is the primary
 * and higher ordinals are backups in configured order.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 * <p><strong>Security:</strong> {@link #toString()} never renders the password.</p>
 *
 * @param name operator-facing relay name (appears in attempt logs)
 * @param host SMTP host name
 * @param port SMTP port
 * @param username authenticated account; also used as the envelope and header sender
 * @param password secret for {@code username}
 * @param senderName configured display name (see DESIGN.md: not applied to the rewritten sender)
 * @param tlsMode transport security
 * @param ordinal preference position, {@code 0} for the primary
 * @since 0.1.0
 */
public record RelayConfig(
    String name,
    String host,
    int port,
    String username,
    String password,
    String senderName,
    TlsMode tlsMode,
    int ordinal) {

  public RelayConfig {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    senderName = senderName == null ? "" : senderName;
    Objects.requireNonNull(tlsMode, "tlsMode");
    if (ordinal < 0) {
      throw new IllegalArgumentException("ordinal must be >= 0");
    }
  }

  public boolean primary() {
    return ordinal == 0;
  }

  @Override
  public String toString() {
    return "RelayConfig{name=" + name
        + ", host=" + host
        + ", port=" + port
        + ", username=" + username
        + ", password=[REDACTED]"
        + ", tlsMode=" + tlsMode
        + ", ordinal=" + ordinal
        + '}';
  }
}
