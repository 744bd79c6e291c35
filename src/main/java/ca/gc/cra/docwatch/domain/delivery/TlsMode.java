package ca.gc.cra.docwatch.domain.delivery;

import java.util.Locale;

/**
 * Transport security used when opening a relay connection.
 *
 * @since 0.1.0
 */
public enum TlsMode {
  /** Implicit TLS from the first byte (typically port 465). */
  SSL,
  /** Plaintext connection upgraded with STARTTLS (typically port 587). */
  STARTTLS,
  /** No transport security. */
  PLAIN;

  /**
   * Parses a configured mode, case-insensitively.
   *
   * @param raw configured text ({@code ssl}, {@code starttls}, {@code plain}, {@code tls} alias)
   * @return parsed mode
   * @throws IllegalArgumentException when the value is blank or unsupported
   */
  public static TlsMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("tls_mode must be one of ssl, starttls, plain");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "ssl" -> SSL;
      case "starttls", "tls" -> STARTTLS;
      case "plain", "none" -> PLAIN;
      default -> throw new IllegalArgumentException(
          "tls_mode must be one of ssl, starttls, plain (was '" + raw + "')");
    };
  }

  /**
   * Maps the legacy boolean pair to a mode: SSL wins, then STARTTLS, else plaintext.
   *
   * @param useSsl legacy {@code use_ssl}
   * @param useTls legacy {@code use_tls}
   * @return equivalent mode
   */
  public static TlsMode fromLegacyFlags(boolean useSsl, boolean useTls) {
    if (useSsl) {
      return SSL;
    }
    return useTls ? STARTTLS : PLAIN;
  }
}
