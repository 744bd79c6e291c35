package ca.gc.cra.docwatch.domain.delivery;

import java.util.Locale;

/**
 * Mail providers with known remediation advice, recognised from the relay host name.
 *
 * @since 0.1.0
 */
public enum MailProvider {
  QQ("qq.com"),
  NETEASE("163.com", "126.com", "yeah.net"),
  GMAIL("gmail.com", "googlemail.com"),
  OUTLOOK("outlook.com", "office365.com", "hotmail.com", "live.com"),
  GENERIC();

  private final String[] domains;

  MailProvider(String... domains) {
    this.domains = domains;
  }

  /**
   * Resolves the provider serving {@code host}.
   *
   * @param host relay host name, e.g. {@code smtp.qq.com}
   * @return matching provider, or {@link #GENERIC}
   */
  public static MailProvider fromHost(String host) {
    if (host == null || host.isBlank()) {
      return GENERIC;
    }
    String normalized = host.trim().toLowerCase(Locale.ROOT);
    for (MailProvider provider : values()) {
      for (String domain : provider.domains) {
        if (normalized.equals(domain) || normalized.endsWith("." + domain)) {
          return provider;
        }
      }
    }
    return GENERIC;
  }
}
