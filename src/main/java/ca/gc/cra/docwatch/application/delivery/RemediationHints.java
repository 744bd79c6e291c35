package ca.gc.cra.docwatch.application.delivery;

import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import ca.gc.cra.docwatch.domain.delivery.MailProvider;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static remediation advice for failed relay attempts.
 *
 * <p>A hint combines advice for the failure class with advice for the provider that serves the relay host.
 * New providers are added to {@link MailProvider} and to {@link #PROVIDER_ADVICE}.</p>
 *
 * @since 0.1.0
 */
public final class RemediationHints {
  private static final Map<FailureClassification, String> CLASSIFICATION_ADVICE =
      new EnumMap<>(FailureClassification.class);
  private static final Map<MailProvider, String> PROVIDER_ADVICE = new EnumMap<>(MailProvider.class);

  static {
    CLASSIFICATION_ADVICE.put(FailureClassification.AUTH_FAILURE,
        "The relay rejected the login; verify smtp_user and smtp_password.");
    CLASSIFICATION_ADVICE.put(FailureClassification.RECIPIENT_REJECTED,
        "The relay refused at least one recipient; check receiver_email for typos or blocked domains.");
    CLASSIFICATION_ADVICE.put(FailureClassification.CONNECTION_DROPPED,
        "The relay closed the connection; check the port and tls_mode pairing (465=ssl, 587=starttls).");
    CLASSIFICATION_ADVICE.put(FailureClassification.CONNECT_FAILURE,
        "Could not reach the relay; check smtp_server, smtp_port, DNS and outbound firewall rules.");
    CLASSIFICATION_ADVICE.put(FailureClassification.PROTOCOL_ERROR,
        "The relay answered with an unexpected SMTP reply or could not use the sender; check that smtp_user "
            + "is a From address the relay accepts, then the relay logs and sender limits.");
    CLASSIFICATION_ADVICE.put(FailureClassification.NETWORK_ERROR,
        "A network or TLS error interrupted the session; check certificates, proxies and tls_mode.");
    CLASSIFICATION_ADVICE.put(FailureClassification.UNKNOWN,
        "Unexpected failure; see the attempt detail and application log.");

    PROVIDER_ADVICE.put(MailProvider.QQ,
        "QQ Mail: enable the SMTP service in mailbox settings and use the generated authorization code, "
            + "not the account password.");
    PROVIDER_ADVICE.put(MailProvider.NETEASE,
        "NetEase (163/126/yeah.net): enable SMTP in mailbox settings and use the client authorization "
            + "password.");
    PROVIDER_ADVICE.put(MailProvider.GMAIL,
        "Gmail: turn on 2-Step Verification and log in with a 16-character App Password.");
    PROVIDER_ADVICE.put(MailProvider.OUTLOOK,
        "Outlook/Office 365: SMTP AUTH must be enabled for the mailbox; use smtp.office365.com:587 with "
            + "starttls.");
    PROVIDER_ADVICE.put(MailProvider.GENERIC,
        "Confirm the relay allows authenticated submission from this host.");
  }

  private RemediationHints() {
    // Utility
  }

  /**
   * Builds the hint for a failed attempt.
   *
   * @param host relay host name
   * @param classification failure class
   * @return operator hint; never blank
   */
  public static String lookup(String host, FailureClassification classification) {
    String general = CLASSIFICATION_ADVICE.get(classification);
    String provider = PROVIDER_ADVICE.get(MailProvider.fromHost(host));
    return general + " " + provider;
  }

  /**
   * Provider part of the hint.
   *
   * @param provider mail provider
   * @return provider advice
   */
  public static String forProvider(MailProvider provider) {
    return PROVIDER_ADVICE.get(provider);
  }
}
