package ca.gc.cra.docwatch.domain.delivery;

/**
 * Classification of a failed relay attempt.
 *
 * <p>Every class is recovered the same way (fail over to the next relay); the class only selects the
 * remediation hint and the failure counter.</p>
 *
 * @since 0.1.0
 */
public enum FailureClassification {
  /** Relay rejected the credentials. */
  AUTH_FAILURE,
  /** Relay refused one or more recipients. */
  RECIPIENT_REJECTED,
  /** Relay closed an established connection. */
  CONNECTION_DROPPED,
  /** Connection could not be established (DNS, refused, timeout). */
  CONNECT_FAILURE,
  /** Relay answered with an unexpected SMTP reply. */
  PROTOCOL_ERROR,
  /** I/O failure outside the SMTP dialogue (TLS handshake, socket errors). */
  NETWORK_ERROR,
  /** Anything else. */
  UNKNOWN
}
