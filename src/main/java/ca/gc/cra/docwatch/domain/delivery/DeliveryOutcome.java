package ca.gc.cra.docwatch.domain.delivery;

/**
 * Outcome of one relay attempt.
 *
 * @since 0.1.0
 */
public enum DeliveryOutcome {
  SUCCESS,
  FAILURE
}
