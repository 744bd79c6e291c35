package ca.gc.cra.docwatch.domain.delivery;

import java.util.Objects;

/**
 * One entry of the attempt log: which relay was tried and what happened.
 *
 * <p>{@code classification} and {@code hint} are {@code null} for successful attempts.</p>
 *
 * @param relayName relay name as configured
 * @param ordinal relay position ({@code 0} = primary)
 * @param outcome attempt outcome
 * @param classification failure class; {@code null} on success
 * @param hint operator remediation hint; {@code null} on success
 * @param detail failure detail (exception message); empty on success
 * @param elapsedMillis wall time spent on the attempt
 * @since 0.1.0
 */
public record DeliveryAttempt(
    String relayName,
    int ordinal,
    DeliveryOutcome outcome,
    FailureClassification classification,
    String hint,
    String detail,
    long elapsedMillis) {

  public DeliveryAttempt {
    Objects.requireNonNull(relayName, "relayName");
    Objects.requireNonNull(outcome, "outcome");
    if (outcome == DeliveryOutcome.SUCCESS && classification != null) {
      throw new IllegalArgumentException("successful attempts carry no failure classification");
    }
    if (outcome == DeliveryOutcome.FAILURE) {
      Objects.requireNonNull(classification, "classification");
      hint = hint == null ? "" : hint;
    }
    detail = detail == null ? "" : detail;
  }

  public static DeliveryAttempt success(RelayConfig relay, long elapsedMillis) {
    return new DeliveryAttempt(
        relay.name(), relay.ordinal(), DeliveryOutcome.SUCCESS, null, null, "", elapsedMillis);
  }

  public static DeliveryAttempt failure(
      RelayConfig relay,
      FailureClassification classification,
      String hint,
      String detail,
      long elapsedMillis) {
    return new DeliveryAttempt(
        relay.name(),
        relay.ordinal(),
        DeliveryOutcome.FAILURE,
        classification,
        hint,
        detail,
        elapsedMillis);
  }

  public boolean succeeded() {
    return outcome == DeliveryOutcome.SUCCESS;
  }
}
