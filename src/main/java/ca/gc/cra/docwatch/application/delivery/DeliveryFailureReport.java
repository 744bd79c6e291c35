package ca.gc.cra.docwatch.application.delivery;

import ca.gc.cra.docwatch.domain.delivery.DeliveryAttempt;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated report produced when every relay has failed.
 *
 * @param attempts failed attempts in relay order
 * @since 0.1.0
 */
public record DeliveryFailureReport(List<DeliveryAttempt> attempts) {
  public DeliveryFailureReport {
    attempts = List.copyOf(Objects.requireNonNull(attempts, "attempts"));
  }

  /**
   * One hint per attempted relay, in relay order.
   *
   * @return hints
   */
  public List<String> hints() {
    return attempts.stream().map(DeliveryAttempt::hint).toList();
  }

  /**
   * Multi-line operator text.
   *
   * @return rendered report
   */
  public String render() {
    StringBuilder sb = new StringBuilder("All ")
        .append(attempts.size())
        .append(" relay(s) failed:");
    for (DeliveryAttempt attempt : attempts) {
      sb.append(System.lineSeparator())
          .append("  [")
          .append(attempt.ordinal())
          .append("] ")
          .append(attempt.relayName())
          .append(": ")
          .append(attempt.classification())
          .append(" - ")
          .append(attempt.detail());
      sb.append(System.lineSeparator()).append("      hint: ").append(attempt.hint());
    }
    return sb.toString();
  }
}
