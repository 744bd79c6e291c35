package ca.gc.cra.docwatch.domain.delivery;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one dispatch: whether any relay accepted the message, plus every attempt in order.
 *
 * @param delivered {@code true} when exactly the last attempt succeeded
 * @param attempts attempt log in relay order
 * @since 0.1.0
 */
public record DeliveryResult(boolean delivered, List<DeliveryAttempt> attempts) {
  public DeliveryResult {
    attempts = List.copyOf(Objects.requireNonNull(attempts, "attempts"));
    if (delivered && (attempts.isEmpty() || !attempts.get(attempts.size() - 1).succeeded())) {
      throw new IllegalArgumentException("a delivered result must end with a successful attempt");
    }
  }

  /**
   * Relay that accepted the message.
   *
   * @return accepting relay name, or empty when nothing was delivered
   */
  public Optional<String> deliveredVia() {
    if (!delivered) {
      return Optional.empty();
    }
    return Optional.of(attempts.get(attempts.size() - 1).relayName());
  }
}
