package ca.gc.cra.docwatch.domain.document;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Ordered reminder day counts (for example {@code [60, 30, 7, 1]}).
 *
 * <p>Only {@link #max()} drives eligibility; the order is kept for reporting.</p>
 *
 * @param days non-negative day counts in configured order
 * @since 0.1.0
 */
public record ReminderThresholds(List<Integer> days) {
  /** Default reminder schedule. */
  public static final ReminderThresholds DEFAULT = new ReminderThresholds(List.of(60, 30, 7, 1));

  public ReminderThresholds {
    Objects.requireNonNull(days, "days");
    for (Integer day : days) {
      if (day == null || day < 0) {
        throw new IllegalArgumentException("reminder days must be non-negative integers (was " + day + ")");
      }
    }
    days = List.copyOf(days);
  }

  /**
   * Convenience factory.
   *
   * @param days day counts
   * @return thresholds
   */
  public static ReminderThresholds of(Integer... days) {
    return new ReminderThresholds(List.of(days));
  }

  public boolean isEmpty() {
    return days.isEmpty();
  }

  /**
   * Largest configured day count.
   *
   * @return maximum, or empty when no thresholds are configured
   */
  public OptionalInt max() {
    return days.stream().mapToInt(Integer::intValue).max();
  }
}
