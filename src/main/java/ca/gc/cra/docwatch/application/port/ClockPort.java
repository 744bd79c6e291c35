package ca.gc.cra.docwatch.application.port;

import java.time.LocalDate;
import java.time.ZonedDateTime;

/**
 * <strong>What:</strong> Domain port supplying the current local date-time to DOCWATCH use cases.
 * <p><strong>Why:</strong> "Today" drives every expiry computation; tests pin it to a fixed instant.</p>
 * <p><strong>Role:</strong> Domain port consumed by application use cases.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose the current zoned date-time.</li>
 *   <li>Derive the calendar day used for a whole batch.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link ZonedDateTime#now()}.
 * @since 0.1.0
 * @see ca.gc.cra.docwatch.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current date-time in the system zone.
   *
   * @return current date-time; never {@code null}
   */
  ZonedDateTime now();

  /**
   * Returns the current calendar day. Callers read this once per batch.
   *
   * @return today's date in the clock's zone
   */
  default LocalDate today() {
    return now().toLocalDate();
  }

  /**
   * Default {@link ClockPort} using the JVM clock and default zone.
   */
  ClockPort SYSTEM = ZonedDateTime::now;
}
