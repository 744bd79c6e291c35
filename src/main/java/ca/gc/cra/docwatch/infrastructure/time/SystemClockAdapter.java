package ca.gc.cra.docwatch.infrastructure.time;

import ca.gc.cra.docwatch.application.port.ClockPort;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates an adapter using the system default zone.
   */
  public SystemClockAdapter() {
    this(Clock.systemDefaultZone());
  }

  /**
   * Creates an adapter over an explicit clock, e.g. {@link Clock#fixed} in tests.
   *
   * @param clock source clock
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the current date-time.
   *
   * @return current date-time in the clock's zone
   */
  @Override
  public ZonedDateTime now() {
    return ZonedDateTime.now(clock);
  }
}
