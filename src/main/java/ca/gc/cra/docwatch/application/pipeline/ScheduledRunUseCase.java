package ca.gc.cra.docwatch.application.pipeline;

import ca.gc.cra.docwatch.application.port.ClockPort;
import ca.gc.cra.docwatch.application.port.LastSuccessStore;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the reminder job on behalf of an external scheduler and records the last success.
 * <p><strong>Modes:</strong> {@link Mode#RUN} always executes; {@link Mode#CATCHUP} executes only when no
 * success is recorded or the last one is dated before yesterday (missed daily run).</p>
 * <p><strong>State:</strong> The timestamp is written only after a successful run.</p>
 *
 * @since 0.1.0
 */
public final class ScheduledRunUseCase {
  private static final Logger log = LoggerFactory.getLogger(ScheduledRunUseCase.class);

  /** Scheduler invocation mode. */
  public enum Mode {
    RUN,
    CATCHUP;

    /**
     * Parses a mode name case-insensitively.
     *
     * @param raw mode text
     * @return mode
     * @throws IllegalArgumentException for unknown names
     */
    public static Mode fromString(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("mode must be one of run|catchup");
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "run" -> RUN;
        case "catchup" -> CATCHUP;
        default -> throw new IllegalArgumentException("mode must be one of run|catchup (was " + raw + ")");
      };
    }
  }

  /** Outcome of a scheduler invocation. */
  public enum Status {
    SKIPPED,
    SUCCEEDED,
    FAILED
  }

  /** The job executed by the scheduler. */
  @FunctionalInterface
  public interface ReminderJob {
    ReminderOutcome run() throws IOException;
  }

  private final ReminderJob job;
  private final LastSuccessStore store;
  private final ClockPort clock;

  public ScheduledRunUseCase(ReminderJob job, LastSuccessStore store, ClockPort clock) {
    this.job = Objects.requireNonNull(job, "job");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Executes the scheduler step.
   *
   * @param mode invocation mode
   * @return status of the invocation
   * @throws IOException when the job cannot read its input or the timestamp cannot be persisted
   */
  public Status run(Mode mode) throws IOException {
    Objects.requireNonNull(mode, "mode");
    LocalDate today = clock.today();
    if (mode == Mode.CATCHUP) {
      Optional<LocalDateTime> last = store.read();
      if (!needsCatchUp(last, today)) {
        log.info("Catch-up not needed; last success {}", last.map(LocalDateTime::toString).orElse("-"));
        return Status.SKIPPED;
      }
      log.info("Catch-up required; last success {}", last.map(LocalDateTime::toString).orElse("never"));
    }

    ReminderOutcome outcome = job.run();
    if (!outcome.succeeded()) {
      log.error("Scheduled reminder run {} failed; last-success timestamp left unchanged", outcome.runId());
      return Status.FAILED;
    }
    LocalDateTime completedAt = clock.now().toLocalDateTime().truncatedTo(ChronoUnit.SECONDS);
    store.write(completedAt);
    log.info("Scheduled reminder run {} succeeded; recorded {}", outcome.runId(), completedAt);
    return Status.SUCCEEDED;
  }

  static boolean needsCatchUp(Optional<LocalDateTime> last, LocalDate today) {
    return last.map(ts -> ts.toLocalDate().isBefore(today.minusDays(1))).orElse(true);
  }
}
