package ca.gc.cra.docwatch.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.application.pipeline.ScheduledRunUseCase.Mode;
import ca.gc.cra.docwatch.application.pipeline.ScheduledRunUseCase.Status;
import ca.gc.cra.docwatch.application.port.LastSuccessStore;
import ca.gc.cra.docwatch.application.reminder.ReminderSummary;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import ca.gc.cra.docwatch.testutil.FixedClock;
import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ScheduledRunUseCaseTest {
  private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 10, 9, 0, 30, 123_000_000);
  private static final LocalDate TODAY = NOW.toLocalDate();

  private final MemoryStore store = new MemoryStore();
  private int runs;

  @Test
  void catchUpThresholdIsMoreThanOneDay() {
    assertTrue(ScheduledRunUseCase.needsCatchUp(Optional.empty(), TODAY));
    assertFalse(ScheduledRunUseCase.needsCatchUp(Optional.of(TODAY.atTime(8, 0)), TODAY));
    assertFalse(ScheduledRunUseCase.needsCatchUp(Optional.of(TODAY.minusDays(1).atStartOfDay()), TODAY));
    assertTrue(ScheduledRunUseCase.needsCatchUp(Optional.of(TODAY.minusDays(2).atTime(23, 59)), TODAY));
  }

  @Test
  void runModeAlwaysRunsAndRecordsSuccess() throws IOException {
    store.value = Optional.of(TODAY.atTime(7, 0));

    Status status = new ScheduledRunUseCase(this::succeeded, store, FixedClock.at(NOW)).run(Mode.RUN);

    assertEquals(Status.SUCCEEDED, status);
    assertEquals(1, runs);
    assertEquals(Optional.of(LocalDateTime.of(2024, 6, 10, 9, 0, 30)), store.value);
  }

  @Test
  void catchUpSkipsWhenRecent() throws IOException {
    store.value = Optional.of(TODAY.minusDays(1).atTime(9, 0));

    Status status = new ScheduledRunUseCase(this::succeeded, store, FixedClock.at(NOW)).run(Mode.CATCHUP);

    assertEquals(Status.SKIPPED, status);
    assertEquals(0, runs);
  }

  @Test
  void catchUpRunsWhenStale() throws IOException {
    store.value = Optional.of(TODAY.minusDays(3).atTime(9, 0));

    Status status = new ScheduledRunUseCase(this::succeeded, store, FixedClock.at(NOW)).run(Mode.CATCHUP);

    assertEquals(Status.SUCCEEDED, status);
    assertEquals(1, runs);
  }

  @Test
  void failedDeliveryLeavesTimestampUntouched() throws IOException {
    Optional<LocalDateTime> before = Optional.of(TODAY.minusDays(5).atTime(9, 0));
    store.value = before;

    Status status = new ScheduledRunUseCase(this::failed, store, FixedClock.at(NOW)).run(Mode.RUN);

    assertEquals(Status.FAILED, status);
    assertEquals(before, store.value);
    assertEquals(0, store.writes);
  }

  @Test
  void modeParsing() {
    assertEquals(Mode.CATCHUP, Mode.fromString(" CatchUp "));
    assertThrows(IllegalArgumentException.class, () -> Mode.fromString("daily"));
    assertThrows(IllegalArgumentException.class, () -> Mode.fromString(""));
  }

  private ReminderOutcome succeeded() {
    runs++;
    return new ReminderOutcome("run00001", 0, List.of(), ReminderSummary.empty(), Optional.empty());
  }

  private ReminderOutcome failed() {
    runs++;
    return new ReminderOutcome("run00002", 1, List.of(), ReminderSummary.empty(),
        Optional.of(new DeliveryResult(false, List.of())));
  }

  private static final class MemoryStore implements LastSuccessStore {
    private Optional<LocalDateTime> value = Optional.empty();
    private int writes;

    @Override
    public Optional<LocalDateTime> read() {
      return value;
    }

    @Override
    public void write(LocalDateTime timestamp) {
      writes++;
      value = Optional.of(timestamp);
    }
  }
}
