package ca.gc.cra.docwatch.application.reminder;

import static ca.gc.cra.docwatch.testutil.Documents.expiringIn;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.document.ReminderThresholds;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class SummaryBuilderTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

  @Test
  void countsAndGroupsCandidates() {
    List<DocumentRecord> all = List.of(
        expiringIn(TODAY, "张三", -3),
        expiringIn(TODAY, "张三", 0),
        expiringIn(TODAY, "李四", 7),
        expiringIn(TODAY, "王五", 7));
    new StatusEngine().classify(all, TODAY, 30);
    List<DocumentRecord> candidates = new ReminderFilter(ReminderThresholds.DEFAULT).apply(all);

    ReminderSummary summary = new SummaryBuilder().build(candidates);

    assertEquals(4, summary.total());
    assertEquals(1, summary.expiredCount());
    assertEquals(3, summary.expiringCount());
    assertEquals(summary.total(), summary.expiredCount() + summary.expiringCount());
    assertEquals(List.of("已过期3天", "0天", "7天"), List.copyOf(summary.byDayBucket().keySet()));
    assertEquals(2, summary.byDayBucket().get("7天").size());
    assertEquals(2, summary.byPerson().get("张三").size());
    assertEquals(4, summary.byDocumentType().get("护照").size());
  }

  @Test
  void emptyCandidatesGiveEmptySummary() {
    ReminderSummary summary = new SummaryBuilder().build(List.of());

    assertEquals(0, summary.total());
    assertTrue(summary.byPerson().isEmpty());
  }

  @Test
  void bucketLabels() {
    assertEquals("未知", SummaryBuilder.dayBucket(null));
    assertEquals("已过期1天", SummaryBuilder.dayBucket(-1));
    assertEquals("12天", SummaryBuilder.dayBucket(12));
  }
}
