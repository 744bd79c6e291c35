package ca.gc.cra.docwatch.application.reminder;

import static ca.gc.cra.docwatch.testutil.Documents.expiringIn;
import static ca.gc.cra.docwatch.testutil.Documents.withoutExpiry;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.document.DocumentStatus;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StatusEngineTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);

  @Test
  void boundariesFollowThreshold() {
    assertEquals(DocumentStatus.EXPIRED, StatusEngine.statusForDays(-1, 30));
    assertEquals(DocumentStatus.EXPIRING_SOON, StatusEngine.statusForDays(0, 30));
    assertEquals(DocumentStatus.EXPIRING_SOON, StatusEngine.statusForDays(30, 30));
    assertEquals(DocumentStatus.VALID, StatusEngine.statusForDays(31, 30));
    assertEquals(DocumentStatus.EXPIRING_SOON, StatusEngine.statusForDays(0, 0));
    assertEquals(DocumentStatus.VALID, StatusEngine.statusForDays(1, 0));
  }

  @Test
  void missingExpiryIsUnknown() {
    assertEquals(DocumentStatus.UNKNOWN, StatusEngine.statusFor(null, TODAY, 30));
    assertEquals(DocumentStatus.EXPIRED, StatusEngine.statusFor(TODAY.minusDays(3), TODAY, 30));
  }

  @Test
  void classifyStampsEveryDocumentAndCountsAllStatuses() {
    DocumentRecord expired = expiringIn(TODAY, "张三", -5);
    DocumentRecord soon = expiringIn(TODAY, "李四", 10);
    DocumentRecord valid = expiringIn(TODAY, "王五", 90);
    DocumentRecord unknown = withoutExpiry("赵六");

    Map<DocumentStatus, Integer> distribution =
        new StatusEngine().classify(List.of(expired, soon, valid, unknown), TODAY, 30);

    assertEquals(-5, expired.daysLeft());
    assertEquals(DocumentStatus.EXPIRING_SOON, soon.status());
    assertEquals(DocumentStatus.VALID, valid.status());
    assertEquals(DocumentStatus.UNKNOWN, unknown.status());
    assertNull(unknown.daysLeft());
    assertEquals(Map.of(
        DocumentStatus.EXPIRED, 1,
        DocumentStatus.EXPIRING_SOON, 1,
        DocumentStatus.VALID, 1,
        DocumentStatus.UNKNOWN, 1), distribution);
  }

  @Test
  void emptyInputStillReportsEveryStatus() {
    Map<DocumentStatus, Integer> distribution = new StatusEngine().classify(List.of(), TODAY, 30);

    assertEquals(DocumentStatus.values().length, distribution.size());
    distribution.values().forEach(count -> assertEquals(0, count));
  }

  @Test
  void reclassifyingIsIdempotent() {
    DocumentRecord soon = expiringIn(TODAY, "李四", 10);
    StatusEngine engine = new StatusEngine();

    engine.classify(List.of(soon), TODAY, 30);
    engine.classify(List.of(soon), TODAY, 30);

    assertEquals(10, soon.daysLeft());
    assertEquals(DocumentStatus.EXPIRING_SOON, soon.status());
  }

  @Test
  void negativeThresholdRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new StatusEngine().classify(List.of(), TODAY, -1));
  }
}
