package ca.gc.cra.docwatch.application.reminder;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the reminder candidates.
 *
 * <p>Grouping maps keep first-seen key order and are unmodifiable.</p>
 *
 * @param total number of candidates
 * @param expiredCount candidates with {@code daysLeft < 0}
 * @param expiringCount candidates with {@code daysLeft >= 0}
 * @param byDayBucket candidates keyed by day label ({@code 7天}, {@code 已过期5天})
 * @param byPerson candidates keyed by person
 * @param byDocumentType candidates keyed by document kind
 * @since 0.1.0
 */
public record ReminderSummary(
    int total,
    int expiredCount,
    int expiringCount,
    Map<String, List<DocumentRecord>> byDayBucket,
    Map<String, List<DocumentRecord>> byPerson,
    Map<String, List<DocumentRecord>> byDocumentType) {

  public ReminderSummary {
    byDayBucket = freeze(byDayBucket);
    byPerson = freeze(byPerson);
    byDocumentType = freeze(byDocumentType);
  }

  /** Summary of an empty candidate set. */
  public static ReminderSummary empty() {
    return new ReminderSummary(0, 0, 0, Map.of(), Map.of(), Map.of());
  }

  private static Map<String, List<DocumentRecord>> freeze(Map<String, List<DocumentRecord>> source) {
    Map<String, List<DocumentRecord>> copy = new LinkedHashMap<>();
    source.forEach((key, value) -> copy.put(key, List.copyOf(value)));
    return Collections.unmodifiableMap(copy);
  }
}
