package ca.gc.cra.docwatch.application.reminder;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Aggregates reminder candidates by status, person, document kind, and day bucket.
 *
 * @since 0.1.0
 */
public final class SummaryBuilder {
  private static final String UNKNOWN_BUCKET = "未知";

  /**
   * Builds the summary.
   *
   * @param candidates reminder candidates in display order
   * @return aggregate counts and groupings; all-zero for an empty input
   */
  public ReminderSummary build(List<DocumentRecord> candidates) {
    Objects.requireNonNull(candidates, "candidates");
    if (candidates.isEmpty()) {
      return ReminderSummary.empty();
    }
    int expired = 0;
    int expiring = 0;
    for (DocumentRecord document : candidates) {
      Integer daysLeft = document.daysLeft();
      if (daysLeft == null) {
        continue;
      }
      if (daysLeft < 0) {
        expired++;
      } else {
        expiring++;
      }
    }
    return new ReminderSummary(
        candidates.size(),
        expired,
        expiring,
        group(candidates, SummaryBuilder::dayBucket),
        group(candidates, DocumentRecord::personName),
        group(candidates, DocumentRecord::documentType));
  }

  /**
   * Display label for a day count.
   *
   * @param daysLeft signed days left
   * @return {@code N天} for non-negative values, {@code 已过期N天} for negative ones
   */
  public static String dayBucket(Integer daysLeft) {
    if (daysLeft == null) {
      return UNKNOWN_BUCKET;
    }
    return daysLeft < 0 ? "已过期" + Math.abs((long) daysLeft) + "天" : daysLeft + "天";
  }

  private static String dayBucket(DocumentRecord document) {
    return dayBucket(document.daysLeft());
  }

  private static Map<String, List<DocumentRecord>> group(
      List<DocumentRecord> candidates, Function<DocumentRecord, String> key) {
    Map<String, List<DocumentRecord>> groups = new LinkedHashMap<>();
    for (DocumentRecord document : candidates) {
      groups.computeIfAbsent(key.apply(document), k -> new ArrayList<>()).add(document);
    }
    return groups;
  }
}
