package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.application.reminder.ReminderFilter;
import ca.gc.cra.docwatch.domain.document.ReminderThresholds;
import java.util.Objects;

/**
 * Reminder settings.
 *
 * @param thresholds reminder day counts
 * @param handledRemark remark that suppresses a reminder
 * @since 0.1.0
 */
public record ReminderConfig(ReminderThresholds thresholds, String handledRemark) {
  public ReminderConfig {
    Objects.requireNonNull(thresholds, "thresholds");
    handledRemark = handledRemark == null || handledRemark.isBlank()
        ? ReminderFilter.DEFAULT_HANDLED_REMARK
        : handledRemark.trim();
  }

  public static ReminderConfig defaults() {
    return new ReminderConfig(ReminderThresholds.DEFAULT, ReminderFilter.DEFAULT_HANDLED_REMARK);
  }
}
