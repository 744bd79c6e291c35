package ca.gc.cra.docwatch.application.notify;

import java.util.Objects;

/**
 * Rendered notification ready for dispatch.
 *
 * @param subject subject line
 * @param htmlBody HTML body
 * @param rowCount number of table rows rendered
 * @since 0.1.0
 */
public record ComposedNotification(String subject, String htmlBody, int rowCount) {
  public ComposedNotification {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(htmlBody, "htmlBody");
  }
}
