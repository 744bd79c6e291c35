package ca.gc.cra.docwatch.config;

import java.util.Objects;

/**
 * Raw template text for the reminder mail. Placeholders are validated by the notification composer.
 *
 * @param subject subject template
 * @param bodyHtml body template
 * @param tableRowHtml table row template
 * @since 0.1.0
 */
public record MailTemplateConfig(String subject, String bodyHtml, String tableRowHtml) {
  public static final String DEFAULT_SUBJECT = "证件到期提醒 - {count}个证件需要关注 ({today_date})";

  public MailTemplateConfig {
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(bodyHtml, "bodyHtml");
    Objects.requireNonNull(tableRowHtml, "tableRowHtml");
  }

  /**
   * Bundled templates.
   *
   * @return defaults loaded from the classpath
   */
  public static MailTemplateConfig defaults() {
    return new MailTemplateConfig(
        DEFAULT_SUBJECT,
        ClasspathTemplates.load(ClasspathTemplates.BODY),
        ClasspathTemplates.load(ClasspathTemplates.ROW));
  }
}
