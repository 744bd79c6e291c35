package ca.gc.cra.docwatch.application.notify;

import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import ca.gc.cra.docwatch.domain.time.DateResolver;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Renders the reminder subject, table rows, and HTML body.
 * <p><strong>Why:</strong> Templates come from operator configuration; validating them when the composer is
 * built means a broken template stops the run before any relay is contacted.</p>
 * <p><strong>Role:</strong> Application service between the reminder filter and the delivery dispatcher.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class NotificationComposer {
  private static final DateTimeFormatter SEND_TIME = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss");

  private final MessageTemplate<SubjectModel> subject;
  private final MessageTemplate<String> body;
  private final MessageTemplate<DocumentRecord> row;
  private final Logger log;

  /**
   * Creates a composer, validating all three templates.
   *
   * @param subjectTemplate subject text requiring {@code {count}} and {@code {today_date}}
   * @param bodyTemplate body text requiring {@code {table_rows}}
   * @param rowTemplate row text requiring the six row placeholders
   * @throws TemplateException when a template misses a required placeholder
   */
  public NotificationComposer(String subjectTemplate, String bodyTemplate, String rowTemplate) {
    this(subjectTemplate, bodyTemplate, rowTemplate, LoggerFactory.getLogger(NotificationComposer.class));
  }

  /**
   * Creates a composer with an injected logger.
   *
   * @param subjectTemplate subject text
   * @param bodyTemplate body text
   * @param rowTemplate row text
   * @param log run-scoped logger
   * @throws TemplateException when a template misses a required placeholder
   */
  public NotificationComposer(
      String subjectTemplate, String bodyTemplate, String rowTemplate, Logger log) {
    this.log = Objects.requireNonNull(log, "log");
    this.subject = MessageTemplate.compile("subject", subjectTemplate, subjectFormatters());
    this.body = MessageTemplate.compile("body", bodyTemplate, bodyFormatters());
    this.row = MessageTemplate.compile("row", rowTemplate, rowFormatters());
  }

  /**
   * Renders the notification for the reminder candidates.
   *
   * @param candidates candidates in display order
   * @param today day shown in the subject
   * @return subject and body
   */
  public ComposedNotification compose(List<DocumentRecord> candidates, LocalDate today) {
    Objects.requireNonNull(candidates, "candidates");
    Objects.requireNonNull(today, "today");
    String renderedSubject = subject.render(new SubjectModel(candidates.size(), today));
    List<String> rows = new ArrayList<>(candidates.size());
    for (DocumentRecord candidate : candidates) {
      rows.add(row.render(candidate));
    }
    String renderedBody = body.render(String.join("\n", rows));
    log.debug("Composed notification '{}' with {} rows ({} chars)",
        renderedSubject, rows.size(), renderedBody.length());
    return new ComposedNotification(renderedSubject, renderedBody, rows.size());
  }

  /**
   * Renders the configuration check message.
   *
   * @param subjectLine subject to use
   * @param bodyTemplate body text requiring {@code {send_time}}
   * @param sentAt timestamp shown in the body
   * @return composed test notification
   * @throws TemplateException when {@code {send_time}} is absent
   */
  public static ComposedNotification composeTest(
      String subjectLine, String bodyTemplate, LocalDateTime sentAt) {
    Map<String, Function<? super LocalDateTime, String>> formatters = new LinkedHashMap<>();
    formatters.put("send_time", SEND_TIME::format);
    MessageTemplate<LocalDateTime> template = MessageTemplate.compile("test", bodyTemplate, formatters);
    return new ComposedNotification(subjectLine, template.render(sentAt), 0);
  }

  private static Map<String, Function<? super SubjectModel, String>> subjectFormatters() {
    Map<String, Function<? super SubjectModel, String>> formatters = new LinkedHashMap<>();
    formatters.put("count", model -> Integer.toString(model.count()));
    formatters.put("today_date", model -> DateResolver.format(model.today()));
    return formatters;
  }

  private static Map<String, Function<? super String, String>> bodyFormatters() {
    Map<String, Function<? super String, String>> formatters = new LinkedHashMap<>();
    formatters.put("table_rows", rows -> rows);
    return formatters;
  }

  private static Map<String, Function<? super DocumentRecord, String>> rowFormatters() {
    Map<String, Function<? super DocumentRecord, String>> formatters = new LinkedHashMap<>();
    formatters.put("person_name", doc -> RowStyles.escapeHtml(doc.personName()));
    formatters.put("document_type", doc -> RowStyles.escapeHtml(doc.documentType()));
    formatters.put("expiry_date", doc -> doc.expiryDate() == null ? "未知" : DateResolver.format(doc.expiryDate()));
    formatters.put("days_left", doc -> RowStyles.daysPhrase(doc.daysLeft()));
    formatters.put("remarks", doc -> RowStyles.escapeHtml(doc.remarks()));
    formatters.put("color", doc -> RowStyles.color(doc.daysLeft()));
    return formatters;
  }

  private record SubjectModel(int count, LocalDate today) {}
}
