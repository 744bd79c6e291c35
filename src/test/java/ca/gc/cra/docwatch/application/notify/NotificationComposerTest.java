package ca.gc.cra.docwatch.application.notify;

import static ca.gc.cra.docwatch.testutil.Documents.expiringIn;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.docwatch.application.reminder.StatusEngine;
import ca.gc.cra.docwatch.domain.document.DocumentRecord;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class NotificationComposerTest {
  private static final LocalDate TODAY = LocalDate.of(2024, 6, 1);
  private static final String SUBJECT = "证件到期提醒 - {count}个证件需要关注 ({today_date})";
  private static final String BODY = "<table>{table_rows}</table>";
  private static final String ROW =
      "<tr style=\"color:{color}\"><td>{person_name}</td><td>{document_type}</td>"
          + "<td>{expiry_date}</td><td>{days_left}</td><td>{remarks}</td></tr>";

  @Test
  void rendersRowsInCandidateOrder() {
    DocumentRecord expired = expiringIn(TODAY, "张三", -2);
    DocumentRecord tomorrow = expiringIn(TODAY, "李四", 1, "<urgent>");
    new StatusEngine().classify(List.of(expired, tomorrow), TODAY, 30);

    ComposedNotification notification =
        new NotificationComposer(SUBJECT, BODY, ROW).compose(List.of(expired, tomorrow), TODAY);

    assertEquals("证件到期提醒 - 2个证件需要关注 (2024-06-01)", notification.subject());
    assertEquals(2, notification.rowCount());
    String body = notification.htmlBody();
    assertTrue(body.startsWith("<table><tr style=\"color:#dc3545\"><td>张三</td>"));
    assertTrue(body.contains("<td>2024-05-30</td><td>已过期 2 天</td>"));
    assertTrue(body.contains("<td>明天到期</td><td>&lt;urgent&gt;</td>"));
    assertFalse(body.contains("<urgent>"));
    assertTrue(body.indexOf("张三") < body.indexOf("李四"));
  }

  @Test
  void missingRowPlaceholderFailsConstruction() {
    TemplateException ex = assertThrows(TemplateException.class,
        () -> new NotificationComposer(SUBJECT, BODY, "<tr><td>{person_name}</td></tr>"));

    assertEquals("row", ex.templateName());
    assertTrue(ex.missingPlaceholders().contains("color"));
  }

  @Test
  void bodyWithoutRowsPlaceholderFails() {
    assertThrows(TemplateException.class, () -> new NotificationComposer(SUBJECT, "<p>hi</p>", ROW));
  }

  @Test
  void testMessageStampsSendTime() {
    ComposedNotification notification = NotificationComposer.composeTest(
        "测试", "<p>sent {send_time}</p>", LocalDateTime.of(2024, 6, 1, 8, 5, 9));

    assertEquals("<p>sent 2024-06-01 08:05:09</p>", notification.htmlBody());
    assertEquals(0, notification.rowCount());
  }
}
