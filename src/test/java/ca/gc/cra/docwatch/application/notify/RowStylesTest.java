package ca.gc.cra.docwatch.application.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class RowStylesTest {
  @Test
  void colorBands() {
    assertEquals(RowStyles.GRAY, RowStyles.color(null));
    assertEquals(RowStyles.RED, RowStyles.color(-4));
    assertEquals(RowStyles.RED, RowStyles.color(1));
    assertEquals(RowStyles.ORANGE, RowStyles.color(2));
    assertEquals(RowStyles.ORANGE, RowStyles.color(7));
    assertEquals(RowStyles.YELLOW, RowStyles.color(30));
    assertEquals(RowStyles.GREEN, RowStyles.color(31));
  }

  @Test
  void daysPhrases() {
    assertEquals("未知", RowStyles.daysPhrase(null));
    assertEquals("已过期 3 天", RowStyles.daysPhrase(-3));
    assertEquals("今天到期", RowStyles.daysPhrase(0));
    assertEquals("明天到期", RowStyles.daysPhrase(1));
    assertEquals("15 天后到期", RowStyles.daysPhrase(15));
  }

  @Test
  void escapesMarkup() {
    assertEquals("&lt;b&gt;Tom &amp; &quot;Jerry&quot; &#39;x&#39;&lt;/b&gt;",
        RowStyles.escapeHtml("<b>Tom & \"Jerry\" 'x'</b>"));
    assertEquals("", RowStyles.escapeHtml(null));
  }
}
