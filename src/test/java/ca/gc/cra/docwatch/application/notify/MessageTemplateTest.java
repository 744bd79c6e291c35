package ca.gc.cra.docwatch.application.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.Test;

class MessageTemplateTest {
  @Test
  void reportsEveryMissingPlaceholder() {
    Map<String, Function<? super String, String>> formatters = new LinkedHashMap<>();
    formatters.put("a", s -> s);
    formatters.put("b", s -> s);
    formatters.put("c", s -> s);

    TemplateException ex = assertThrows(TemplateException.class,
        () -> MessageTemplate.compile("row", "only {b} here", formatters));

    assertEquals("row", ex.templateName());
    assertEquals(List.of("a", "c"), ex.missingPlaceholders());
    assertEquals("Template 'row' is missing required placeholder(s): {a}, {c}", ex.getMessage());
  }

  @Test
  void rendersInSinglePassAndLeavesForeignBracesAlone() {
    Map<String, Function<? super String, String>> formatters = new LinkedHashMap<>();
    formatters.put("name", s -> s);
    MessageTemplate<String> template =
        MessageTemplate.compile("body", "<style>td {color: red}</style>{name} {name}", formatters);

    assertEquals("<style>td {color: red}</style>{name} {name}", template.render("{name}"));
    assertEquals("<style>td {color: red}</style>x x", template.render("x"));
  }

  @Test
  void unterminatedBraceIsCopiedVerbatim() {
    Map<String, Function<? super String, String>> formatters = new LinkedHashMap<>();
    formatters.put("v", s -> s);
    MessageTemplate<String> template = MessageTemplate.compile("t", "{v} and {open", formatters);

    assertEquals("1 and {open", template.render("1"));
    assertEquals(List.of("v"), template.placeholders());
  }
}
