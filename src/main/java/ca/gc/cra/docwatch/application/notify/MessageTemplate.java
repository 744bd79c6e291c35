package ca.gc.cra.docwatch.application.notify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Template text bound to an explicit placeholder → formatter map.
 * <p><strong>Contract:</strong> Every mapped placeholder must appear in the text as {@code {name}}; otherwise
 * construction fails with {@link TemplateException} before anything is rendered. Brace sequences that are
 * not mapped placeholders (CSS blocks, for example) are copied through unchanged, and substituted values are
 * never re-scanned.</p>
 * <p><strong>Thread-safety:</strong> Immutable; formatters must be side-effect free.</p>
 *
 * @param <T> model type rendered by this template
 * @since 0.1.0
 */
public final class MessageTemplate<T> {
  private final String name;
  private final String text;
  private final Map<String, Function<? super T, String>> formatters;

  private MessageTemplate(String name, String text, Map<String, Function<? super T, String>> formatters) {
    this.name = name;
    this.text = text;
    this.formatters = formatters;
  }

  /**
   * Validates {@code text} against {@code formatters} and returns the bound template.
   *
   * @param name template identifier used in error messages
   * @param text template text; must not be {@code null}
   * @param formatters placeholder name to formatter, in reporting order
   * @param <T> model type
   * @return bound template
   * @throws TemplateException if any placeholder is absent from {@code text}
   */
  public static <T> MessageTemplate<T> compile(
      String name, String text, Map<String, Function<? super T, String>> formatters) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(formatters, "formatters");
    List<String> missing = new ArrayList<>();
    for (String placeholder : formatters.keySet()) {
      if (!text.contains("{" + placeholder + "}")) {
        missing.add(placeholder);
      }
    }
    if (!missing.isEmpty()) {
      throw new TemplateException(name, missing);
    }
    Map<String, Function<? super T, String>> copy = new LinkedHashMap<>(formatters);
    return new MessageTemplate<T>(name, text, Collections.unmodifiableMap(copy));
  }

  /**
   * Renders the template for {@code model}.
   *
   * @param model value handed to each formatter
   * @return rendered text
   */
  public String render(T model) {
    Map<String, String> values = new LinkedHashMap<>();
    formatters.forEach((placeholder, formatter) -> values.put(placeholder, formatter.apply(model)));
    StringBuilder out = new StringBuilder(text.length() + 64);
    int cursor = 0;
    while (cursor < text.length()) {
      int open = text.indexOf('{', cursor);
      if (open < 0) {
        break;
      }
      int close = text.indexOf('}', open + 1);
      if (close < 0) {
        break;
      }
      String key = text.substring(open + 1, close);
      String value = values.get(key);
      if (value == null) {
        // not ours: emit the brace and keep scanning right after it
        out.append(text, cursor, open + 1);
        cursor = open + 1;
      } else {
        out.append(text, cursor, open).append(value);
        cursor = close + 1;
      }
    }
    out.append(text, cursor, text.length());
    return out.toString();
  }

  public String name() {
    return name;
  }

  public List<String> placeholders() {
    return List.copyOf(formatters.keySet());
  }
}
