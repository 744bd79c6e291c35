package ca.gc.cra.docwatch.application.notify;

import ca.gc.cra.docwatch.domain.DocwatchException;
import java.util.List;

/**
 * Raised when a mail template lacks a required placeholder.
 *
 * @since 0.1.0
 */
public final class TemplateException extends DocwatchException {
  private final String templateName;
  private final List<String> missingPlaceholders;

  /**
   * Creates an exception describing missing placeholders.
   *
   * @param templateName template identifier ({@code subject}, {@code body}, {@code row})
   * @param missingPlaceholders placeholder names absent from the template
   */
  public TemplateException(String templateName, List<String> missingPlaceholders) {
    super("Template '" + templateName + "' is missing required placeholder(s): "
        + String.join(", ", missingPlaceholders.stream().map(p -> "{" + p + "}").toList()));
    this.templateName = templateName;
    this.missingPlaceholders = List.copyOf(missingPlaceholders);
  }

  public String templateName() {
    return templateName;
  }

  public List<String> missingPlaceholders() {
    return missingPlaceholders;
  }
}
