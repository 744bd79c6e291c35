package ca.gc.cra.docwatch.application.notify;

/**
 * Per-row display values for the reminder table.
 *
 * @since 0.1.0
 */
public final class RowStyles {
  public static final String GRAY = "#666666";
  public static final String RED = "#dc3545";
  public static final String ORANGE = "#fd7e14";
  public static final String YELLOW = "#ffc107";
  public static final String GREEN = "#28a745";

  private RowStyles() {
    // Utility
  }

  /**
   * Colour for the days-left cell.
   *
   * @param daysLeft signed days left, {@code null} when unknown
   * @return CSS colour
   */
  public static String color(Integer daysLeft) {
    if (daysLeft == null) {
      return GRAY;
    }
    if (daysLeft <= 1) {
      return RED;
    }
    if (daysLeft <= 7) {
      return ORANGE;
    }
    if (daysLeft <= 30) {
      return YELLOW;
    }
    return GREEN;
  }

  /**
   * Human phrase for the days-left cell.
   *
   * @param daysLeft signed days left, {@code null} when unknown
   * @return display phrase
   */
  public static String daysPhrase(Integer daysLeft) {
    if (daysLeft == null) {
      return "未知";
    }
    if (daysLeft < 0) {
      return "已过期 " + Math.abs((long) daysLeft) + " 天";
    }
    return switch (daysLeft) {
      case 0 -> "今天到期";
      case 1 -> "明天到期";
      default -> daysLeft + " 天后到期";
    };
  }

  /**
   * Escapes text for inclusion in HTML element content or attribute values.
   *
   * @param text raw text, may be {@code null}
   * @return escaped text; empty for {@code null}
   */
  public static String escapeHtml(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    StringBuilder out = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '&' -> out.append("&amp;");
        case '<' -> out.append("&lt;");
        case '>' -> out.append("&gt;");
        case '"' -> out.append("&quot;");
        case '\'' -> out.append("&#39;");
        default -> out.append(c);
      }
    }
    return out.toString();
  }
}
