package ca.gc.cra.docwatch.domain.time;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Date helpers shared by ingestion, status computation, and rendering.
 * <p><strong>Why:</strong> Roster files arrive with dates typed by hand in several regional shapes; every
 * stage must agree on one parse and one day-delta rule.</p>
 * <p><strong>Role:</strong> Domain leaf utility; no dependencies beyond {@code java.time}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse date text against an ordered list of strict patterns, then a small lenient fallback set.</li>
 *   <li>Compute signed whole calendar-day deltas independent of time of day.</li>
 *   <li>Format dates back to {@code yyyy-MM-dd} or a caller-supplied pattern.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; formatters are immutable.</p>
 *
 * @since 0.1.0
 */
public final class DateResolver {
  /** Default display pattern used in reports and mail rows. */
  public static final DateTimeFormatter ISO_DAY = DateTimeFormatter.ofPattern("uuuu-MM-dd");
  /** Compact pattern used in generated file names. */
  public static final DateTimeFormatter COMPACT_DAY = DateTimeFormatter.ofPattern("uuuuMMdd");

  // Order matters: compact digits first, then year-first, then day-first shapes.
  private static final List<DateTimeFormatter> STRICT_PATTERNS = List.of(
      strict("uuuuMMdd"),
      strict("uuuu-MM-dd"),
      strict("uuuu/MM/dd"),
      strict("dd/MM/uuuu"),
      strict("dd-MM-uuuu"),
      strict("uuuu年MM月dd日"));

  private static final List<DateTimeFormatter> LENIENT_PATTERNS = List.of(
      strict("uuuu-M-d"),
      strict("uuuu/M/d"),
      strict("uuuu.M.d"),
      strict("uuuu年M月d日"),
      strict("d/M/uuuu"),
      strict("d-M-uuuu"));

  private DateResolver() {
    // Utility
  }

  /**
   * Parses free-form date text.
   *
   * @param text candidate text; {@code null} or blank yields empty
   * @return parsed date, or empty when no supported shape matches
   */
  public static Optional<LocalDate> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return Optional.empty();
    }
    for (DateTimeFormatter formatter : STRICT_PATTERNS) {
      Optional<LocalDate> parsed = tryParse(trimmed, formatter);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    for (DateTimeFormatter formatter : LENIENT_PATTERNS) {
      Optional<LocalDate> parsed = tryParse(trimmed, formatter);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return parseDateTime(trimmed);
  }

  /**
   * Returns {@code true} when {@link #parse(String)} would succeed.
   *
   * @param text candidate text
   * @return whether the text is a supported date
   */
  public static boolean isValid(String text) {
    return parse(text).isPresent();
  }

  /**
   * Signed number of calendar days from {@code today} to {@code target}.
   *
   * @param today reference day; must not be {@code null}
   * @param target day being measured; must not be {@code null}
   * @return positive when {@code target} is in the future, negative when in the past
   */
  public static int daysBetween(LocalDate today, LocalDate target) {
    return Math.toIntExact(ChronoUnit.DAYS.between(today, target));
  }

  /**
   * Formats a date as {@code yyyy-MM-dd}.
   *
   * @param date date to format; {@code null} yields an empty string
   * @return formatted text
   */
  public static String format(LocalDate date) {
    return format(date, ISO_DAY);
  }

  /**
   * Formats a date with the supplied formatter.
   *
   * @param date date to format; {@code null} yields an empty string
   * @param formatter formatter to apply
   * @return formatted text
   */
  public static String format(LocalDate date, DateTimeFormatter formatter) {
    return date == null ? "" : formatter.format(date);
  }

  /**
   * Re-renders date text into another pattern.
   *
   * @param text source text
   * @param target target formatter
   * @return normalized text, or empty when the source does not parse
   */
  public static Optional<String> normalize(String text, DateTimeFormatter target) {
    return parse(text).map(target::format);
  }

  private static Optional<LocalDate> tryParse(String text, DateTimeFormatter formatter) {
    try {
      return Optional.of(LocalDate.parse(text, formatter));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  // Spreadsheet exports sometimes carry a time component ("2024-01-01 00:00:00").
  private static Optional<LocalDate> parseDateTime(String text) {
    String candidate = text.replace(' ', 'T');
    try {
      return Optional.of(LocalDateTime.parse(candidate).toLocalDate());
    } catch (DateTimeException ex) {
      return Optional.empty();
    }
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
  }
}
