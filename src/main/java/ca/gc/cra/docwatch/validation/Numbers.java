package ca.gc.cra.docwatch.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by DOCWATCH CLI and configuration parsing.
 * <p><strong>Why:</strong> Ports, thresholds, and day counts must be range-checked before a run starts.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses an integer from YAML scalars (numbers or numeric strings).
   *
   * @param name logical parameter name
   * @param value raw YAML value
   * @return parsed integer
   * @throws IllegalArgumentException when the value is missing, fractional, or not numeric
   */
  public static int requireInt(String name, Object value) {
    if (value instanceof Integer i) {
      return i;
    }
    if (value instanceof Long l) {
      return Math.toIntExact(requireRange(name, l, Integer.MIN_VALUE, Integer.MAX_VALUE));
    }
    if (value instanceof String s && !s.isBlank()) {
      try {
        return Integer.parseInt(s.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(name + " must be an integer (was '" + s + "')", ex);
      }
    }
    throw new IllegalArgumentException(name + " must be an integer (was " + value + ")");
  }
}
