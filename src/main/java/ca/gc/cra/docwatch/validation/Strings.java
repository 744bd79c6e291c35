package ca.gc.cra.docwatch.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings used by DOCWATCH configuration and CLI layers.
 * <p><strong>Why:</strong> Relay credentials and recipients are typed by hand into YAML; catching blanks and stray
 * control characters up front beats an opaque SMTP rejection later.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Apply the minimal mail-address shape check used for recipients.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Checks the loose address shape accepted for recipients: an {@code @} and a {@code .}.
   *
   * @param name logical parameter name for diagnostics
   * @param address candidate address
   * @return trimmed address
   * @throws IllegalArgumentException if the address is blank or lacks either character
   */
  public static String requireMailAddress(String name, String address) {
    String trimmed = requireNonBlank(name, address);
    if (trimmed.indexOf('@') < 0 || trimmed.indexOf('.') < 0) {
      throw new IllegalArgumentException(message(name, "is not a valid e-mail address: " + trimmed));
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
