package ca.gc.cra.docwatch.domain.document;

import ca.gc.cra.docwatch.domain.DocwatchException;

/**
 * Raised when a roster entry is malformed (missing required field, unparsable date, missing column).
 *
 * <p>Aborts the run; never recovered locally.</p>
 *
 * @since 0.1.0
 */
public final class DocumentValidationException extends DocwatchException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error naming the offending row or column
   */
  public DocumentValidationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public DocumentValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
