package ca.gc.cra.docwatch.domain;

/**
 * Base type for unchecked DOCWATCH failures that abort a run.
 *
 * <p>Subtypes map one-to-one onto CLI exit codes.</p>
 *
 * @since 0.1.0
 */
public class DocwatchException extends RuntimeException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public DocwatchException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause root cause
   */
  public DocwatchException(String message, Throwable cause) {
    super(message, cause);
  }
}
