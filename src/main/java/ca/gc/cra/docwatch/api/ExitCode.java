package ca.gc.cra.docwatch.api;

/**
 * <strong>What:</strong> Process exit codes shared by DOCWATCH commands.
 * <p><strong>Why:</strong> Schedulers (cron, systemd timers, Task Scheduler) branch on the numeric status.</p>
 * <p><strong>Role:</strong> Adapter-facing enum returned by CLI entry points.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution, including runs with nothing to send. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** File could not be read or written. */
  IO_ERROR(3),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** Roster data failed validation. */
  VALIDATION_ERROR(6),
  /** A message template lacks a required placeholder. */
  TEMPLATE_ERROR(7),
  /** Every configured relay failed. */
  DELIVERY_FAILED(8),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
