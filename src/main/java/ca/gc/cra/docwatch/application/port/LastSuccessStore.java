package ca.gc.cra.docwatch.application.port;

import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Port remembering when the reminder job last completed successfully.
 *
 * @since 0.1.0
 */
public interface LastSuccessStore {
  /**
   * Reads the stored timestamp.
   *
   * @return last success, or empty when none is recorded or the stored value is unreadable
   */
  Optional<LocalDateTime> read();

  /**
   * Replaces the stored timestamp atomically.
   *
   * @param timestamp completion time
   * @throws IOException when the value cannot be persisted
   */
  void write(LocalDateTime timestamp) throws IOException;
}
