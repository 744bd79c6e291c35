package ca.gc.cra.docwatch.application.port;

import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import java.io.IOException;

/**
 * Port exporting a dispatch's attempt log for operators.
 *
 * @since 0.1.0
 */
public interface AttemptLogWriter {
  /**
   * Appends every attempt of {@code result}.
   *
   * @param runId identifier of the run that produced the result
   * @param result dispatch result
   * @throws IOException when the log cannot be written
   */
  void write(String runId, DeliveryResult result) throws IOException;

  /** Writer that discards everything. */
  AttemptLogWriter NONE = (runId, result) -> {};
}
