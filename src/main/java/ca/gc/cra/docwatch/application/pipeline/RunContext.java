package ca.gc.cra.docwatch.application.pipeline;

import java.util.UUID;
import org.slf4j.MDC;

/**
 * Binds a {@code runId} to the logging MDC for the duration of a use case run and restores the previous
 * value afterwards.
 */
final class RunContext implements AutoCloseable {
  static final String MDC_KEY = "runId";

  private final String runId;
  private final String previous;

  private RunContext(String runId) {
    this.runId = runId;
    this.previous = MDC.get(MDC_KEY);
    MDC.put(MDC_KEY, runId);
  }

  static RunContext open() {
    return new RunContext(UUID.randomUUID().toString().substring(0, 8));
  }

  String runId() {
    return runId;
  }

  @Override
  public void close() {
    if (previous == null) {
      MDC.remove(MDC_KEY);
    } else {
      MDC.put(MDC_KEY, previous);
    }
  }
}
