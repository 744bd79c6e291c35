package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.domain.DocwatchException;
import java.util.List;

/**
 * Raised when configuration is missing, malformed, or out of range. Lists every problem found.
 *
 * @since 0.1.0
 */
public final class ConfigException extends DocwatchException {
  private final List<String> problems;

  /**
   * Creates an exception for a set of problems.
   *
   * @param source configuration source (usually the file path)
   * @param problems problems in discovery order; must not be empty
   */
  public ConfigException(String source, List<String> problems) {
    super(render(source, problems));
    this.problems = List.copyOf(problems);
  }

  /**
   * Creates an exception for a single problem with a cause.
   *
   * @param message problem description
   * @param cause underlying parse failure
   */
  public ConfigException(String message, Throwable cause) {
    super(message, cause);
    this.problems = List.of(message);
  }

  public List<String> problems() {
    return problems;
  }

  private static String render(String source, List<String> problems) {
    StringBuilder sb = new StringBuilder("Invalid configuration in ")
        .append(source)
        .append(" (")
        .append(problems.size())
        .append(" problem(s)):");
    for (String problem : problems) {
      sb.append(System.lineSeparator()).append("  - ").append(problem);
    }
    return sb.toString();
  }
}
