package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.domain.time.DateResolver;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Status report settings.
 *
 * @param outputFilename file name pattern; {@code {date}} expands to {@code yyyyMMdd}
 * @param expiringThreshold inclusive expiring-soon window in days
 * @since 0.1.0
 */
public record ReportConfig(String outputFilename, int expiringThreshold) {
  public static final String DEFAULT_OUTPUT_FILENAME = "证件状态报告_{date}.csv";
  public static final int DEFAULT_EXPIRING_THRESHOLD = 30;

  public ReportConfig {
    Objects.requireNonNull(outputFilename, "outputFilename");
    if (expiringThreshold < 0) {
      throw new IllegalArgumentException("expiringThreshold must be >= 0");
    }
  }

  public static ReportConfig defaults() {
    return new ReportConfig(DEFAULT_OUTPUT_FILENAME, DEFAULT_EXPIRING_THRESHOLD);
  }

  /**
   * Expands the file name pattern for {@code day}.
   *
   * @param day report day
   * @return concrete file name
   */
  public String fileNameFor(LocalDate day) {
    return outputFilename.replace("{date}", DateResolver.format(day, DateResolver.COMPACT_DAY));
  }

  /**
   * Resolves the report file for {@code day}.
   *
   * @param day report day
   * @return report path relative to the working directory
   * @throws ConfigException if the name cannot be represented on this platform
   */
  public Path fileFor(LocalDate day) {
    return ConfigPaths.resolve("report.output_filename", fileNameFor(day));
  }
}
