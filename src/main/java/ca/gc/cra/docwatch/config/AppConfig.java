package ca.gc.cra.docwatch.config;

import ca.gc.cra.docwatch.domain.time.DateResolver;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Fully validated DOCWATCH configuration.
 * <p><strong>Role:</strong> Produced once by {@link YamlConfigLoader} and handed to {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param email relays and recipients
 * @param reminder reminder thresholds and sentinel
 * @param report report settings
 * @param mailTemplate mail templates
 * @param dataFile roster CSV location as configured; resolved by {@link #dataFilePath()}
 * @param logLevel root log level
 * @param logFile optional log file pattern; {@code {date}} expands to {@code yyyyMMdd}
 * @since 0.1.0
 */
public record AppConfig(
    EmailConfig email,
    ReminderConfig reminder,
    ReportConfig report,
    MailTemplateConfig mailTemplate,
    String dataFile,
    String logLevel,
    String logFile) {

  public static final String DEFAULT_DATA_FILE = "sample_data/人员证件信息.csv";
  public static final String DEFAULT_LOG_LEVEL = "INFO";

  public AppConfig {
    Objects.requireNonNull(email, "email");
    Objects.requireNonNull(reminder, "reminder");
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(mailTemplate, "mailTemplate");
    dataFile = dataFile == null || dataFile.isBlank() ? DEFAULT_DATA_FILE : dataFile.trim();
    logLevel = logLevel == null || logLevel.isBlank() ? DEFAULT_LOG_LEVEL : logLevel;
    logFile = logFile == null || logFile.isBlank() ? null : logFile;
  }

  /**
   * Resolves the roster location.
   *
   * @return roster CSV path
   * @throws ConfigException if the name cannot be represented on this platform
   */
  public Path dataFilePath() {
    return ConfigPaths.resolve("data_file", dataFile);
  }

  /**
   * Resolves the log file for {@code day}.
   *
   * @param day run day
   * @return log file path, or empty when file logging is not configured
   * @throws ConfigException if the name cannot be represented on this platform
   */
  public Optional<Path> logFileFor(LocalDate day) {
    if (logFile == null) {
      return Optional.empty();
    }
    return Optional.of(ConfigPaths.resolve("log_file",
        logFile.replace("{date}", DateResolver.format(day, DateResolver.COMPACT_DAY))));
  }
}
