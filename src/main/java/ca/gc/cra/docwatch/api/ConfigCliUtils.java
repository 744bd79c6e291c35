package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.config.AppConfig;
import ca.gc.cra.docwatch.config.ConfigException;
import ca.gc.cra.docwatch.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helpers shared by commands that read {@code config.yaml}.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  static final Path DEFAULT_CONFIG = Path.of("config.yaml");

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=} (or {@code --config=}) from {@code options}.
   *
   * @param options mutable option map
   * @return explicit config path, or empty when not supplied
   */
  static Optional<Path> extractConfigPath(Map<String, String> options) {
    if (options == null || options.isEmpty()) {
      return Optional.empty();
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = options.remove(key);
      if (value != null && !value.isBlank()) {
        return Optional.of(Path.of(value.trim()));
      }
    }
    return Optional.empty();
  }

  /**
   * Removes an optional path option.
   *
   * @param options mutable option map
   * @param key option name
   * @return path, or empty when absent or blank
   */
  static Optional<Path> removePath(Map<String, String> options, String key) {
    String value = options.remove(key);
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(Path.of(value.trim()));
  }

  /**
   * Applies {@code log_level} and {@code log_file} from the configuration. {@code --verbose} keeps DEBUG.
   *
   * @param config loaded configuration
   * @param verbose whether {@code --verbose} was supplied
   * @param today day used to expand {@code {date}} in the log file name
   */
  static void applyLogging(AppConfig config, boolean verbose, LocalDate today) {
    if (!verbose) {
      LoggingConfigurator.applyLevel(config.logLevel());
    }
    Optional<Path> logFile;
    try {
      logFile = config.logFileFor(today);
    } catch (ConfigException ex) {
      log.warn("{}; continuing with console logging only", ex.getMessage());
      return;
    }
    if (logFile.isEmpty()) {
      return;
    }
    try {
      LoggingConfigurator.attachFileAppender(logFile.get());
    } catch (IOException ex) {
      log.warn("Unable to log to {}; continuing with console logging only: {}", logFile.get(), ex.getMessage());
    }
  }
}
