package ca.gc.cra.docwatch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures DOCWATCH runtime logging for CLI-driven workflows.
 * <p><strong>Why:</strong> Operators set the level and log file in {@code config.yaml} and raise verbosity with
 * {@code --verbose}; scheduled runs keep a size-capped log next to the state file.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Adjust the root logging level of the Logback context.</li>
 *   <li>Attach plain and size-rolled file appenders using the console pattern.</li>
 *   <li>Warn when the backend does not support dynamic configuration.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Pattern shared by console and file output. */
  public static final String PATTERN = "[%d{yyyy-MM-dd HH:mm:ss}] %-5level %logger{36}: %msg%n";

  private static final int ROLLED_FILES = 5;

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    applyLevel("DEBUG");
  }

  /**
   * Sets the root level from configuration text. {@code WARNING} and {@code CRITICAL} are accepted as aliases
   * of {@code WARN} and {@code ERROR}.
   *
   * @param levelName level name, case-insensitive
   * @return {@code true} when the level was applied
   */
  public static boolean applyLevel(String levelName) {
    LoggerContext context = context();
    if (context == null) {
      return false;
    }
    String normalized = levelName == null ? "INFO" : levelName.trim().toUpperCase(Locale.ROOT);
    Level level = switch (normalized) {
      case "WARNING" -> Level.WARN;
      case "CRITICAL" -> Level.ERROR;
      default -> Level.toLevel(normalized, Level.INFO);
    };
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    if (!level.equals(root.getLevel())) {
      root.setLevel(level);
    }
    return true;
  }

  /**
   * Appends all log output to {@code file} in addition to the console.
   *
   * @param file log file; parent directories are created
   * @throws IOException when the parent directory cannot be created
   */
  public static void attachFileAppender(Path file) throws IOException {
    LoggerContext context = context();
    if (context == null) {
      return;
    }
    createParent(file);
    FileAppender<ILoggingEvent> appender = new FileAppender<>();
    appender.setContext(context);
    appender.setName("FILE");
    appender.setFile(file.toString());
    appender.setAppend(true);
    appender.setEncoder(encoder(context));
    appender.start();
    attach(context, appender);
    log.debug("Logging to {}", file);
  }

  /**
   * Appends all log output to {@code file}, rolling it once it reaches {@code maxBytes}.
   *
   * @param file active log file; parent directories are created
   * @param maxBytes size that triggers a rollover
   * @throws IOException when the parent directory cannot be created
   */
  public static void attachRollingFileAppender(Path file, long maxBytes) throws IOException {
    LoggerContext context = context();
    if (context == null) {
      return;
    }
    createParent(file);
    RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
    appender.setContext(context);
    appender.setName("ROLLING");
    appender.setFile(file.toString());
    appender.setEncoder(encoder(context));

    FixedWindowRollingPolicy rolling = new FixedWindowRollingPolicy();
    rolling.setContext(context);
    rolling.setParent(appender);
    rolling.setFileNamePattern(rolledPattern(file));
    rolling.setMinIndex(1);
    rolling.setMaxIndex(ROLLED_FILES);
    rolling.start();

    SizeBasedTriggeringPolicy<ILoggingEvent> trigger = new SizeBasedTriggeringPolicy<>();
    trigger.setContext(context);
    trigger.setMaxFileSize(new FileSize(maxBytes));
    trigger.start();

    appender.setRollingPolicy(rolling);
    appender.setTriggeringPolicy(trigger);
    appender.start();
    attach(context, appender);
    log.debug("Logging to {} (rolls at {} bytes)", file, maxBytes);
  }

  static String rolledPattern(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    String stem = dot > 0 ? name.substring(0, dot) : name;
    String extension = dot > 0 ? name.substring(dot) : "";
    Path parent = file.toAbsolutePath().getParent();
    return parent.resolve(stem + ".%i" + extension).toString();
  }

  private static PatternLayoutEncoder encoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(PATTERN);
    encoder.start();
    return encoder;
  }

  private static void attach(LoggerContext context, ch.qos.logback.core.Appender<ILoggingEvent> appender) {
    Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    ch.qos.logback.core.Appender<ILoggingEvent> previous = root.getAppender(appender.getName());
    if (previous != null) {
      root.detachAppender(previous);
      previous.stop();
    }
    root.addAppender(appender);
  }

  private static void createParent(Path file) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }

  private static LoggerContext context() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      return context;
    }
    log.warn("Logging reconfiguration requested but backend {} does not support dynamic updates",
        factory.getClass().getName());
    return null;
  }
}
