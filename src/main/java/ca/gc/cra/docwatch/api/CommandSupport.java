package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.application.delivery.DeliveryFailureReport;
import ca.gc.cra.docwatch.application.notify.TemplateException;
import ca.gc.cra.docwatch.config.AppConfig;
import ca.gc.cra.docwatch.config.CompositionRoot;
import ca.gc.cra.docwatch.config.ConfigException;
import ca.gc.cra.docwatch.config.YamlConfigLoader;
import ca.gc.cra.docwatch.domain.DocwatchException;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import ca.gc.cra.docwatch.domain.document.DocumentValidationException;
import ca.gc.cra.docwatch.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared command skeleton: argument parsing, help, logging, configuration loading, and exception to
 * {@link ExitCode} mapping.
 */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private static final Function<AppConfig, CompositionRoot> DEFAULT_ROOT_FACTORY = CompositionRoot::new;
  private static volatile Function<AppConfig, CompositionRoot> rootFactory = DEFAULT_ROOT_FACTORY;

  private CommandSupport() {}

  /**
   * Static description of a command.
   *
   * @param name command name used in log messages
   * @param usage one-line usage printed on argument errors
   * @param helpText text printed for {@code --help}
   * @param optionKeys accepted {@code key=value} names besides {@code config} and telemetry keys
   */
  record CommandDescriptor(String name, String usage, String helpText, Set<String> optionKeys) {
    CommandDescriptor {
      Objects.requireNonNull(name, "name");
      optionKeys = Set.copyOf(optionKeys);
    }
  }

  /** Command body executed once arguments and configuration are in place. */
  @FunctionalInterface
  interface ConfiguredCommand {
    ExitCode execute(CompositionRoot root, Map<String, String> options, CliInput input) throws Exception;
  }

  /**
   * Runs a command that needs {@code config.yaml}.
   *
   * @param descriptor command description
   * @param args raw arguments following the command name
   * @param body command body
   * @return exit code
   */
  static ExitCode runConfigured(CommandDescriptor descriptor, String[] args, ConfiguredCommand body) {
    CliInput input;
    Map<String, String> options;
    try {
      input = CliInput.parse(args);
      if (input.help()) {
        CliPrinter.println(descriptor.helpText().stripTrailing());
        return ExitCode.SUCCESS;
      }
      options = prepareOptions(descriptor, input);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(descriptor.usage());
      return ExitCode.INVALID_ARGS;
    }

    Path configPath = ConfigCliUtils.extractConfigPath(options).orElse(ConfigCliUtils.DEFAULT_CONFIG);
    AppConfig config;
    try {
      config = YamlConfigLoader.load(configPath);
    } catch (ConfigException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration {}: {}", configPath, ex.getMessage());
      return ExitCode.IO_ERROR;
    }
    ConfigCliUtils.applyLogging(config, input.verbose(), LocalDate.now());

    try (CompositionRoot root = rootFactory.apply(config)) {
      return body.execute(root, options, input);
    } catch (Exception ex) {
      return exitCodeFor(descriptor.name(), ex);
    }
  }

  /**
   * Parses arguments for a command that does not read configuration.
   *
   * @param descriptor command description
   * @param input parsed input
   * @return remaining options with telemetry keys removed
   * @throws IllegalArgumentException on unknown options
   */
  static Map<String, String> prepareOptions(CommandDescriptor descriptor, CliInput input) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", descriptor.name());
    }
    if (!input.words().isEmpty()) {
      throw new IllegalArgumentException("unexpected argument '" + input.words().get(0) + "'");
    }
    Map<String, String> options = input.options();
    TelemetryConfigurator.configureMetrics(options);
    Set<String> unknown = new TreeSet<>(options.keySet());
    unknown.removeAll(descriptor.optionKeys());
    unknown.remove("config");
    unknown.remove("--config");
    if (!unknown.isEmpty()) {
      throw new IllegalArgumentException("unknown option(s) " + unknown);
    }
    return options;
  }

  /**
   * Maps a failure escaping a command body to an exit code, logging it once.
   *
   * @param command command name
   * @param ex failure
   * @return exit code
   */
  static ExitCode exitCodeFor(String command, Exception ex) {
    if (ex instanceof DocumentValidationException) {
      log.error("{}: invalid document data: {}", command, ex.getMessage());
      return ExitCode.VALIDATION_ERROR;
    }
    if (ex instanceof TemplateException) {
      log.error("{}: {}", command, ex.getMessage());
      return ExitCode.TEMPLATE_ERROR;
    }
    if (ex instanceof ConfigException) {
      log.error("{}: {}", command, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof IOException || ex instanceof UncheckedIOException) {
      log.error("{}: I/O failure: {}", command, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
    if (ex instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      log.error("{}: interrupted", command);
      return ExitCode.INTERRUPTED;
    }
    if (ex instanceof IllegalArgumentException) {
      log.error("{}: {}", command, ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof DocwatchException) {
      log.error("{}: {}", command, ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    log.error("{}: unexpected failure", command, ex);
    return ExitCode.RUNTIME_FAILURE;
  }

  /**
   * Prints the delivery outcome and maps it to an exit code.
   *
   * @param result dispatch result
   * @return {@link ExitCode#SUCCESS} when a relay accepted the message, else {@link ExitCode#DELIVERY_FAILED}
   */
  static ExitCode reportDelivery(DeliveryResult result) {
    if (result.delivered()) {
      CliPrinter.println("Delivered via relay " + result.deliveredVia().orElse("?")
          + " after " + result.attempts().size() + " attempt(s).");
      return ExitCode.SUCCESS;
    }
    CliPrinter.println(new DeliveryFailureReport(result.attempts()).render());
    return ExitCode.DELIVERY_FAILED;
  }

  static void setRootFactoryForTesting(Function<AppConfig, CompositionRoot> factory) {
    rootFactory = Objects.requireNonNull(factory, "factory");
  }

  static void clearRootFactory() {
    rootFactory = DEFAULT_ROOT_FACTORY;
  }
}
