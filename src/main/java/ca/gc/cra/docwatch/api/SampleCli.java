package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.config.AppConfig;
import ca.gc.cra.docwatch.config.ConfigException;
import ca.gc.cra.docwatch.config.ConfigPaths;
import ca.gc.cra.docwatch.config.YamlConfigLoader;
import ca.gc.cra.docwatch.infrastructure.csv.SampleDataWriter;
import ca.gc.cra.docwatch.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a small demonstration roster with dates relative to today.
 *
 * <p>The target is {@code out=PATH}, else the configured {@code data_file} when a configuration file is
 * present, else {@code sample_data/人员证件信息.csv}.</p>
 *
 * @since 0.1.0
 */
public final class SampleCli {
  private static final Logger log = LoggerFactory.getLogger(SampleCli.class);
  private static final String SUMMARY_USAGE = "usage: sample [config=PATH] [out=PATH] [--force]";
  private static final String HELP_TEXT = """
      DOCWATCH sample data

      Usage:
        sample [options]

      Options:
        config=PATH   Configuration file whose data_file is used (default config.yaml, if present)
        out=PATH      Target CSV, overriding data_file
        --force       Replace an existing file
        --verbose     Enable DEBUG logging
        --help        Show this message
      """;

  static final CommandSupport.CommandDescriptor DESCRIPTOR =
      new CommandSupport.CommandDescriptor("sample", SUMMARY_USAGE, HELP_TEXT, Set.of("out"));

  private SampleCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input;
    Map<String, String> options;
    Path target;
    try {
      input = CliInput.parse(args);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      options = CommandSupport.prepareOptions(DESCRIPTOR, input);
      Optional<Path> configPath = ConfigCliUtils.extractConfigPath(options);
      Optional<Path> out = ConfigCliUtils.removePath(options, "out");
      target = Paths.validateOutputFile(out.isPresent() ? out.get() : configuredDataFile(configPath), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (ConfigException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration: {}", ex.getMessage());
      return ExitCode.IO_ERROR;
    }

    if (Files.exists(target) && !input.hasFlag("--force")) {
      log.error("{} already exists; pass --force to replace it", target);
      return ExitCode.INVALID_ARGS;
    }
    try {
      int rows = new SampleDataWriter().write(target, LocalDate.now());
      CliPrinter.println("Sample data written to " + target + " (" + rows + " rows)");
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      return CommandSupport.exitCodeFor(DESCRIPTOR.name(), ex);
    }
  }

  private static Path configuredDataFile(Optional<Path> explicitConfig) throws IOException {
    if (explicitConfig.isPresent()) {
      return YamlConfigLoader.load(explicitConfig.get()).dataFilePath();
    }
    if (Files.isRegularFile(ConfigCliUtils.DEFAULT_CONFIG)) {
      return YamlConfigLoader.load(ConfigCliUtils.DEFAULT_CONFIG).dataFilePath();
    }
    return ConfigPaths.resolve("data_file", AppConfig.DEFAULT_DATA_FILE);
  }
}
