package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.config.DefaultConfigTemplate;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the commented configuration template.
 *
 * @since 0.1.0
 */
public final class InitConfigCli {
  private static final Logger log = LoggerFactory.getLogger(InitConfigCli.class);
  private static final String SUMMARY_USAGE = "usage: init-config [out=PATH] [--force]";
  private static final String HELP_TEXT = """
      DOCWATCH configuration template

      Usage:
        init-config [options]

      Options:
        out=PATH    Target file (default config_templates/config_template.yaml)
        --force     Replace an existing file
        --help      Show this message

      Copy the template to config.yaml and fill in the relay credentials and recipients.
      """;

  static final CommandSupport.CommandDescriptor DESCRIPTOR =
      new CommandSupport.CommandDescriptor("init-config", SUMMARY_USAGE, HELP_TEXT, Set.of("out"));

  private InitConfigCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    Path target;
    boolean force;
    try {
      CliInput input = CliInput.parse(args);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      Map<String, String> options = CommandSupport.prepareOptions(DESCRIPTOR, input);
      target = ConfigCliUtils.removePath(options, "out").orElse(DefaultConfigTemplate.DEFAULT_PATH);
      force = input.hasFlag("--force");
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Path written = DefaultConfigTemplate.write(target, force);
      CliPrinter.printLines(
          "Configuration template written to " + written,
          "Copy it to config.yaml and edit the relay and recipient settings.");
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("{}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      return CommandSupport.exitCodeFor(DESCRIPTOR.name(), ex);
    }
  }
}
