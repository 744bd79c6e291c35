package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.config.CompositionRoot;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Sends a test message through the configured relays to check the mail settings.
 *
 * @since 0.1.0
 */
public final class TestEmailCli {
  private static final String SUMMARY_USAGE = "usage: test-email [config=PATH] [attemptLog=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      DOCWATCH mail configuration check

      Usage:
        test-email [options]

      Options:
        config=PATH       Configuration file (default config.yaml)
        attemptLog=PATH   Append the delivery attempt log as NDJSON
        --verbose         Enable DEBUG logging (includes relay conversation summaries)
        --help            Show this message

      On failure every relay is listed with a classification and a provider-specific hint.
      """;

  static final CommandSupport.CommandDescriptor DESCRIPTOR =
      new CommandSupport.CommandDescriptor("test-email", SUMMARY_USAGE, HELP_TEXT, Set.of("attemptLog"));

  private TestEmailCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return CommandSupport.runConfigured(DESCRIPTOR, args, TestEmailCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> options, CliInput input) {
    Path attemptLog = ConfigCliUtils.removePath(options, "attemptLog").orElse(null);
    DeliveryResult result = root.testEmailUseCase(root.attemptLogWriter(attemptLog)).run();
    return CommandSupport.reportDelivery(result);
  }
}
