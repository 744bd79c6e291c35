package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.application.pipeline.ReminderOutcome;
import ca.gc.cra.docwatch.application.reminder.ReminderSummary;
import ca.gc.cra.docwatch.config.CompositionRoot;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Runs the reminder job once: classify the roster and mail the due documents.
 *
 * @since 0.1.0
 */
public final class RemindCli {
  private static final String SUMMARY_USAGE = "usage: remind [config=PATH] [attemptLog=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      DOCWATCH reminder run

      Usage:
        remind [options]

      Options:
        config=PATH            Configuration file (default config.yaml)
        attemptLog=PATH        Append the delivery attempt log as NDJSON
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL       OTLP endpoint when metricsExporter=otlp
        --verbose              Enable DEBUG logging
        --help                 Show this message

      Exit codes:
        0 sent or nothing to send, 4 configuration error, 6 invalid roster data,
        7 template error, 8 every relay failed
      """;

  static final CommandSupport.CommandDescriptor DESCRIPTOR =
      new CommandSupport.CommandDescriptor("remind", SUMMARY_USAGE, HELP_TEXT, Set.of("attemptLog"));

  private RemindCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return CommandSupport.runConfigured(DESCRIPTOR, args, RemindCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> options, CliInput input)
      throws Exception {
    Path attemptLog = ConfigCliUtils.removePath(options, "attemptLog").orElse(null);
    ReminderOutcome outcome = root.reminderUseCase(root.attemptLogWriter(attemptLog)).run();
    ReminderSummary summary = outcome.summary();
    CliPrinter.printLines(
        "Documents checked : " + outcome.documentCount(),
        "Reminders due     : " + summary.total()
            + " (expired " + summary.expiredCount() + ", expiring " + summary.expiringCount() + ")");
    if (outcome.delivery().isEmpty()) {
      CliPrinter.println("Nothing to send.");
      return ExitCode.SUCCESS;
    }
    return CommandSupport.reportDelivery(outcome.delivery().get());
  }
}
