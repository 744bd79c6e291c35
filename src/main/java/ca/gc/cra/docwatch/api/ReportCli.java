package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.application.pipeline.ReportOutcome;
import ca.gc.cra.docwatch.config.CompositionRoot;
import ca.gc.cra.docwatch.domain.document.DocumentStatus;
import ca.gc.cra.docwatch.validation.Paths;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes the CSV status report for every document in the roster.
 *
 * @since 0.1.0
 */
public final class ReportCli {
  private static final String SUMMARY_USAGE = "usage: report [config=PATH] [out=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      DOCWATCH status report

      Usage:
        report [options]

      Options:
        config=PATH   Configuration file (default config.yaml)
        out=PATH      Report file (default report.output_filename with {date} expanded)
        --verbose     Enable DEBUG logging
        --help        Show this message
      """;

  static final CommandSupport.CommandDescriptor DESCRIPTOR =
      new CommandSupport.CommandDescriptor("report", SUMMARY_USAGE, HELP_TEXT, Set.of("out"));

  private ReportCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return CommandSupport.runConfigured(DESCRIPTOR, args, ReportCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> options, CliInput input)
      throws Exception {
    Optional<Path> out = ConfigCliUtils.removePath(options, "out");
    ReportOutcome outcome = root.reportUseCase().run(today -> Paths.validateOutputFile(
        out.orElseGet(() -> root.config().report().fileFor(today)), true));
    CliPrinter.printLines(
        "Report written    : " + outcome.file(),
        "Rows              : " + outcome.rowCount(),
        "Expired           : " + outcome.statusCounts().getOrDefault(DocumentStatus.EXPIRED, 0),
        "Expiring soon     : " + outcome.statusCounts().getOrDefault(DocumentStatus.EXPIRING_SOON, 0),
        "Needing reminder  : " + outcome.reminderCount());
    return ExitCode.SUCCESS;
  }
}
