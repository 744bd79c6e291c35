package ca.gc.cra.docwatch.api;

import ca.gc.cra.docwatch.application.pipeline.ScheduledRunUseCase;
import ca.gc.cra.docwatch.application.pipeline.ScheduledRunUseCase.Mode;
import ca.gc.cra.docwatch.application.pipeline.ScheduledRunUseCase.Status;
import ca.gc.cra.docwatch.config.CompositionRoot;
import ca.gc.cra.docwatch.logging.LoggingConfigurator;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for external schedulers: runs the reminder job and records the last successful run.
 *
 * @since 0.1.0
 */
public final class ScheduleCli {
  private static final Logger log = LoggerFactory.getLogger(ScheduleCli.class);

  static final Path SCHEDULER_LOG = Path.of("logs", "scheduled_runner.log");
  static final long SCHEDULER_LOG_MAX_BYTES = 1024L * 1024L;

  private static final String SUMMARY_USAGE =
      "usage: schedule mode=run|catchup [config=PATH] [state=PATH] [attemptLog=PATH] [log=PATH]";
  private static final String HELP_TEXT = """
      DOCWATCH scheduled run

      Usage:
        schedule mode=run|catchup [options]

      Modes:
        run        Run the reminder job and record the completion time on success
        catchup    Run only when no success is recorded or the last one is older than yesterday

      Options:
        config=PATH       Configuration file (default config.yaml)
        state=PATH        Last-success file (default logs/last_success_iso.txt)
        attemptLog=PATH   Append the delivery attempt log as NDJSON
        log=PATH          Rolling scheduler log (default logs/scheduled_runner.log, 1 MB per file)
        --verbose         Enable DEBUG logging
        --help            Show this message
      """;

  static final CommandSupport.CommandDescriptor DESCRIPTOR = new CommandSupport.CommandDescriptor(
      "schedule", SUMMARY_USAGE, HELP_TEXT, Set.of("mode", "state", "attemptLog", "log"));

  private ScheduleCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return CommandSupport.runConfigured(DESCRIPTOR, args, ScheduleCli::execute);
  }

  private static ExitCode execute(CompositionRoot root, Map<String, String> options, CliInput input)
      throws Exception {
    Mode mode;
    try {
      mode = Mode.fromString(options.remove("mode"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path schedulerLog = ConfigCliUtils.removePath(options, "log").orElse(SCHEDULER_LOG);
    LoggingConfigurator.attachRollingFileAppender(schedulerLog, SCHEDULER_LOG_MAX_BYTES);

    Path state = ConfigCliUtils.removePath(options, "state").orElse(null);
    Path attemptLog = ConfigCliUtils.removePath(options, "attemptLog").orElse(null);
    ScheduledRunUseCase useCase = root.scheduledRunUseCase(state, root.attemptLogWriter(attemptLog));
    Status status = useCase.run(mode);
    CliPrinter.println("Scheduled " + mode.name().toLowerCase(Locale.ROOT) + ": " + status);
    return status == Status.FAILED ? ExitCode.DELIVERY_FAILED : ExitCode.SUCCESS;
  }
}
