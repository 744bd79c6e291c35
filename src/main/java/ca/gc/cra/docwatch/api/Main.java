package ca.gc.cra.docwatch.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DOCWATCH CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE =
      "usage: docwatch <remind|report|test-email|sample|init-config|schedule> [options]";
  private static final String HELP_TEXT = """
      DOCWATCH document expiry reminders

      Usage:
        docwatch <command> [key=value ...] [--verbose] [--help]

      Commands:
        remind       Classify the roster and mail documents that are due (default daily job)
        report       Write the CSV status report
        test-email   Send a test message through the configured relays
        sample       Write a demonstration roster
        init-config  Write a commented configuration template
        schedule     Scheduler entry point (mode=run|catchup)

      Global flags:
        --help      Show this message, or a command's options after the command name
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first bare word is the command
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    List<String> rest = new ArrayList<>();
    String command = null;
    boolean help = false;
    if (args != null) {
      for (String arg : args) {
        if (arg == null || arg.isBlank()) {
          continue;
        }
        boolean bareWord = !arg.startsWith("-") && arg.indexOf('=') < 0 && !CliInput.isHelpFlag(arg);
        if (command == null && bareWord) {
          command = arg.trim().toLowerCase(Locale.ROOT);
        } else {
          help |= command == null && CliInput.isHelpFlag(arg);
          rest.add(arg);
        }
      }
    }
    if (command == null) {
      if (help) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] delegateArgs = rest.toArray(String[]::new);
    return switch (command) {
      case "remind" -> RemindCli.run(delegateArgs);
      case "report" -> ReportCli.run(delegateArgs);
      case "test-email" -> TestEmailCli.run(delegateArgs);
      case "sample" -> SampleCli.run(delegateArgs);
      case "init-config" -> InitConfigCli.run(delegateArgs);
      case "schedule" -> ScheduleCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
