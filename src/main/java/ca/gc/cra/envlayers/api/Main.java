package ca.gc.cra.envlayers.api;

import ca.gc.cra.envlayers.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * envlayers CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: envlayers <show|vars> [options]";
  private static final String HELP_TEXT = """
      envlayers command dispatcher

      Usage:
        envlayers <command> [options]

      Commands:
        show        Reload the configuration chain from the environment and print it
        vars        List the environment variables each layer reads

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
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

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = safeArgs[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, 1, safeArgs.length);

    return switch (command) {
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      case "--verbose", "-v" -> {
        LoggingConfigurator.enableVerboseLogging();
        yield run(delegateArgs);
      }
      case "show" -> ShowCli.run(delegateArgs);
      case "vars" -> VarsCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
