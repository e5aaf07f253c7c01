package ca.gc.cra.envlayers.api;

import ca.gc.cra.envlayers.config.ChainAssembler;
import ca.gc.cra.envlayers.config.ConfigSnapshot;
import ca.gc.cra.envlayers.config.ConfigurationLayer;
import ca.gc.cra.envlayers.config.EnvironmentLookup;
import ca.gc.cra.envlayers.config.MissingRequiredValueException;
import ca.gc.cra.envlayers.config.SeedDefaults;
import ca.gc.cra.envlayers.logging.LoggingConfigurator;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a configuration chain, reloads it from the environment and prints the result.
 */
public final class ShowCli {
  private static final Logger log = LoggerFactory.getLogger(ShowCli.class);
  private static final String SUMMARY_USAGE =
      "usage: show [layers=database,motd] [policy=defaults|strict] [strict=VAR,...] "
          + "[address=URL] [port=N] [dbAddress=URL] [dbPort=N] [motd=TEXT] [format=text|json]";
  private static final String HELP_TEXT = """
      envlayers show

      Usage:
        show [options]

      Chain:
        layers=LIST           Decorators wrapped around the base layer, innermost first (default database,motd)
        policy=defaults|strict
                              Handling of unset or empty variables (default defaults)
        strict=VAR,...        Variables that are required regardless of policy (MOTD is never required)

      Seeds (values held before the first reload):
        address=URL           Base address (default http://webapp)
        port=N                Base port (default 8080)
        dbAddress=URL         Database address (default http://mongodb)
        dbPort=N              Database port (default 27017)
        motd=TEXT             Message of the day (default Hello, World!)

      Output:
        format=text|json      Output format (default text)
        --verbose             Enable DEBUG logging
        --help                Show this message

      Environment:
        ADDRESS, PORT, DB_ADDRESS, DB_PORT, MOTD (run 'vars' for defaults)
      """;

  private ShowCli() {}

  /**
   * Runs the command against the process environment.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, EnvironmentLookup.system());
  }

  /**
   * Runs the command against {@code environment}.
   *
   * @param args raw CLI arguments
   * @param environment variable source for the reload
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args, EnvironmentLookup environment) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for show");
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown flags: {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ConfigurationLayer chain;
    SnapshotRenderer.Format format;
    try {
      Map<String, String> overrides = CliArgsParser.toMap(input.keyValueArray());
      Map<String, String> seeds = ChainAssembler.effectiveSeeds(overrides, log::warn);
      format = SnapshotRenderer.Format.fromString(seeds.get(SeedDefaults.FORMAT));
      chain = ChainAssembler.assemble(seeds, environment);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid show configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      chain.reload();
    } catch (MissingRequiredValueException ex) {
      log.error("Configuration reload failed: {}", ex.getMessage());
      CliPrinter.println("error: " + ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try {
      List<String> lines = SnapshotRenderer.render(ConfigSnapshot.of(chain), format);
      CliPrinter.printLines(lines);
      return ExitCode.SUCCESS;
    } catch (UncheckedIOException ex) {
      log.error("Failed to render configuration", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
