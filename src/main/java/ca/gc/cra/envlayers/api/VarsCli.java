package ca.gc.cra.envlayers.api;

import ca.gc.cra.envlayers.config.ChainAssembler;
import ca.gc.cra.envlayers.config.FieldDefinition;
import ca.gc.cra.envlayers.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the environment variables read by each layer together with their reload defaults.
 */
public final class VarsCli {
  private static final Logger log = LoggerFactory.getLogger(VarsCli.class);
  private static final String ROW_FORMAT = "%-12s %-10s %-18s %s";
  private static final String SUMMARY_USAGE = "usage: vars [--verbose] [--help]";

  private VarsCli() {}

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE + "\n\nLists ADDRESS, PORT, DB_ADDRESS, DB_PORT and MOTD with their defaults.");
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown flags: {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (!input.keyValueArgs().isEmpty()) {
      log.error("vars takes no key=value options: {}", input.keyValueArgs());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    CliPrinter.printLines(rows());
    return ExitCode.SUCCESS;
  }

  static List<String> rows() {
    List<String> rows = new ArrayList<>();
    rows.add(String.format(ROW_FORMAT, "VARIABLE", "LAYER", "DEFAULT", "REQUIRABLE"));
    for (Map.Entry<String, List<FieldDefinition>> layer : ChainAssembler.fieldsByLayer().entrySet()) {
      for (FieldDefinition field : layer.getValue()) {
        rows.add(String.format(ROW_FORMAT,
            field.variable(), layer.getKey(), field.defaultValue(), field.strictCapable() ? "yes" : "no"));
      }
    }
    return rows;
  }
}
