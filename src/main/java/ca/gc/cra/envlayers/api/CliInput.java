package ca.gc.cra.envlayers.api;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into recognised flags, unknown flags and {@code key=value} tokens.
 *
 * @param keyValueArgs tokens that are not flags, in input order
 * @param help {@code true} when {@code --help}, {@code -h} or {@code help} was present
 * @param verbose {@code true} when {@code --verbose}, {@code -v} or {@code --debug} was present
 * @param unknownFlags other dash-prefixed tokens, lower-cased
 */
public record CliInput(List<String> keyValueArgs, boolean help, boolean verbose, Set<String> unknownFlags) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  public CliInput {
    keyValueArgs = List.copyOf(keyValueArgs);
    unknownFlags = Set.copyOf(unknownFlags);
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    Set<String> unknown = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        if (raw == null || raw.isBlank()) {
          continue;
        }
        String arg = raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          help = true;
        } else if (VERBOSE_FLAGS.contains(lower)) {
          verbose = true;
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          unknown.add(lower);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, help, verbose, unknown);
  }

  /**
   * Returns the {@code key=value} tokens as an array for {@link CliArgsParser}.
   *
   * @return new array of tokens
   */
  public String[] keyValueArray() {
    return keyValueArgs.toArray(String[]::new);
  }
}
