package ca.gc.cra.beacon.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into the global flags and the remaining tokens.
 *
 * @param arguments command and {@code key=value} tokens in their original order
 * @param help {@code true} when {@code --help}, {@code -h} or {@code help} was given
 * @param verbose {@code true} when {@code --verbose}, {@code -v} or {@code --debug} was given
 * @since 0.1.0
 */
record CliInput(List<String> arguments, boolean help, boolean verbose) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  CliInput {
    arguments = List.copyOf(arguments);
  }

  /**
   * Parses raw arguments. Blank and {@code null} tokens are skipped.
   *
   * @param args raw CLI arguments; may be {@code null}
   * @return parsed input
   */
  static CliInput parse(String[] args) {
    List<String> remaining = new ArrayList<>();
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
        } else {
          remaining.add(arg);
        }
      }
    }
    return new CliInput(remaining, help, verbose);
  }

  /**
   * Returns the arguments after the first (the command).
   *
   * @return command arguments; empty when no command was given
   */
  String[] commandArguments() {
    return arguments.isEmpty() ? new String[0] : arguments.subList(1, arguments.size()).toArray(String[]::new);
  }

  /**
   * Returns the command token in lower case.
   *
   * @return command, or {@code null} when none was given
   */
  String command() {
    return arguments.isEmpty() ? null : arguments.get(0).toLowerCase(Locale.ROOT);
  }
}
