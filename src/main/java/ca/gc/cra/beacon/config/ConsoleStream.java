package ca.gc.cra.beacon.config;

import java.util.Locale;

/**
 * Standard stream targeted by a console handler.
 *
 * @since 0.1.0
 */
public enum ConsoleStream {
  /** Process standard output. */
  STDOUT,
  /** Process standard error. */
  STDERR;

  /**
   * Parses a stream name case-insensitively.
   *
   * @param value {@code stdout} or {@code stderr}
   * @return matching stream
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static ConsoleStream fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("console.stream must not be blank");
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "stdout", "out", "system.out" -> STDOUT;
      case "stderr", "err", "system.err" -> STDERR;
      default -> throw new IllegalArgumentException("console.stream must be stdout or stderr (was " + value + ")");
    };
  }
}
