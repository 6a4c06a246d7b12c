package ca.gc.cra.beacon.domain.log;

import java.util.Locale;

/**
 * <strong>What:</strong> Severity levels understood by Beacon sinks, handlers, and configuration.
 * <p><strong>Why:</strong> Gives configuration files and call sites a backend-neutral vocabulary; adapters map each
 * constant onto the active logging framework.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  /** Diagnostic detail. */
  DEBUG,
  /** Normal operational events. */
  INFO,
  /** Unexpected but recoverable situations. */
  WARNING,
  /** Failures of a single operation. */
  ERROR,
  /** Failures that threaten the whole process. */
  CRITICAL;

  /**
   * Parses a level name case-insensitively. {@code WARN} and {@code FATAL} are accepted as aliases.
   *
   * @param value textual level; must not be {@code null}
   * @return matching level
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static LogLevel fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "DEBUG", "TRACE" -> DEBUG;
      case "INFO" -> INFO;
      case "WARNING", "WARN" -> WARNING;
      case "ERROR" -> ERROR;
      case "CRITICAL", "FATAL" -> CRITICAL;
      default -> throw new IllegalArgumentException(
          "level must be one of DEBUG, INFO, WARNING, ERROR, CRITICAL (was " + value + ")");
    };
  }

  /**
   * Returns whether this level is at least as severe as {@code other}.
   *
   * @param other level to compare against
   * @return {@code true} when this level is equal or more severe
   */
  public boolean isAtLeast(LogLevel other) {
    return compareTo(other) >= 0;
  }
}
