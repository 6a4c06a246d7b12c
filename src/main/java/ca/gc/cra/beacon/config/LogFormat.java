package ca.gc.cra.beacon.config;

import java.util.Locale;

/**
 * Output formats supported by Beacon handlers.
 *
 * @since 0.1.0
 */
public enum LogFormat {
  /** Human-readable single line with a bracketed context suffix. */
  TEXT,
  /** One JSON object per line with attributes nested under {@code extra} (or flattened). */
  JSON,
  /** One JSON object per line in the fixed structured-entry shape. */
  STRUCTURED;

  /**
   * Parses a format name case-insensitively.
   *
   * @param value textual format; must not be {@code null}
   * @return matching format
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static LogFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("format must not be blank");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "text", "plain" -> TEXT;
      case "json" -> JSON;
      case "structured" -> STRUCTURED;
      default -> throw new IllegalArgumentException(
          "format must be one of text, json, structured (was " + value + ")");
    };
  }
}
