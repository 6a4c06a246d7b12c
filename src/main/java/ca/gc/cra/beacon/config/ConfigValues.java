package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.log.LogLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsing helpers shared by the configuration records' {@code fromMap} factories.
 */
final class ConfigValues {

  private ConfigValues() {}

  /**
   * Extracts the entries under {@code prefix.} with the prefix removed.
   */
  static Map<String, String> section(Map<String, String> kv, String prefix) {
    String dotted = prefix + '.';
    Map<String, String> section = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : kv.entrySet()) {
      String key = entry.getKey();
      if (key != null && key.startsWith(dotted) && key.length() > dotted.length()) {
        section.put(key.substring(dotted.length()), entry.getValue());
      }
    }
    return section;
  }

  static boolean parseBoolean(String key, String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was " + value + ")");
    };
  }

  static int parseInt(String key, String value, int fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + value + ")", ex);
    }
  }

  static long parseSize(String key, String value, long fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT).replace("_", "");
    long multiplier = 1L;
    if (normalized.endsWith("KB") || normalized.endsWith("KIB")) {
      multiplier = 1_024L;
    } else if (normalized.endsWith("MB") || normalized.endsWith("MIB")) {
      multiplier = 1_024L * 1_024L;
    } else if (normalized.endsWith("GB") || normalized.endsWith("GIB")) {
      multiplier = 1_024L * 1_024L * 1_024L;
    }
    String digits = normalized.replaceAll("[A-Z]+$", "").trim();
    try {
      return Math.multiplyExact(Long.parseLong(digits), multiplier);
    } catch (NumberFormatException | ArithmeticException ex) {
      throw new IllegalArgumentException(key + " must be a byte size such as 10485760 or 10MB (was " + value + ")", ex);
    }
  }

  static double parseDouble(String key, String value, double fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + value + ")", ex);
    }
  }

  static LogLevel parseLevel(String value, LogLevel fallback) {
    return value == null || value.isBlank() ? fallback : LogLevel.fromString(value);
  }

  static LogFormat parseFormat(String value, LogFormat fallback) {
    return value == null || value.isBlank() ? fallback : LogFormat.fromString(value);
  }

  static List<String> parseList(String value, List<String> fallback) {
    if (value == null) {
      return fallback;
    }
    String trimmed = value.trim();
    if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    List<String> items = new ArrayList<>();
    for (String token : trimmed.split(",")) {
      String item = token.trim();
      if (!item.isEmpty()) {
        items.add(item);
      }
    }
    return List.copyOf(items);
  }

  static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
