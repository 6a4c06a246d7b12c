package ca.gc.cra.beacon.infrastructure.logging;

import java.util.Map;

/**
 * {@link TextLayout} with the level name wrapped in ANSI color escapes for terminals.
 *
 * @since 0.1.0
 */
public class ColoredTextLayout extends TextLayout {
  static final String RESET = "\u001B[0m";

  private static final Map<String, String> COLORS = Map.of(
      "DEBUG", "\u001B[36m",
      "INFO", "\u001B[32m",
      "WARNING", "\u001B[33m",
      "ERROR", "\u001B[31m",
      "CRITICAL", "\u001B[35m");

  @Override
  protected String renderLevel(String levelName) {
    String color = COLORS.get(levelName);
    return color == null ? levelName : color + levelName + RESET;
  }
}
