package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.log.LogLevel;
import java.util.Map;
import java.util.Objects;

/**
 * Console handler settings.
 *
 * @param enabled whether a console appender is attached
 * @param level minimum level written to the console
 * @param format output format
 * @param stream target standard stream
 * @param colored whether text output colors the level with ANSI escapes (ignored for JSON formats)
 * @since 0.1.0
 */
public record ConsoleHandlerConfig(
    boolean enabled, LogLevel level, LogFormat format, ConsoleStream stream, boolean colored) {

  public ConsoleHandlerConfig {
    level = Objects.requireNonNull(level, "level");
    format = Objects.requireNonNull(format, "format");
    stream = Objects.requireNonNull(stream, "stream");
  }

  /**
   * Returns an enabled INFO text handler on standard output without colors.
   *
   * @return default console configuration
   */
  public static ConsoleHandlerConfig defaults() {
    return new ConsoleHandlerConfig(true, LogLevel.INFO, LogFormat.TEXT, ConsoleStream.STDOUT, false);
  }

  public ConsoleHandlerConfig withLevel(LogLevel newLevel) {
    return new ConsoleHandlerConfig(enabled, newLevel, format, stream, colored);
  }

  public ConsoleHandlerConfig withFormat(LogFormat newFormat) {
    return new ConsoleHandlerConfig(enabled, level, newFormat, stream, colored);
  }

  public ConsoleHandlerConfig withColored(boolean newColored) {
    return new ConsoleHandlerConfig(enabled, level, format, stream, newColored);
  }

  /**
   * Parses section-relative keys ({@code enabled}, {@code level}, {@code format}, {@code stream}, {@code colored}).
   *
   * @param kv keys of the {@code console} section
   * @param defaultFormat format used when {@code format} is absent
   * @return parsed configuration
   */
  public static ConsoleHandlerConfig fromMap(Map<String, String> kv, LogFormat defaultFormat) {
    Objects.requireNonNull(kv, "kv");
    ConsoleHandlerConfig d = defaults();
    String stream = kv.get("stream");
    return new ConsoleHandlerConfig(
        ConfigValues.parseBoolean("console.enabled", kv.get("enabled"), d.enabled()),
        ConfigValues.parseLevel(kv.get("level"), d.level()),
        ConfigValues.parseFormat(kv.get("format"), defaultFormat),
        stream == null || stream.isBlank() ? d.stream() : ConsoleStream.fromString(stream),
        ConfigValues.parseBoolean("console.colored", kv.get("colored"), d.colored()));
  }
}
