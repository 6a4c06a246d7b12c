package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.validation.Numbers;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> File handler settings covering the target path and rotation policy.
 * <p><strong>Why:</strong> A single record drives both size-based and time-based rotation; {@code when} selects
 * the time-based policy.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param enabled whether a file appender is attached
 * @param level minimum level written to the file
 * @param format output format
 * @param filename explicit log file; takes precedence over {@code directory}
 * @param directory directory receiving {@code <logger>.log} when no filename is given
 * @param maxBytes size threshold for size-based rotation; must be positive
 * @param backupCount rotated files kept (size-based) or periods of history kept (time-based)
 * @param when time-based rotation unit ({@code S}, {@code M}, {@code H}, {@code D}, {@code MIDNIGHT},
 *     {@code W0}-{@code W6}); {@code null} selects size-based rotation
 * @param interval rotation interval multiplier for time-based rotation; must be positive
 * @since 0.1.0
 */
public record FileHandlerConfig(
    boolean enabled,
    LogLevel level,
    LogFormat format,
    Path filename,
    Path directory,
    long maxBytes,
    int backupCount,
    String when,
    int interval) {

  /** Default rotation size: 10 MiB. */
  public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
  /** Default number of rotated files kept. */
  public static final int DEFAULT_BACKUP_COUNT = 5;

  private static final Pattern WHEN_PATTERN = Pattern.compile("^(S|M|H|D|MIDNIGHT|W[0-6])$");

  public FileHandlerConfig {
    level = Objects.requireNonNull(level, "level");
    format = Objects.requireNonNull(format, "format");
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("file.maxBytes must be positive (was " + maxBytes + ")");
    }
    Numbers.requireRange("file.backupCount", backupCount, 0, 10_000);
    Numbers.requireRange("file.interval", interval, 1, 10_000);
    when = normalizeWhen(when);
  }

  /**
   * Returns an enabled INFO text handler with 10 MiB x 5 size rotation and no target path.
   *
   * @return default file configuration; a path must still be supplied before use
   */
  public static FileHandlerConfig defaults() {
    return new FileHandlerConfig(
        true, LogLevel.INFO, LogFormat.TEXT, null, null, DEFAULT_MAX_BYTES, DEFAULT_BACKUP_COUNT, null, 1);
  }

  /**
   * Returns the default handler writing into {@code directory}.
   *
   * @param directory log directory
   * @return configuration targeting {@code directory/<logger>.log}
   */
  public static FileHandlerConfig inDirectory(Path directory) {
    return defaults().withDirectory(Objects.requireNonNull(directory, "directory"));
  }

  public FileHandlerConfig withDirectory(Path newDirectory) {
    return new FileHandlerConfig(enabled, level, format, filename, newDirectory, maxBytes, backupCount, when, interval);
  }

  public FileHandlerConfig withFilename(Path newFilename) {
    return new FileHandlerConfig(enabled, level, format, newFilename, directory, maxBytes, backupCount, when, interval);
  }

  public FileHandlerConfig withLevel(LogLevel newLevel) {
    return new FileHandlerConfig(enabled, newLevel, format, filename, directory, maxBytes, backupCount, when, interval);
  }

  public FileHandlerConfig withFormat(LogFormat newFormat) {
    return new FileHandlerConfig(enabled, level, newFormat, filename, directory, maxBytes, backupCount, when, interval);
  }

  public FileHandlerConfig withRotation(long newMaxBytes, int newBackupCount) {
    return new FileHandlerConfig(enabled, level, format, filename, directory, newMaxBytes, newBackupCount, when, interval);
  }

  public FileHandlerConfig withSchedule(String newWhen, int newInterval) {
    return new FileHandlerConfig(enabled, level, format, filename, directory, maxBytes, backupCount, newWhen, newInterval);
  }

  /**
   * Indicates whether rotation is time-based.
   *
   * @return {@code true} when {@code when} is set
   */
  public boolean timeBased() {
    return when != null;
  }

  /**
   * Resolves the file this handler writes to.
   *
   * @param loggerName logger the handler is attached to; names the file when only a directory is configured
   * @return explicit filename, or {@code directory/<loggerName>.log}
   * @throws IllegalArgumentException if neither filename nor directory is configured
   */
  public Path resolveFile(String loggerName) {
    if (filename != null) {
      return filename;
    }
    if (directory != null) {
      return directory.resolve(loggerName + ".log");
    }
    throw new IllegalArgumentException("Either filename or directory must be specified for file handler");
  }

  /**
   * Parses section-relative keys of the {@code file} section.
   *
   * @param kv keys with the {@code file.} prefix removed
   * @param defaultFormat format used when {@code format} is absent
   * @return parsed configuration
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static FileHandlerConfig fromMap(Map<String, String> kv, LogFormat defaultFormat) {
    Objects.requireNonNull(kv, "kv");
    FileHandlerConfig d = defaults();
    String filename = ConfigValues.blankToNull(kv.get("filename"));
    String directory = ConfigValues.blankToNull(kv.get("directory"));
    return new FileHandlerConfig(
        ConfigValues.parseBoolean("file.enabled", kv.get("enabled"), d.enabled()),
        ConfigValues.parseLevel(kv.get("level"), d.level()),
        ConfigValues.parseFormat(kv.get("format"), defaultFormat),
        filename == null ? null : Path.of(filename),
        directory == null ? null : Path.of(directory),
        ConfigValues.parseSize("file.maxBytes", kv.get("maxBytes"), d.maxBytes()),
        ConfigValues.parseInt("file.backupCount", kv.get("backupCount"), d.backupCount()),
        ConfigValues.blankToNull(kv.get("when")),
        ConfigValues.parseInt("file.interval", kv.get("interval"), d.interval()));
  }

  private static String normalizeWhen(String when) {
    if (when == null || when.isBlank()) {
      return null;
    }
    String normalized = when.trim().toUpperCase(Locale.ROOT);
    if (!WHEN_PATTERN.matcher(normalized).matches()) {
      throw new IllegalArgumentException(
          "file.when must be one of S, M, H, D, MIDNIGHT, W0-W6 (was " + when + ")");
    }
    return normalized;
  }
}
