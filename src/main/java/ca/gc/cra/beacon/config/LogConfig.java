package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Root logging configuration aggregating handler, performance, request and training
 * settings.
 * <p><strong>Why:</strong> One immutable value describes how a logger is wired so YAML, environment and
 * programmatic sources can be merged before any appender is created.</p>
 * <p><strong>Role:</strong> Input to {@code LoggingConfigurator}, {@code LoggerRegistry} and
 * {@code BeaconRuntime}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to publish across threads.</p>
 *
 * @param level logger level
 * @param format default output format for handlers that do not set one
 * @param name logger name; {@code null} means the default name {@value #DEFAULT_NAME}
 * @param console console handler settings
 * @param file file handler settings; {@code null} when no file handler is configured
 * @param performance performance tracker settings
 * @param request request logging settings
 * @param training training logging settings
 * @param propagate whether events also reach ancestor loggers (Logback additivity)
 * @param flattenJson whether JSON output writes attributes at the top level instead of under {@code extra}
 * @since 0.1.0
 */
public record LogConfig(
    LogLevel level,
    LogFormat format,
    String name,
    ConsoleHandlerConfig console,
    FileHandlerConfig file,
    PerformanceConfig performance,
    RequestLoggingConfig request,
    TrainingLoggingConfig training,
    boolean propagate,
    boolean flattenJson) {

  /** Logger name used when none is configured. */
  public static final String DEFAULT_NAME = "beacon";

  public LogConfig {
    level = Objects.requireNonNull(level, "level");
    format = Objects.requireNonNull(format, "format");
    if (name != null) {
      name = name.isBlank() ? null : Strings.requireLoggerName("name", name);
    }
    console = Objects.requireNonNull(console, "console");
    performance = Objects.requireNonNull(performance, "performance");
    request = Objects.requireNonNull(request, "request");
    training = Objects.requireNonNull(training, "training");
  }

  /**
   * Returns the default configuration: INFO, text, console on stdout, no file handler, default sections.
   *
   * @return default configuration
   */
  public static LogConfig defaults() {
    return new LogConfig(
        LogLevel.INFO,
        LogFormat.TEXT,
        null,
        ConsoleHandlerConfig.defaults(),
        null,
        PerformanceConfig.defaults(),
        RequestLoggingConfig.defaults(),
        TrainingLoggingConfig.defaults(),
        false,
        false);
  }

  /**
   * Returns the configured logger name or {@value #DEFAULT_NAME}.
   *
   * @return effective logger name
   */
  public String effectiveName() {
    return name == null ? DEFAULT_NAME : name;
  }

  /**
   * Returns the file handler settings when present and enabled.
   *
   * @return file settings, or empty
   */
  public Optional<FileHandlerConfig> fileHandler() {
    return file != null && file.enabled() ? Optional.of(file) : Optional.empty();
  }

  public LogConfig withLevel(LogLevel newLevel) {
    return new LogConfig(newLevel, format, name, console, file, performance, request, training, propagate, flattenJson);
  }

  /**
   * Returns a copy with a new default format, also applied to the console handler and any file handler.
   *
   * @param newFormat output format
   * @return updated configuration
   */
  public LogConfig withFormat(LogFormat newFormat) {
    FileHandlerConfig newFile = file == null ? null : file.withFormat(newFormat);
    return new LogConfig(level, newFormat, name, console.withFormat(newFormat), newFile, performance, request,
        training, propagate, flattenJson);
  }

  public LogConfig withName(String newName) {
    return new LogConfig(level, format, newName, console, file, performance, request, training, propagate, flattenJson);
  }

  public LogConfig withConsole(ConsoleHandlerConfig newConsole) {
    return new LogConfig(level, format, name, newConsole, file, performance, request, training, propagate, flattenJson);
  }

  public LogConfig withFile(FileHandlerConfig newFile) {
    return new LogConfig(level, format, name, console, newFile, performance, request, training, propagate, flattenJson);
  }

  public LogConfig withPerformance(PerformanceConfig newPerformance) {
    return new LogConfig(level, format, name, console, file, newPerformance, request, training, propagate, flattenJson);
  }

  public LogConfig withRequest(RequestLoggingConfig newRequest) {
    return new LogConfig(level, format, name, console, file, performance, newRequest, training, propagate, flattenJson);
  }

  public LogConfig withTraining(TrainingLoggingConfig newTraining) {
    return new LogConfig(level, format, name, console, file, performance, request, newTraining, propagate, flattenJson);
  }

  public LogConfig withPropagate(boolean newPropagate) {
    return new LogConfig(level, format, name, console, file, performance, request, training, newPropagate, flattenJson);
  }

  /**
   * Builds a configuration from flat dotted keys.
   *
   * <p>Recognized top-level keys are {@code level}, {@code format}, {@code name}, {@code propagate},
   * {@code flattenJson} and {@code logDir}. Section keys use the prefixes {@code console.}, {@code file.},
   * {@code performance.}, {@code request.} and {@code training.}. A file handler is configured when any
   * {@code file.} key or {@code logDir} is present; {@code logDir} fills {@code file.directory} when that key is
   * absent. Handler sections inherit the top-level {@code format} unless they set their own.</p>
   *
   * @param kv flat configuration map; must not be {@code null}
   * @return parsed configuration
   * @throws IllegalArgumentException if any value fails validation
   */
  public static LogConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    LogConfig d = defaults();
    LogFormat format = ConfigValues.parseFormat(kv.get("format"), d.format());

    Map<String, String> fileSection = ConfigValues.section(kv, "file");
    String logDir = ConfigValues.blankToNull(kv.get("logDir"));
    if (logDir != null) {
      fileSection.putIfAbsent("directory", logDir);
    }
    FileHandlerConfig file = fileSection.isEmpty() ? null : FileHandlerConfig.fromMap(fileSection, format);

    return new LogConfig(
        ConfigValues.parseLevel(kv.get("level"), d.level()),
        format,
        ConfigValues.blankToNull(kv.get("name")),
        ConsoleHandlerConfig.fromMap(ConfigValues.section(kv, "console"), format),
        file,
        PerformanceConfig.fromMap(ConfigValues.section(kv, "performance")),
        RequestLoggingConfig.fromMap(ConfigValues.section(kv, "request")),
        TrainingLoggingConfig.fromMap(ConfigValues.section(kv, "training")),
        ConfigValues.parseBoolean("propagate", kv.get("propagate"), d.propagate()),
        ConfigValues.parseBoolean("flattenJson", kv.get("flattenJson"), d.flattenJson()));
  }

  /**
   * Returns the default configuration with a file handler in {@code logDir}.
   *
   * @param logDir directory for {@code <name>.log}
   * @return configuration writing to {@code logDir}
   */
  public static LogConfig forLogDir(Path logDir) {
    return defaults().withFile(FileHandlerConfig.inDirectory(logDir));
  }
}
