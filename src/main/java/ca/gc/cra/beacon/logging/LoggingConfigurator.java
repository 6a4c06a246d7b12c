package ca.gc.cra.beacon.logging;

import ca.gc.cra.beacon.config.BeaconRuntime;
import ca.gc.cra.beacon.config.ConfigMerger;
import ca.gc.cra.beacon.config.ConsoleHandlerConfig;
import ca.gc.cra.beacon.config.EnvironmentConfigLoader;
import ca.gc.cra.beacon.config.FileHandlerConfig;
import ca.gc.cra.beacon.config.LogConfig;
import ca.gc.cra.beacon.config.LogFormat;
import ca.gc.cra.beacon.config.PerformanceConfig;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.infrastructure.logging.HandlerFactory;
import ca.gc.cra.beacon.infrastructure.logging.LevelMapping;
import ca.gc.cra.beacon.validation.Paths;
import ca.gc.cra.beacon.validation.Strings;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures Beacon loggers and root-level log layouts on the Logback backend.
 * <p><strong>Why:</strong> Applications describe logging once as a {@link LogConfig} (or a preset) and get console,
 * rotating file and dedicated error/performance/request handlers without writing Logback XML.</p>
 * <p><strong>Role:</strong> Adapter-side entry point used by applications, {@link LoggerRegistry} and the CLI.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Replace a logger's appenders with the handlers a configuration describes.</li>
 *   <li>Install root-level rotation, aggregation, development and production presets.</li>
 *   <li>Raise the root level to DEBUG on request (CLI {@code --verbose}).</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for application startup; concurrent reconfiguration of the same
 * logger may interleave appender changes.</p>
 * <p><strong>Observability:</strong> Logs each reconfiguration at DEBUG.</p>
 *
 * @implNote Requires Logback as the SLF4J backend. Previously attached appenders are stopped before new ones are
 *     attached, so file handles are released.
 * @since 0.1.0
 * @see HandlerFactory
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger receiving performance threshold emissions. */
  public static final String PERFORMANCE_LOGGER = BeaconRuntime.PERFORMANCE_LOGGER;
  /** Logger receiving request entries. */
  public static final String REQUEST_LOGGER = BeaconRuntime.REQUEST_LOGGER;
  /** Logger receiving training and model events. */
  public static final String TRAINING_LOGGER = BeaconRuntime.TRAINING_LOGGER;

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * <p>Logs a warning naming the SLF4J backend when it does not support dynamic level updates.</p>
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  /**
   * Returns a logger by name.
   *
   * @param name logger name; {@code null} or blank returns the root logger
   * @return SLF4J logger
   */
  public static org.slf4j.Logger getLogger(String name) {
    if (name == null || name.isBlank()) {
      return LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
    }
    return LoggerFactory.getLogger(name);
  }

  /**
   * Sets up a logger with console output and, when {@code logDir} is given, a rotating
   * {@code <logDir>/<name>.log} file.
   *
   * @param name logger name
   * @param logDir log directory; {@code null} for console only
   * @param debug DEBUG level when {@code true}, INFO otherwise
   * @return configured logger
   * @throws IllegalArgumentException if the name is invalid or the directory cannot be prepared
   */
  public static org.slf4j.Logger setupLogger(String name, Path logDir, boolean debug) {
    LogConfig config = LogConfig.defaults().withLevel(debug ? LogLevel.DEBUG : LogLevel.INFO);
    if (logDir != null) {
      config = config.withFile(FileHandlerConfig.inDirectory(logDir));
    }
    return setupLogger(name, config);
  }

  /**
   * Sets up a logger from a configuration, replacing (and stopping) any appenders already attached to it.
   *
   * @param name logger name
   * @param config logging configuration
   * @return configured logger
   * @throws IllegalArgumentException if the name is invalid or a file handler cannot be created
   */
  public static org.slf4j.Logger setupLogger(String name, LogConfig config) {
    String loggerName = Strings.requireLoggerName("name", name);
    Objects.requireNonNull(config, "config");
    HandlerFactory factory = HandlerFactory.forCurrentContext();
    Logger logger = factory.context().getLogger(loggerName);
    apply(logger, config, factory);
    return logger;
  }

  /**
   * Sets up the logger named by {@code config.name()}, or {@value LogConfig#DEFAULT_NAME}.
   *
   * @param config logging configuration
   * @return configured logger
   */
  public static org.slf4j.Logger setupLogging(LogConfig config) {
    Objects.requireNonNull(config, "config");
    return setupLogger(config.effectiveName(), config);
  }

  /**
   * Sets up logging from flat dotted keys, as produced by the YAML loader.
   *
   * @param kv configuration map
   * @return configured logger
   * @throws IllegalArgumentException when a value fails validation
   */
  public static org.slf4j.Logger setupLoggingFromMap(Map<String, String> kv) {
    return setupLogging(LogConfig.fromMap(kv));
  }

  /**
   * Sets up logging from {@code BEACON_LOG_LEVEL}, {@code BEACON_LOG_FORMAT}, {@code BEACON_LOG_NAME} and
   * {@code BEACON_LOG_DIR}.
   *
   * @return configured logger
   */
  public static org.slf4j.Logger setupLoggingFromEnv() {
    return setupLoggingFromEnv(System.getenv());
  }

  /**
   * Sets up logging from the given environment view.
   *
   * @param env environment variables
   * @return configured logger
   */
  public static org.slf4j.Logger setupLoggingFromEnv(Map<String, String> env) {
    Map<String, String> flat = EnvironmentConfigLoader.load(env);
    return setupLogging(ConfigMerger.resolve(Optional.empty(), flat, Map.of()));
  }

  /**
   * Replaces the root handlers with console output at INFO and {@code <logDir>/app.log} at DEBUG.
   *
   * @param logDir log directory, created when missing
   * @param maxBytes size threshold for size-based rotation
   * @param backupCount rotated files (or periods) kept
   * @param when time-based rotation unit, or {@code null} for size-based rotation
   * @param interval time-based rotation interval
   */
  public static void setupLogRotation(Path logDir, long maxBytes, int backupCount, String when, int interval) {
    Path dir = Paths.ensureWritableDir(logDir);
    FileHandlerConfig file = FileHandlerConfig.defaults()
        .withFilename(dir.resolve(HandlerFactory.APP_FILE))
        .withLevel(LogLevel.DEBUG)
        .withRotation(maxBytes, backupCount)
        .withSchedule(when, interval);

    HandlerFactory factory = HandlerFactory.forCurrentContext();
    Logger root = rootLogger(factory);
    root.detachAndStopAllAppenders();
    root.addAppender(factory.consoleAppender("root.console", ConsoleHandlerConfig.defaults(), false));
    root.addAppender(factory.fileAppender("root.file", file.resolveFile("app"), file, false));
    root.setLevel(Level.DEBUG);
    log.debug("Root log rotation configured in {}", dir);
  }

  /**
   * Size-based {@link #setupLogRotation(Path, long, int, String, int)} with 10 MiB x 5 files.
   *
   * @param logDir log directory
   */
  public static void setupLogRotation(Path logDir) {
    setupLogRotation(logDir, FileHandlerConfig.DEFAULT_MAX_BYTES, FileHandlerConfig.DEFAULT_BACKUP_COUNT, null, 1);
  }

  /**
   * Replaces the root handlers with the aggregated layout.
   *
   * <ul>
   *   <li>{@code app.log} with the file handler's level, format and rotation, when a file handler is enabled.</li>
   *   <li>{@code errors.log}: ERROR and above, structured.</li>
   *   <li>{@code performance.log} on the {@value #PERFORMANCE_LOGGER} logger, when performance is enabled.</li>
   *   <li>{@code requests.log} on the {@value #REQUEST_LOGGER} logger, when request logging is enabled.</li>
   *   <li>Console output, when enabled.</li>
   * </ul>
   *
   * @param logDir log directory, created when missing
   * @param config logging configuration; {@code null} uses the defaults
   */
  public static void setupLogAggregation(Path logDir, LogConfig config) {
    Path dir = Paths.ensureWritableDir(logDir);
    LogConfig effective = config == null ? LogConfig.defaults() : config;
    HandlerFactory factory = HandlerFactory.forCurrentContext();

    Logger root = rootLogger(factory);
    root.detachAndStopAllAppenders();
    effective.fileHandler().ifPresent(file -> {
      FileHandlerConfig appFile = file.withFilename(dir.resolve(HandlerFactory.APP_FILE));
      root.addAppender(factory.fileAppender("root.file", appFile.filename(), appFile, effective.flattenJson()));
    });
    root.addAppender(factory.errorFileAppender(dir));
    if (effective.console().enabled()) {
      root.addAppender(factory.consoleAppender("root.console", effective.console(), effective.flattenJson()));
    }
    root.setLevel(Level.DEBUG);

    Logger performance = factory.context().getLogger(PERFORMANCE_LOGGER);
    performance.detachAndStopAllAppenders();
    if (effective.performance().enabled()) {
      performance.addAppender(factory.performanceFileAppender(dir));
    }
    Logger requests = factory.context().getLogger(REQUEST_LOGGER);
    requests.detachAndStopAllAppenders();
    if (effective.request().enabled()) {
      requests.addAppender(factory.requestFileAppender(dir));
    }
    log.debug("Log aggregation configured in {}", dir);
  }

  /**
   * Attaches {@code performance.log} to the {@value #PERFORMANCE_LOGGER} logger (when {@code logDir} is given)
   * and replaces the global runtime's performance tracker.
   *
   * @param config performance settings; {@code null} uses the defaults
   * @param logDir log directory, or {@code null} to leave handlers unchanged
   */
  public static void setupPerformanceMonitoring(PerformanceConfig config, Path logDir) {
    setupPerformanceMonitoring(BeaconRuntime.global(), config, logDir);
  }

  /**
   * Attaches {@code performance.log} to the {@value #PERFORMANCE_LOGGER} logger (when {@code logDir} is given)
   * and replaces the runtime's performance tracker, discarding its samples.
   *
   * @param runtime runtime whose tracker is replaced
   * @param config performance settings; {@code null} uses the defaults
   * @param logDir log directory, or {@code null} to leave handlers unchanged
   */
  public static void setupPerformanceMonitoring(BeaconRuntime runtime, PerformanceConfig config, Path logDir) {
    Objects.requireNonNull(runtime, "runtime");
    PerformanceConfig effective = config == null ? PerformanceConfig.defaults() : config;
    if (logDir != null) {
      Path dir = Paths.ensureWritableDir(logDir);
      HandlerFactory factory = HandlerFactory.forCurrentContext();
      Logger performance = factory.context().getLogger(PERFORMANCE_LOGGER);
      Appender<ILoggingEvent> existing = performance.getAppender("beacon.performance");
      if (existing != null) {
        performance.detachAppender(existing);
        existing.stop();
      }
      performance.addAppender(factory.performanceFileAppender(dir));
      performance.setLevel(Level.INFO);
    }
    runtime.setupPerformanceLogging(effective);
  }

  /** Replaces the root handlers with colored DEBUG console output. */
  public static void setupDevelopmentLogging() {
    HandlerFactory factory = HandlerFactory.forCurrentContext();
    Logger root = rootLogger(factory);
    root.detachAndStopAllAppenders();
    ConsoleHandlerConfig console = ConsoleHandlerConfig.defaults().withLevel(LogLevel.DEBUG).withColored(true);
    root.addAppender(factory.consoleAppender("root.console", console, false));
    root.setLevel(Level.DEBUG);
  }

  /**
   * Installs {@link #setupLogAggregation(Path, LogConfig)} with a file handler in {@code logDir} and the given
   * level and format applied to the console and file handlers.
   *
   * @param logDir log directory
   * @param level handler level
   * @param format handler format
   */
  public static void setupProductionLogging(Path logDir, LogLevel level, LogFormat format) {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(format, "format");
    LogConfig config = LogConfig.defaults()
        .withLevel(level)
        .withFile(FileHandlerConfig.inDirectory(logDir).withLevel(level))
        .withFormat(format);
    config = config.withConsole(config.console().withLevel(level));
    setupLogAggregation(logDir, config);
  }

  /** {@link #setupProductionLogging(Path, LogLevel, LogFormat)} at INFO with JSON output. */
  public static void setupProductionLogging(Path logDir) {
    setupProductionLogging(logDir, LogLevel.INFO, LogFormat.JSON);
  }

  static void apply(Logger logger, LogConfig config, HandlerFactory factory) {
    logger.detachAndStopAllAppenders();
    logger.setLevel(LevelMapping.toLogback(config.level()));
    logger.setAdditive(config.propagate());
    List<Appender<ILoggingEvent>> appenders = factory.createHandlers(logger.getName(), config);
    appenders.forEach(logger::addAppender);
    log.debug("Configured logger {} at {} with {} handler(s)", logger.getName(), config.level(), appenders.size());
  }

  private static Logger rootLogger(HandlerFactory factory) {
    return factory.context().getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  }
}
