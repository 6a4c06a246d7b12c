package ca.gc.cra.beacon.infrastructure.logging;

import ca.gc.cra.beacon.config.ConsoleHandlerConfig;
import ca.gc.cra.beacon.config.ConsoleStream;
import ca.gc.cra.beacon.config.FileHandlerConfig;
import ca.gc.cra.beacon.config.LogConfig;
import ca.gc.cra.beacon.config.LogFormat;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.validation.Paths;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.LayoutBase;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import ch.qos.logback.core.util.FileSize;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds started Logback appenders from Beacon handler configuration.
 * <p><strong>Why:</strong> Console, rotating file and dedicated error/performance/request handlers all share the
 * same wiring of layout, encoder, level filter and rolling policy.</p>
 * <p><strong>Role:</strong> Infrastructure adapter used by {@code LoggingConfigurator}.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Select the layout for a {@link LogFormat}.</li>
 *   <li>Create size-based (fixed window) or time-based rolling file appenders.</li>
 *   <li>Create missing log directories before an appender opens its file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are stateless apart from the Logback context; appender creation is
 * expected on a configuration thread.</p>
 *
 * @implNote Logback limits a fixed rolling window to 20 files, so larger {@code backupCount} values are capped by
 *     Logback with a status warning. A {@code backupCount} of zero disables size-based rotation. Time-based
 *     rotation rolls once per unit; an {@code interval} above one is logged and treated as one, and weekly
 *     rotation rolls on the locale's first day of the week regardless of {@code W0}-{@code W6}.
 * @since 0.1.0
 */
public final class HandlerFactory {
  private static final Logger log = LoggerFactory.getLogger(HandlerFactory.class);

  /** File name of the aggregated application log. */
  public static final String APP_FILE = "app.log";
  /** File name of the dedicated error log. */
  public static final String ERROR_FILE = "errors.log";
  /** File name of the dedicated performance log. */
  public static final String PERFORMANCE_FILE = "performance.log";
  /** File name of the dedicated request log. */
  public static final String REQUEST_FILE = "requests.log";

  private static final long FIVE_MIB = 5L * 1024 * 1024;
  private static final long TEN_MIB = 10L * 1024 * 1024;

  private final LoggerContext context;

  public HandlerFactory(LoggerContext context) {
    this.context = Objects.requireNonNull(context, "context");
  }

  /**
   * Creates a factory bound to the active Logback context.
   *
   * @return factory
   * @throws IllegalStateException if the SLF4J binding is not Logback
   */
  public static HandlerFactory forCurrentContext() {
    return new HandlerFactory(loggerContext());
  }

  /**
   * Returns the active Logback context.
   *
   * @return logger context
   * @throws IllegalStateException if the SLF4J binding is not Logback
   */
  public static LoggerContext loggerContext() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext loggerContext) {
      return loggerContext;
    }
    throw new IllegalStateException("Logback is required but the SLF4J backend is " + factory.getClass().getName());
  }

  public LoggerContext context() {
    return context;
  }

  /**
   * Creates the handlers described by {@code config} for the named logger: console when enabled, then the file
   * handler when one is configured and enabled.
   *
   * @param loggerName logger the handlers are attached to; names appenders and the default log file
   * @param config logging configuration
   * @return started appenders in attachment order
   * @throws IllegalArgumentException if the file handler has neither filename nor directory, or its directory
   *     cannot be prepared
   */
  public List<Appender<ILoggingEvent>> createHandlers(String loggerName, LogConfig config) {
    Objects.requireNonNull(loggerName, "loggerName");
    Objects.requireNonNull(config, "config");
    List<Appender<ILoggingEvent>> appenders = new ArrayList<>(2);
    if (config.console().enabled()) {
      appenders.add(consoleAppender(loggerName + ".console", config.console(), config.flattenJson()));
    }
    config.fileHandler().ifPresent(file ->
        appenders.add(fileAppender(loggerName + ".file", file.resolveFile(loggerName), file, config.flattenJson())));
    return appenders;
  }

  /**
   * Creates a console appender.
   *
   * @param name appender name
   * @param config console settings
   * @param flattenJson JSON attribute placement
   * @return started appender
   */
  public Appender<ILoggingEvent> consoleAppender(String name, ConsoleHandlerConfig config, boolean flattenJson) {
    Objects.requireNonNull(config, "config");
    ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
    appender.setContext(context);
    appender.setName(name);
    appender.setTarget(config.stream() == ConsoleStream.STDERR ? "System.err" : "System.out");
    LayoutBase<ILoggingEvent> layout = layout(config.format(), config.colored(), flattenJson);
    return start(appender, layout, config.level());
  }

  /**
   * Creates a file appender writing to {@code file}, rotating per {@code config}.
   *
   * @param name appender name
   * @param file target file; parent directories are created when missing
   * @param config file settings (level, format, rotation)
   * @param flattenJson JSON attribute placement
   * @return started appender
   * @throws IllegalArgumentException if the target cannot be prepared
   */
  public Appender<ILoggingEvent> fileAppender(String name, Path file, FileHandlerConfig config, boolean flattenJson) {
    Objects.requireNonNull(config, "config");
    Path target = Paths.ensureLogFile(Objects.requireNonNull(file, "file"));
    LayoutBase<ILoggingEvent> layout = layout(config.format(), false, flattenJson);
    if (config.timeBased()) {
      return start(timeRolling(name, target, config), layout, config.level());
    }
    if (config.backupCount() == 0) {
      FileAppender<ILoggingEvent> plain = new FileAppender<>();
      plain.setContext(context);
      plain.setName(name);
      plain.setFile(target.toString());
      plain.setAppend(true);
      return start(plain, layout, config.level());
    }
    return start(sizeRolling(name, target, config.maxBytes(), config.backupCount()), layout, config.level());
  }

  /**
   * Creates the dedicated error handler: {@code errors.log}, ERROR and above, structured, 5 MiB x 3.
   *
   * @param logDir log directory
   * @return started appender
   */
  public Appender<ILoggingEvent> errorFileAppender(Path logDir) {
    Path target = Paths.ensureLogFile(logDir.resolve(ERROR_FILE));
    return start(sizeRolling("beacon.errors", target, FIVE_MIB, 3), layout(LogFormat.STRUCTURED, false, false),
        LogLevel.ERROR);
  }

  /**
   * Creates the dedicated performance handler: {@code performance.log}, INFO and above, JSON, 5 MiB x 3.
   *
   * @param logDir log directory
   * @return started appender
   */
  public Appender<ILoggingEvent> performanceFileAppender(Path logDir) {
    Path target = Paths.ensureLogFile(logDir.resolve(PERFORMANCE_FILE));
    return start(sizeRolling("beacon.performance", target, FIVE_MIB, 3), layout(LogFormat.JSON, false, false),
        LogLevel.INFO);
  }

  /**
   * Creates the dedicated request handler: {@code requests.log}, INFO and above, JSON, 10 MiB x 5.
   *
   * @param logDir log directory
   * @return started appender
   */
  public Appender<ILoggingEvent> requestFileAppender(Path logDir) {
    Path target = Paths.ensureLogFile(logDir.resolve(REQUEST_FILE));
    return start(sizeRolling("beacon.requests", target, TEN_MIB, 5), layout(LogFormat.JSON, false, false),
        LogLevel.INFO);
  }

  /**
   * Returns a started layout for the format.
   *
   * @param format output format
   * @param colored ANSI level colors for text output
   * @param flattenJson write JSON attributes at the top level
   * @return started layout
   */
  public LayoutBase<ILoggingEvent> layout(LogFormat format, boolean colored, boolean flattenJson) {
    LayoutBase<ILoggingEvent> layout = switch (format) {
      case TEXT -> colored ? new ColoredTextLayout() : new TextLayout();
      case JSON -> {
        JsonLayout json = new JsonLayout();
        json.setFlatten(flattenJson);
        yield json;
      }
      case STRUCTURED -> new StructuredLayout();
    };
    layout.setContext(context);
    layout.start();
    return layout;
  }

  private RollingFileAppender<ILoggingEvent> sizeRolling(String name, Path target, long maxBytes, int backupCount) {
    RollingFileAppender<ILoggingEvent> appender = newRollingAppender(name, target);

    FixedWindowRollingPolicy policy = new FixedWindowRollingPolicy();
    policy.setContext(context);
    policy.setParent(appender);
    policy.setFileNamePattern(target + ".%i");
    policy.setMinIndex(1);
    policy.setMaxIndex(backupCount);
    policy.start();

    SizeBasedTriggeringPolicy<ILoggingEvent> trigger = new SizeBasedTriggeringPolicy<>();
    trigger.setContext(context);
    trigger.setMaxFileSize(new FileSize(maxBytes));
    trigger.start();

    appender.setRollingPolicy(policy);
    appender.setTriggeringPolicy(trigger);
    return appender;
  }

  private RollingFileAppender<ILoggingEvent> timeRolling(String name, Path target, FileHandlerConfig config) {
    if (config.interval() > 1) {
      log.warn("Rotation interval {} for {} is not supported; rolling every {}", config.interval(), target,
          config.when());
    }
    RollingFileAppender<ILoggingEvent> appender = newRollingAppender(name, target);
    TimeBasedRollingPolicy<ILoggingEvent> policy = new TimeBasedRollingPolicy<>();
    policy.setContext(context);
    policy.setParent(appender);
    policy.setFileNamePattern(target + ".%d{" + datePattern(config.when()) + "}");
    policy.setMaxHistory(config.backupCount());
    policy.start();
    appender.setRollingPolicy(policy);
    appender.setTriggeringPolicy(policy);
    return appender;
  }

  static String datePattern(String when) {
    if (when.startsWith("W")) {
      return "yyyy-ww";
    }
    return switch (when) {
      case "S" -> "yyyy-MM-dd_HH-mm-ss";
      case "M" -> "yyyy-MM-dd_HH-mm";
      case "H" -> "yyyy-MM-dd_HH";
      case "D", "MIDNIGHT" -> "yyyy-MM-dd";
      default -> throw new IllegalArgumentException("Unsupported rotation unit: " + when);
    };
  }

  private RollingFileAppender<ILoggingEvent> newRollingAppender(String name, Path target) {
    RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
    appender.setContext(context);
    appender.setName(name);
    appender.setFile(target.toString());
    appender.setAppend(true);
    return appender;
  }

  private <A extends OutputStreamAppender<ILoggingEvent>> A start(
      A appender, LayoutBase<ILoggingEvent> layout, LogLevel level) {
    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.setCharset(StandardCharsets.UTF_8);
    encoder.start();

    ThresholdFilter threshold = new ThresholdFilter();
    threshold.setContext(context);
    threshold.setLevel(LevelMapping.toLogback(level).toString());
    threshold.start();

    appender.setEncoder(encoder);
    appender.addFilter(threshold);
    appender.start();
    return appender;
  }
}
