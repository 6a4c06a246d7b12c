package ca.gc.cra.beacon.infrastructure.logging;

import ca.gc.cra.beacon.application.port.LogSink;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.value.LogValue;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.spi.CallerBoundaryAware;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * <strong>What:</strong> {@link LogSink} adapter that forwards to an SLF4J logger.
 * <p><strong>Why:</strong> Application services stay independent of the logging backend while Logback appenders
 * and Beacon layouts handle formatting and rotation.</p>
 * <p><strong>Role:</strong> Default sink wired by {@code BeaconRuntime} for the {@code performance},
 * {@code requests} and {@code training} loggers.</p>
 * <p><strong>Thread-safety:</strong> Stateless; SLF4J loggers are thread-safe.</p>
 *
 * @implNote Uses the SLF4J 2 fluent API; each attribute becomes one key/value pair holding the plain Java value
 *     ({@link LogValue#toPlainObject()}). CRITICAL is logged at ERROR with {@link LevelMapping#CRITICAL}.
 * @since 0.1.0
 */
public final class Slf4jLogSink implements LogSink {
  private final Logger logger;

  public Slf4jLogSink(Logger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  /**
   * Creates a sink writing to the named logger.
   *
   * @param loggerName SLF4J logger name
   * @return sink
   */
  public static Slf4jLogSink forLogger(String loggerName) {
    return new Slf4jLogSink(LoggerFactory.getLogger(Objects.requireNonNull(loggerName, "loggerName")));
  }

  public Logger logger() {
    return logger;
  }

  @Override
  public void emit(LogLevel level, String message, Map<String, LogValue> attributes) {
    Objects.requireNonNull(level, "level");
    LoggingEventBuilder builder = switch (level) {
      case DEBUG -> logger.atDebug();
      case INFO -> logger.atInfo();
      case WARNING -> logger.atWarn();
      case ERROR -> logger.atError();
      case CRITICAL -> logger.atError().addMarker(LevelMapping.CRITICAL);
    };
    if (builder instanceof CallerBoundaryAware boundary) {
      boundary.setCallerBoundary(Slf4jLogSink.class.getName());
    }
    if (attributes != null) {
      for (Map.Entry<String, LogValue> entry : attributes.entrySet()) {
        builder = builder.addKeyValue(entry.getKey(), entry.getValue().toPlainObject());
      }
    }
    builder.log(message);
  }
}
