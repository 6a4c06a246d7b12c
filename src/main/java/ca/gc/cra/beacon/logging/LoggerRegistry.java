package ca.gc.cra.beacon.logging;

import ca.gc.cra.beacon.config.LogConfig;
import ca.gc.cra.beacon.infrastructure.logging.HandlerFactory;
import ca.gc.cra.beacon.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Name-keyed cache of configured loggers.
 * <p><strong>Why:</strong> Components ask for a logger by name and get the same configured instance back, with
 * configuration applied once on first creation.</p>
 * <p><strong>Thread-safety:</strong> All operations run under one {@link ReentrantLock}.</p>
 *
 * @implNote Removing a logger only forgets the cached reference; the Logback logger and its appenders remain in
 *     the logger context.
 * @since 0.1.0
 */
public final class LoggerRegistry {
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, Logger> loggers = new LinkedHashMap<>();
  private final HandlerFactory handlers;

  /** Creates a registry bound to the active Logback context. */
  public LoggerRegistry() {
    this(HandlerFactory.forCurrentContext());
  }

  /**
   * Creates a registry bound to the given handler factory.
   *
   * @param handlers factory whose logger context owns the registered loggers
   */
  public LoggerRegistry(HandlerFactory handlers) {
    this.handlers = Objects.requireNonNull(handlers, "handlers");
  }

  /**
   * Returns the cached logger, creating it without configuration on first access.
   *
   * @param name logger name
   * @return logger
   */
  public Logger getLogger(String name) {
    return getLogger(name, null);
  }

  /**
   * Returns the cached logger. On first access the logger is created and, when {@code config} is given, its
   * level, additivity and appenders are replaced according to it. Later calls ignore {@code config}.
   *
   * @param name logger name
   * @param config configuration applied on creation; may be {@code null}
   * @return logger
   * @throws IllegalArgumentException if the name is invalid
   */
  public Logger getLogger(String name, LogConfig config) {
    String loggerName = Strings.requireLoggerName("name", name);
    lock.lock();
    try {
      Logger cached = loggers.get(loggerName);
      if (cached != null) {
        return cached;
      }
      ch.qos.logback.classic.Logger logger = handlers.context().getLogger(loggerName);
      if (config != null) {
        LoggingConfigurator.apply(logger, config, handlers);
      }
      loggers.put(loggerName, logger);
      return logger;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Forgets a cached logger.
   *
   * @param name logger name
   * @return {@code true} when a logger was cached under the name
   */
  public boolean removeLogger(String name) {
    lock.lock();
    try {
      return loggers.remove(name) != null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns a copy of the cache in creation order.
   *
   * @return logger names mapped to loggers
   */
  public Map<String, Logger> allLoggers() {
    lock.lock();
    try {
      return new LinkedHashMap<>(loggers);
    } finally {
      lock.unlock();
    }
  }

  /** Forgets every cached logger. */
  public void clear() {
    lock.lock();
    try {
      loggers.clear();
    } finally {
      lock.unlock();
    }
  }
}
