package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.application.perf.PerformanceTracker;
import ca.gc.cra.beacon.application.perf.TrackedOperation;
import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.LogSink;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.application.request.RequestLogger;
import ca.gc.cra.beacon.application.training.TrainingLogger;
import ca.gc.cra.beacon.domain.perf.PerformanceSample;
import ca.gc.cra.beacon.domain.value.LogValue;
import ca.gc.cra.beacon.infrastructure.logging.Slf4jLogSink;
import ca.gc.cra.beacon.logging.LoggerRegistry;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Application context holding Beacon's shared logging components.
 * <p><strong>Why:</strong> Replaces hidden module-level singletons with one explicit object that owns the default
 * performance tracker, the request and training loggers, the logger registry and the metrics port.</p>
 * <p><strong>Role:</strong> Composition root; wires application services to the SLF4J sink adapter.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Create the default tracker, request logger and training logger lazily on first access.</li>
 *   <li>Replace the tracker on {@link #setupPerformanceLogging}, discarding the previous instance and its
 *   samples.</li>
 *   <li>Expose {@link #logPerformance} and {@link #trackOperation} convenience entry points.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lazy creation and replacement happen under one lock, so concurrent first
 * access yields a single instance. Components are used outside the lock.</p>
 * <p><strong>Observability:</strong> Passes the configured {@link MetricsPort} to every tracker it creates.</p>
 *
 * @implNote A caller that already obtained the previous tracker keeps recording into it after a replacement;
 *     those samples are not visible through this runtime.
 * @since 0.1.0
 */
public final class BeaconRuntime {
  private static final Logger log = LoggerFactory.getLogger(BeaconRuntime.class);

  /** Sink logger name for performance threshold emissions. */
  public static final String PERFORMANCE_LOGGER = "performance";
  /** Sink logger name for request entries. */
  public static final String REQUEST_LOGGER = "requests";
  /** Sink logger name for training and model events. */
  public static final String TRAINING_LOGGER = "training";

  private static final ReentrantLock GLOBAL_LOCK = new ReentrantLock();
  private static BeaconRuntime global;

  private final LogConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Function<String, LogSink> sinks;
  private final Supplier<LoggerRegistry> registryFactory;
  private final ReentrantLock lock = new ReentrantLock();

  private PerformanceTracker tracker;
  private RequestLogger requestLogger;
  private TrainingLogger trainingLogger;
  private LoggerRegistry registry;

  /**
   * Creates a runtime emitting through SLF4J loggers, with the system clock and no metrics.
   *
   * @param config logging configuration; must not be {@code null}
   */
  public BeaconRuntime(LogConfig config) {
    this(config, MetricsPort.NO_OP, ClockPort.SYSTEM, Slf4jLogSink::forLogger);
  }

  /**
   * Creates a runtime with explicit collaborators.
   *
   * @param config logging configuration; must not be {@code null}
   * @param metrics metrics port handed to trackers; must not be {@code null}
   * @param clock clock handed to trackers; must not be {@code null}
   * @param sinks maps a sink logger name ({@value #PERFORMANCE_LOGGER}, {@value #REQUEST_LOGGER},
   *     {@value #TRAINING_LOGGER}) to a sink; must not be {@code null}
   */
  public BeaconRuntime(
      LogConfig config, MetricsPort metrics, ClockPort clock, Function<String, LogSink> sinks) {
    this(config, metrics, clock, sinks, LoggerRegistry::new);
  }

  BeaconRuntime(
      LogConfig config,
      MetricsPort metrics,
      ClockPort clock,
      Function<String, LogSink> sinks,
      Supplier<LoggerRegistry> registryFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sinks = Objects.requireNonNull(sinks, "sinks");
    this.registryFactory = Objects.requireNonNull(registryFactory, "registryFactory");
  }

  /**
   * Returns the process-wide runtime, creating it with {@link LogConfig#defaults()} on first access.
   *
   * @return global runtime
   */
  public static BeaconRuntime global() {
    GLOBAL_LOCK.lock();
    try {
      if (global == null) {
        global = new BeaconRuntime(LogConfig.defaults());
      }
      return global;
    } finally {
      GLOBAL_LOCK.unlock();
    }
  }

  /**
   * Installs the process-wide runtime.
   *
   * @param runtime replacement; {@code null} resets to lazy default creation
   * @return the runtime previously installed, or {@code null}
   */
  public static BeaconRuntime installGlobal(BeaconRuntime runtime) {
    GLOBAL_LOCK.lock();
    try {
      BeaconRuntime previous = global;
      global = runtime;
      return previous;
    } finally {
      GLOBAL_LOCK.unlock();
    }
  }

  public LogConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the default tracker, created from {@code config().performance()} on first access.
   *
   * @return current tracker
   */
  public PerformanceTracker performanceTracker() {
    lock.lock();
    try {
      if (tracker == null) {
        tracker = newTracker(config.performance(), sinks.apply(PERFORMANCE_LOGGER));
      }
      return tracker;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Replaces the default tracker with one emitting to the {@value #PERFORMANCE_LOGGER} sink.
   *
   * @param performance settings for the new tracker; must not be {@code null}
   * @return the new tracker
   */
  public PerformanceTracker setupPerformanceLogging(PerformanceConfig performance) {
    return setupPerformanceLogging(performance, sinks.apply(PERFORMANCE_LOGGER));
  }

  /**
   * Replaces the default tracker. The previous tracker and its samples are discarded.
   *
   * @param performance settings for the new tracker; must not be {@code null}
   * @param sink destination for threshold emissions; must not be {@code null}
   * @return the new tracker
   */
  public PerformanceTracker setupPerformanceLogging(PerformanceConfig performance, LogSink sink) {
    PerformanceTracker replacement = newTracker(performance, sink);
    lock.lock();
    try {
      if (tracker != null) {
        log.debug("Replacing performance tracker holding {} sample(s)", tracker.size());
      }
      tracker = replacement;
      return replacement;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Records a sample on the default tracker.
   *
   * @param operation non-empty operation name
   * @param duration non-negative duration in seconds
   * @return the appended sample
   */
  public PerformanceSample logPerformance(String operation, double duration) {
    return performanceTracker().record(operation, duration);
  }

  /**
   * Records a sample with context and correlation identifiers on the default tracker.
   *
   * @param operation non-empty operation name
   * @param duration non-negative duration in seconds
   * @param context additional attributes; may be {@code null}
   * @param userId optional user identifier
   * @param sessionId optional session identifier
   * @param requestId optional request identifier
   * @return the appended sample
   */
  public PerformanceSample logPerformance(
      String operation,
      double duration,
      Map<String, LogValue> context,
      String userId,
      String sessionId,
      String requestId) {
    return performanceTracker().record(operation, duration, context, userId, sessionId, requestId);
  }

  /**
   * Opens a timing scope on the default tracker.
   *
   * @param operation non-empty operation name
   * @return scope recording once when closed
   */
  public TrackedOperation trackOperation(String operation) {
    return performanceTracker().trackOperation(operation);
  }

  /**
   * Opens a timing scope with context and correlation identifiers on the default tracker.
   *
   * @param operation non-empty operation name
   * @param context attributes attached to the sample; may be {@code null}
   * @param userId optional user identifier
   * @param sessionId optional session identifier
   * @param requestId optional request identifier
   * @return scope recording once when closed
   */
  public TrackedOperation trackOperation(
      String operation, Map<String, LogValue> context, String userId, String sessionId, String requestId) {
    return performanceTracker().trackOperation(operation, context, userId, sessionId, requestId);
  }

  /**
   * Returns the request logger, created from {@code config().request()} on first access.
   *
   * @return request logger
   */
  public RequestLogger requestLogger() {
    lock.lock();
    try {
      if (requestLogger == null) {
        requestLogger = new RequestLogger(sinks.apply(REQUEST_LOGGER), config.request());
      }
      return requestLogger;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the training logger, created from {@code config().training()} on first access.
   *
   * @return training logger
   */
  public TrainingLogger trainingLogger() {
    lock.lock();
    try {
      if (trainingLogger == null) {
        trainingLogger = new TrainingLogger(sinks.apply(TRAINING_LOGGER), config.training());
      }
      return trainingLogger;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the logger registry, created on first access.
   *
   * @return registry
   * @throws IllegalStateException if the SLF4J backend is not Logback
   */
  public LoggerRegistry loggerRegistry() {
    lock.lock();
    try {
      if (registry == null) {
        registry = registryFactory.get();
      }
      return registry;
    } finally {
      lock.unlock();
    }
  }

  private PerformanceTracker newTracker(PerformanceConfig performance, LogSink sink) {
    return new PerformanceTracker(performance, sink, clock, metrics);
  }
}
