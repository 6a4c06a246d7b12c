package ca.gc.cra.beacon.application.perf;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.LogSink;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.config.PerformanceConfig;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.perf.PerformanceSample;
import ca.gc.cra.beacon.domain.perf.PerformanceStatistics;
import ca.gc.cra.beacon.domain.perf.SampleQuery;
import ca.gc.cra.beacon.domain.value.LogValue;
import ca.gc.cra.beacon.logging.Logs;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Records timed operation samples into an in-memory buffer and emits slow ones to a log
 * sink.
 * <p><strong>Why:</strong> Gives applications per-operation latency history and tail statistics without an
 * external time-series store.</p>
 * <p><strong>Role:</strong> Application service behind {@code BeaconRuntime.logPerformance} and
 * {@code BeaconRuntime.trackOperation}.</p>
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Validate and append samples in lock-acquisition order.</li>
 *   <li>Emit {@code "Performance: <op> took <s>s"} at INFO when {@code duration * 1000 >= thresholdMs}.</li>
 *   <li>Serve filtered snapshots and statistics, and clear the buffer on request.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> All public methods are safe for concurrent use. The buffer lock is never
 * held while calling the sink.</p>
 * <p><strong>Observability:</strong> Increments {@code performance.recorded},
 * {@code performance.threshold.emitted} and {@code performance.sink.failures}; observes
 * {@code performance.duration.micros}.</p>
 *
 * @implNote The sample is appended before the sink is called. A sink that throws is logged at WARN and counted;
 *     the exception is not rethrown and the append stands.
 * @since 0.1.0
 */
public final class PerformanceTracker {
  private static final Logger log = LoggerFactory.getLogger(PerformanceTracker.class);

  private final PerformanceConfig config;
  private final LogSink sink;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final SampleBuffer buffer = new SampleBuffer();

  /**
   * Creates a tracker using the system clock and no metrics.
   *
   * @param config performance settings; must not be {@code null}
   * @param sink destination for threshold emissions; must not be {@code null}
   */
  public PerformanceTracker(PerformanceConfig config, LogSink sink) {
    this(config, sink, ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Creates a tracker with explicit collaborators.
   *
   * @param config performance settings; must not be {@code null}
   * @param sink destination for threshold emissions; must not be {@code null}
   * @param clock wall-clock and monotonic time source; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public PerformanceTracker(PerformanceConfig config, LogSink sink, ClockPort clock, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  public PerformanceConfig config() {
    return config;
  }

  /**
   * Records a sample without context or correlation identifiers.
   *
   * @param operation non-empty operation name
   * @param duration non-negative duration in seconds
   * @return the appended sample
   * @throws IllegalArgumentException if {@code operation} is empty or {@code duration} is negative, NaN or infinite
   */
  public PerformanceSample record(String operation, double duration) {
    return record(operation, duration, Map.of(), null, null, null);
  }

  /**
   * Records a sample with context only.
   *
   * @param operation non-empty operation name
   * @param duration non-negative duration in seconds
   * @param context additional attributes; may be {@code null}
   * @return the appended sample
   */
  public PerformanceSample record(String operation, double duration, Map<String, LogValue> context) {
    return record(operation, duration, context, null, null, null);
  }

  /**
   * Records a sample stamped with the current time.
   *
   * @param operation non-empty operation name
   * @param duration non-negative duration in seconds
   * @param context additional attributes; may be {@code null}
   * @param userId optional user identifier; blank is treated as absent
   * @param sessionId optional session identifier; blank is treated as absent
   * @param requestId optional request identifier; blank is treated as absent
   * @return the appended sample, which is the last buffer element when this method returns unless a concurrent
   *     clear intervened
   * @throws IllegalArgumentException if {@code operation} is empty or {@code duration} is negative, NaN or
   *     infinite; the buffer is left untouched
   * @throws NullPointerException if {@code operation} is {@code null}
   */
  public PerformanceSample record(
      String operation,
      double duration,
      Map<String, LogValue> context,
      String userId,
      String sessionId,
      String requestId) {
    PerformanceSample sample =
        new PerformanceSample(operation, duration, clock.now(), context, userId, sessionId, requestId);
    buffer.append(sample);
    metrics.increment("performance.recorded");
    metrics.observe("performance.duration.micros", Math.round(duration * 1_000_000d));

    if (sample.durationMs() >= config.thresholdMs()) {
      emit(sample);
    }
    return sample;
  }

  /**
   * Opens a timing scope for use with try-with-resources.
   *
   * @param operation non-empty operation name
   * @return scope that records exactly once when closed
   */
  public TrackedOperation trackOperation(String operation) {
    return trackOperation(operation, Map.of(), null, null, null);
  }

  /**
   * Opens a timing scope carrying context and correlation identifiers.
   *
   * @param operation non-empty operation name
   * @param context attributes attached to the recorded sample; may be {@code null}
   * @param userId optional user identifier
   * @param sessionId optional session identifier
   * @param requestId optional request identifier
   * @return scope that records exactly once when closed
   * @throws IllegalArgumentException if {@code operation} is empty
   */
  public TrackedOperation trackOperation(
      String operation, Map<String, LogValue> context, String userId, String sessionId, String requestId) {
    return new TrackedOperation(this, clock, operation, context, userId, sessionId, requestId);
  }

  /**
   * Times a unit of work and records its duration on every exit path.
   *
   * @param operation non-empty operation name
   * @param work work to run; its exception propagates unchanged after the sample is recorded
   * @param <T> result type
   * @return the work's result
   * @throws Exception whatever {@code work} throws
   */
  public <T> T time(String operation, Callable<T> work) throws Exception {
    Objects.requireNonNull(work, "work");
    try (TrackedOperation ignored = trackOperation(operation)) {
      return work.call();
    }
  }

  /**
   * Times a unit of work and records its duration on every exit path.
   *
   * @param operation non-empty operation name
   * @param work work to run; runtime exceptions propagate unchanged after the sample is recorded
   */
  public void time(String operation, Runnable work) {
    Objects.requireNonNull(work, "work");
    try (TrackedOperation ignored = trackOperation(operation)) {
      work.run();
    }
  }

  /**
   * Returns every sample in insertion order.
   *
   * @return immutable snapshot
   */
  public List<PerformanceSample> getMetrics() {
    return buffer.snapshot();
  }

  /**
   * Returns samples matching {@code operation} and recorded at or after {@code since}, keeping the most recent
   * {@code limit}.
   *
   * @param operation exact operation filter; {@code null} matches all
   * @param since inclusive lower time bound; {@code null} matches all
   * @param limit maximum number of most recent matches; {@code null} or {@code 0} means no limit
   * @return immutable list in original order
   */
  public List<PerformanceSample> getMetrics(String operation, Instant since, Integer limit) {
    return getMetrics(new SampleQuery(operation, since, limit));
  }

  /**
   * Returns samples matching the query from a snapshot taken under the buffer lock.
   *
   * @param query filter; must not be {@code null}
   * @return immutable list in original order
   */
  public List<PerformanceSample> getMetrics(SampleQuery query) {
    Objects.requireNonNull(query, "query");
    List<PerformanceSample> snapshot = buffer.snapshot();
    List<PerformanceSample> matches = new ArrayList<>(snapshot.size());
    for (PerformanceSample sample : snapshot) {
      if (query.matches(sample)) {
        matches.add(sample);
      }
    }
    Integer limit = query.limit();
    if (limit != null && limit > 0 && matches.size() > limit) {
      return List.copyOf(matches.subList(matches.size() - limit, matches.size()));
    }
    return List.copyOf(matches);
  }

  public PerformanceStatistics getStatistics() {
    return getStatistics(null, null);
  }

  /**
   * Summarizes the samples selected by {@code getMetrics(operation, since, null)}.
   *
   * @param operation exact operation filter; {@code null} matches all
   * @param since inclusive lower time bound; {@code null} matches all
   * @return summary; all zero when nothing matches
   */
  public PerformanceStatistics getStatistics(String operation, Instant since) {
    return StatisticsEngine.summarize(getMetrics(operation, since, null));
  }

  /** Empties the buffer; idempotent. */
  public void clearMetrics() {
    buffer.clear();
  }

  public int size() {
    return buffer.size();
  }

  private void emit(PerformanceSample sample) {
    String message = "Performance: " + sample.operation() + " took " + Logs.seconds(sample.duration()) + "s";
    try {
      sink.emit(LogLevel.INFO, message, attributes(sample));
      metrics.increment("performance.threshold.emitted");
    } catch (RuntimeException ex) {
      metrics.increment("performance.sink.failures");
      log.warn("Performance sink failed for operation {}; sample retained", sample.operation(), ex);
    }
  }

  static Map<String, LogValue> attributes(PerformanceSample sample) {
    Map<String, LogValue> attributes = new LinkedHashMap<>();
    attributes.put("operation", LogValue.of(sample.operation()));
    attributes.put("duration_ms", LogValue.of(sample.durationMs()));
    attributes.put("duration_seconds", LogValue.of(sample.duration()));
    attributes.put("timestamp", LogValue.of(DateTimeFormatter.ISO_INSTANT.format(sample.timestamp())));
    attributes.putAll(sample.context());
    sample.user().ifPresent(id -> attributes.put("user_id", LogValue.of(id)));
    sample.session().ifPresent(id -> attributes.put("session_id", LogValue.of(id)));
    sample.request().ifPresent(id -> attributes.put("request_id", LogValue.of(id)));
    return attributes;
  }
}
