package ca.gc.cra.beacon.application.perf;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.domain.perf.PerformanceSample;
import ca.gc.cra.beacon.domain.value.LogValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Timing scope returned by {@link PerformanceTracker#trackOperation(String)}.
 *
 * <p>The start instant is captured from the monotonic clock at construction. {@link #close()} computes the
 * elapsed seconds and records exactly one sample, however the enclosing block exits. Further calls to
 * {@code close()} are no-ops.</p>
 *
 * <pre>{@code
 * try (TrackedOperation op = tracker.trackOperation("db.query")) {
 *   repository.load(id);
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class TrackedOperation implements AutoCloseable {
  private final PerformanceTracker tracker;
  private final ClockPort clock;
  private final String operation;
  private final Map<String, LogValue> context;
  private final String userId;
  private final String sessionId;
  private final String requestId;
  private final long startNanos;
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile PerformanceSample sample;

  TrackedOperation(
      PerformanceTracker tracker,
      ClockPort clock,
      String operation,
      Map<String, LogValue> context,
      String userId,
      String sessionId,
      String requestId) {
    this.tracker = Objects.requireNonNull(tracker, "tracker");
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(operation, "operation");
    if (operation.isEmpty()) {
      throw new IllegalArgumentException("operation must not be empty");
    }
    this.operation = operation;
    this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    this.userId = userId;
    this.sessionId = sessionId;
    this.requestId = requestId;
    this.startNanos = clock.monotonicNanos();
  }

  public String operation() {
    return operation;
  }

  /**
   * Seconds elapsed since the scope opened, never negative.
   *
   * @return elapsed seconds
   */
  public double elapsedSeconds() {
    long elapsed = clock.monotonicNanos() - startNanos;
    return Math.max(0L, elapsed) / 1_000_000_000d;
  }

  /**
   * Returns the recorded sample once the scope has closed.
   *
   * @return recorded sample, or empty while the scope is open
   */
  public Optional<PerformanceSample> sample() {
    return Optional.ofNullable(sample);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    sample = tracker.record(operation, elapsedSeconds(), context, userId, sessionId, requestId);
  }
}
