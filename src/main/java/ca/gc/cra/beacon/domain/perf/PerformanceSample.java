package ca.gc.cra.beacon.domain.perf;

import ca.gc.cra.beacon.domain.value.LogValue;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable timing observation for one unit of work.
 *
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param operation name of the measured operation; never empty
 * @param duration elapsed seconds; never negative
 * @param timestamp instant the sample was recorded (UTC); never {@code null}
 * @param context additional attributes; never {@code null}
 * @param userId optional user identifier; {@code null} when not applicable
 * @param sessionId optional session identifier; {@code null} when not applicable
 * @param requestId optional request identifier; {@code null} when not applicable
 * @since 0.1.0
 */
public record PerformanceSample(
    String operation,
    double duration,
    Instant timestamp,
    Map<String, LogValue> context,
    String userId,
    String sessionId,
    String requestId) {

  /**
   * Validates invariants and defensively copies the context map. Blank correlation identifiers collapse to
   * {@code null}.
   */
  public PerformanceSample {
    operation = requireOperation(operation);
    requireDuration(duration);
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    context = context == null || context.isEmpty()
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    userId = blankToNull(userId);
    sessionId = blankToNull(sessionId);
    requestId = blankToNull(requestId);
  }

  /**
   * Creates a sample without correlation identifiers.
   *
   * @param operation operation name
   * @param duration elapsed seconds
   * @param timestamp record instant
   * @return sample with empty context
   */
  public static PerformanceSample of(String operation, double duration, Instant timestamp) {
    return new PerformanceSample(operation, duration, timestamp, Map.of(), null, null, null);
  }

  /**
   * Returns the duration in milliseconds, always computed as {@code duration * 1000}.
   *
   * @return elapsed milliseconds
   */
  public double durationMs() {
    return duration * 1000;
  }

  /**
   * Returns the user identifier when present.
   *
   * @return optional user id
   */
  public Optional<String> user() {
    return Optional.ofNullable(userId);
  }

  /**
   * Returns the session identifier when present.
   *
   * @return optional session id
   */
  public Optional<String> session() {
    return Optional.ofNullable(sessionId);
  }

  /**
   * Returns the request identifier when present.
   *
   * @return optional request id
   */
  public Optional<String> request() {
    return Optional.ofNullable(requestId);
  }

  static String requireOperation(String operation) {
    Objects.requireNonNull(operation, "operation");
    if (operation.isEmpty()) {
      throw new IllegalArgumentException("operation must not be empty");
    }
    return operation;
  }

  static void requireDuration(double duration) {
    if (!Double.isFinite(duration) || duration < 0d) {
      throw new IllegalArgumentException(
          "duration must be a finite non-negative number of seconds (was " + duration + ")");
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
