package ca.gc.cra.beacon.domain.perf;

import java.time.Instant;
import java.util.Optional;

/**
 * Filter applied to a snapshot of recorded samples.
 *
 * @param operation exact operation name to keep; {@code null} keeps every operation
 * @param since inclusive lower bound on {@link PerformanceSample#timestamp()}; {@code null} disables the bound
 * @param limit maximum number of most recent samples to keep; {@code null} or {@code 0} means unlimited
 * @since 0.1.0
 */
public record SampleQuery(String operation, Instant since, Integer limit) {

  private static final SampleQuery ALL = new SampleQuery(null, null, null);

  /**
   * Validates the limit.
   */
  public SampleQuery {
    if (operation != null && operation.isEmpty()) {
      operation = null;
    }
    if (limit != null && limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0 (was " + limit + ")");
    }
  }

  /**
   * Query matching every sample.
   *
   * @return unfiltered query
   */
  public static SampleQuery all() {
    return ALL;
  }

  /**
   * Query matching one operation.
   *
   * @param operation exact operation name
   * @return filtered query
   */
  public static SampleQuery forOperation(String operation) {
    return new SampleQuery(operation, null, null);
  }

  /**
   * Returns a copy with the given inclusive lower time bound.
   *
   * @param instant lower bound; {@code null} removes it
   * @return updated query
   */
  public SampleQuery since(Instant instant) {
    return new SampleQuery(operation, instant, limit);
  }

  /**
   * Returns a copy keeping at most {@code max} of the most recent samples.
   *
   * @param max maximum sample count; {@code null} or {@code 0} removes the limit
   * @return updated query
   */
  public SampleQuery limit(Integer max) {
    return new SampleQuery(operation, since, max);
  }

  /**
   * Returns a copy without the limit, as used for statistics.
   *
   * @return unlimited query
   */
  public SampleQuery unlimited() {
    return limit == null ? this : new SampleQuery(operation, since, null);
  }

  /**
   * Returns whether a sample passes the operation and time filters. The limit is applied separately.
   *
   * @param sample candidate sample
   * @return {@code true} when the sample is kept
   */
  public boolean matches(PerformanceSample sample) {
    if (operation != null && !operation.equals(sample.operation())) {
      return false;
    }
    return since == null || !sample.timestamp().isBefore(since);
  }

  /**
   * Returns the operation filter when present.
   *
   * @return optional operation
   */
  public Optional<String> operationFilter() {
    return Optional.ofNullable(operation);
  }
}
