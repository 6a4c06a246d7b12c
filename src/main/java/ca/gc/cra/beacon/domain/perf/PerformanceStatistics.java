package ca.gc.cra.beacon.domain.perf;

/**
 * Summary of the durations in a filtered set of {@link PerformanceSample}s. All durations are in seconds.
 *
 * @param count number of samples
 * @param totalDuration sum of durations
 * @param avgDuration mean duration
 * @param minDuration smallest duration
 * @param maxDuration largest duration
 * @param p95Duration 95th percentile (nearest-rank-floor)
 * @param p99Duration 99th percentile (nearest-rank-floor)
 * @since 0.1.0
 */
public record PerformanceStatistics(
    int count,
    double totalDuration,
    double avgDuration,
    double minDuration,
    double maxDuration,
    double p95Duration,
    double p99Duration) {

  /** Summary returned for an empty sample set. */
  public static final PerformanceStatistics EMPTY = new PerformanceStatistics(0, 0d, 0d, 0d, 0d, 0d, 0d);

  /**
   * Validates that the count is non-negative.
   */
  public PerformanceStatistics {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0 (was " + count + ")");
    }
  }

  /**
   * Returns whether the summary was computed over zero samples.
   *
   * @return {@code true} when {@code count == 0}
   */
  public boolean isEmpty() {
    return count == 0;
  }
}
