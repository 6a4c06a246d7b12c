package ca.gc.cra.beacon.application.perf;

import ca.gc.cra.beacon.domain.perf.PerformanceSample;
import ca.gc.cra.beacon.domain.perf.PerformanceStatistics;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Computes summary statistics over a set of performance samples.
 * <p><strong>Why:</strong> Callers want count, extremes, mean and tail latency for an operation without
 * exporting raw samples.</p>
 * <p><strong>Thread-safety:</strong> Stateless; operates on caller-supplied snapshots.</p>
 * <p><strong>Performance:</strong> O(n log n) per call for the sort; no caching between calls.</p>
 *
 * @implNote Percentiles use the nearest-rank-floor rule {@code index = floor(count * p)}, falling back to the
 *     maximum when the index reaches {@code count}. No interpolation is performed.
 * @since 0.1.0
 */
public final class StatisticsEngine {
  /** 95th percentile fraction. */
  public static final double P95 = 0.95d;
  /** 99th percentile fraction. */
  public static final double P99 = 0.99d;

  private StatisticsEngine() {
    // Utility
  }

  /**
   * Summarizes the durations of the given samples.
   *
   * @param samples samples to summarize; must not be {@code null}
   * @return summary, or {@link PerformanceStatistics#EMPTY} when {@code samples} is empty
   */
  public static PerformanceStatistics summarize(List<PerformanceSample> samples) {
    Objects.requireNonNull(samples, "samples");
    if (samples.isEmpty()) {
      return PerformanceStatistics.EMPTY;
    }
    double[] durations = new double[samples.size()];
    for (int i = 0; i < durations.length; i++) {
      durations[i] = samples.get(i).duration();
    }
    return summarize(durations);
  }

  /**
   * Summarizes raw durations in seconds. The array is sorted in place.
   *
   * @param durations durations in seconds; must not be {@code null}
   * @return summary, or {@link PerformanceStatistics#EMPTY} when empty
   */
  public static PerformanceStatistics summarize(double[] durations) {
    Objects.requireNonNull(durations, "durations");
    int count = durations.length;
    if (count == 0) {
      return PerformanceStatistics.EMPTY;
    }
    Arrays.sort(durations);
    double total = 0d;
    for (double duration : durations) {
      total += duration;
    }
    return new PerformanceStatistics(
        count,
        total,
        total / count,
        durations[0],
        durations[count - 1],
        percentile(durations, P95),
        percentile(durations, P99));
  }

  /**
   * Selects the nearest-rank-floor percentile from an ascending array.
   *
   * @param sorted ascending, non-empty durations
   * @param p fraction in {@code [0, 1]}
   * @return {@code sorted[floor(n * p)]}, or the last element when that index is out of range
   * @throws IllegalArgumentException if {@code sorted} is empty or {@code p} is outside {@code [0, 1]}
   */
  public static double percentile(double[] sorted, double p) {
    Objects.requireNonNull(sorted, "sorted");
    if (sorted.length == 0) {
      throw new IllegalArgumentException("sorted must not be empty");
    }
    if (Double.isNaN(p) || p < 0d || p > 1d) {
      throw new IllegalArgumentException("p must be within [0, 1] (was " + p + ")");
    }
    int index = (int) Math.floor(sorted.length * p);
    return index < sorted.length ? sorted[index] : sorted[sorted.length - 1];
  }
}
