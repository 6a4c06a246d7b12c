package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for the performance tracker and its dedicated log handler.
 * <p><strong>Why:</strong> Controls which recorded samples are eagerly emitted to the log sink.</p>
 * <p><strong>Role:</strong> Configuration value consumed by {@code PerformanceTracker} and
 * {@code LoggingConfigurator.setupPerformanceMonitoring}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param enabled whether the performance handler is attached during log aggregation
 * @param trackMemory reserved; carried for configuration compatibility and not sampled
 * @param trackCpu reserved; carried for configuration compatibility and not sampled
 * @param trackDisk reserved; carried for configuration compatibility and not sampled
 * @param trackNetwork reserved; carried for configuration compatibility and not sampled
 * @param intervalSeconds reserved sampling interval in seconds; must be positive
 * @param thresholdMs samples with {@code duration * 1000 >= thresholdMs} are emitted; must be finite and {@code >= 0}
 * @since 0.1.0
 */
public record PerformanceConfig(
    boolean enabled,
    boolean trackMemory,
    boolean trackCpu,
    boolean trackDisk,
    boolean trackNetwork,
    int intervalSeconds,
    double thresholdMs) {

  private static final PerformanceConfig DEFAULTS =
      new PerformanceConfig(true, true, true, false, false, 60, 1000d);

  /**
   * Validates the interval and threshold.
   *
   * @throws IllegalArgumentException if {@code intervalSeconds <= 0} or {@code thresholdMs} is negative or not finite
   */
  public PerformanceConfig {
    Numbers.requireRange("performance.intervalSeconds", intervalSeconds, 1, 86_400);
    Numbers.requireNonNegative("performance.thresholdMs", thresholdMs);
  }

  /**
   * Returns the default settings: enabled, memory and CPU flags on, 60 second interval, 1000 ms threshold.
   *
   * @return default performance configuration
   */
  public static PerformanceConfig defaults() {
    return DEFAULTS;
  }

  /**
   * Returns a copy with a different emission threshold.
   *
   * @param thresholdMs new threshold in milliseconds
   * @return updated configuration
   */
  public PerformanceConfig withThresholdMs(double thresholdMs) {
    return new PerformanceConfig(
        enabled, trackMemory, trackCpu, trackDisk, trackNetwork, intervalSeconds, thresholdMs);
  }

  /**
   * Builds a configuration from section-relative keys such as {@code thresholdMs} or {@code trackCpu}.
   *
   * @param kv keys of the {@code performance} section with the prefix removed
   * @return parsed configuration, falling back to {@link #defaults()} per key
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static PerformanceConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    PerformanceConfig d = defaults();
    return new PerformanceConfig(
        ConfigValues.parseBoolean("performance.enabled", kv.get("enabled"), d.enabled()),
        ConfigValues.parseBoolean("performance.trackMemory", kv.get("trackMemory"), d.trackMemory()),
        ConfigValues.parseBoolean("performance.trackCpu", kv.get("trackCpu"), d.trackCpu()),
        ConfigValues.parseBoolean("performance.trackDisk", kv.get("trackDisk"), d.trackDisk()),
        ConfigValues.parseBoolean("performance.trackNetwork", kv.get("trackNetwork"), d.trackNetwork()),
        ConfigValues.parseInt("performance.intervalSeconds", kv.get("intervalSeconds"), d.intervalSeconds()),
        ConfigValues.parseDouble("performance.thresholdMs", kv.get("thresholdMs"), d.thresholdMs()));
  }
}
