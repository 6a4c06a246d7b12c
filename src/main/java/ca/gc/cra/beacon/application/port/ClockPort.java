package ca.gc.cra.beacon.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Domain port supplying timestamps and a monotonic tick source.
 * <p><strong>Why:</strong> Samples carry wall-clock instants while scoped timing must measure elapsed time with a
 * clock that ignores wall-clock adjustments; tests inject deterministic values for both.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; clock reads occur on any recording
 * thread.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @implNote {@link #SYSTEM} delegates to {@link Instant#now()} and {@link System#nanoTime()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current wall-clock instant in UTC.
   *
   * @return current instant
   */
  Instant now();

  /**
   * Returns a monotonic tick in nanoseconds. Only differences between two readings are meaningful.
   *
   * @return monotonic nanoseconds
   */
  long monotonicNanos();

  /**
   * Default {@link ClockPort} backed by the JVM clocks.
   *
   * <p><strong>Concurrency:</strong> Thread-safe.</p>
   */
  ClockPort SYSTEM = new ClockPort() {
    @Override
    public Instant now() {
      return Instant.now();
    }

    @Override
    public long monotonicNanos() {
      return System.nanoTime();
    }
  };
}
