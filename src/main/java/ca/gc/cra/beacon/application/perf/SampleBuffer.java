package ca.gc.cra.beacon.application.perf;

import ca.gc.cra.beacon.domain.perf.PerformanceSample;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded, append-only sequence of performance samples guarded by a single exclusive lock.
 *
 * <p>Insertion order equals lock-acquisition order. Append, snapshot and clear all take the same lock, so
 * readers and writers serialize; under heavy read load this is the first contention point.</p>
 */
public final class SampleBuffer {
  private final List<PerformanceSample> samples = new ArrayList<>();
  private final ReentrantLock lock = new ReentrantLock();

  /**
   * Appends a sample at the end of the buffer.
   *
   * @param sample sample to append; must not be {@code null}
   */
  public void append(PerformanceSample sample) {
    Objects.requireNonNull(sample, "sample");
    lock.lock();
    try {
      samples.add(sample);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Copies the current contents.
   *
   * @return immutable copy in insertion order; later appends do not affect it
   */
  public List<PerformanceSample> snapshot() {
    lock.lock();
    try {
      return List.copyOf(samples);
    } finally {
      lock.unlock();
    }
  }

  /** Removes every sample. Calling it on an empty buffer is a no-op. */
  public void clear() {
    lock.lock();
    try {
      samples.clear();
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return samples.size();
    } finally {
      lock.unlock();
    }
  }
}
