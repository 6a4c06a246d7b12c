package ca.gc.cra.beacon.testutil;

import ca.gc.cra.beacon.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/** Manually advanced clock; wall and monotonic time move together. */
public final class FakeClock implements ClockPort {
  private final Instant origin;
  private final AtomicLong nanos = new AtomicLong();

  public FakeClock(Instant origin) {
    this.origin = origin;
  }

  public FakeClock() {
    this(Instant.parse("2024-01-15T10:00:00Z"));
  }

  public void advance(Duration duration) {
    nanos.addAndGet(duration.toNanos());
  }

  public void advanceSeconds(double seconds) {
    nanos.addAndGet(Math.round(seconds * 1_000_000_000d));
  }

  @Override
  public Instant now() {
    return origin.plusNanos(nanos.get());
  }

  @Override
  public long monotonicNanos() {
    return nanos.get();
  }
}
