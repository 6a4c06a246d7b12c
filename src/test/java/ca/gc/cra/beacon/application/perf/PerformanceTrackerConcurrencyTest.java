package ca.gc.cra.beacon.application.perf;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.LogSink;
import ca.gc.cra.beacon.config.PerformanceConfig;
import ca.gc.cra.beacon.domain.perf.PerformanceSample;
import ca.gc.cra.beacon.testutil.RecordingMetrics;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PerformanceTrackerConcurrencyTest {
  private static final int THREADS = 8;
  private static final int PER_THREAD = 100;

  @Test
  void concurrentRecordsAreAllKeptIntact() throws Exception {
    RecordingMetrics metrics = new RecordingMetrics();
    PerformanceTracker tracker =
        new PerformanceTracker(PerformanceConfig.defaults(), LogSink.NO_OP, ClockPort.SYSTEM, metrics);
    ExecutorService pool = Executors.newFixedThreadPool(THREADS);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < THREADS; t++) {
        String operation = "worker-" + t;
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < PER_THREAD; i++) {
            tracker.record(operation, i / 1000.0);
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    List<PerformanceSample> samples = tracker.getMetrics();
    assertEquals(THREADS * PER_THREAD, samples.size());
    assertEquals(THREADS * PER_THREAD, metrics.count("performance.recorded"));

    Map<String, Integer> nextIndex = new HashMap<>();
    for (PerformanceSample sample : samples) {
      assertTrue(sample.operation().startsWith("worker-"));
      int expected = nextIndex.getOrDefault(sample.operation(), 0);
      assertEquals(expected / 1000.0, sample.duration(), 1e-12, "per-thread order for " + sample.operation());
      nextIndex.put(sample.operation(), expected + 1);
    }
    nextIndex.values().forEach(count -> assertEquals(PER_THREAD, count));
  }
}
