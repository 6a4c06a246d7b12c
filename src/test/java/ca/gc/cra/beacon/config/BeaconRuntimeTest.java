package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.beacon.application.perf.PerformanceTracker;
import ca.gc.cra.beacon.application.perf.TrackedOperation;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.infrastructure.logging.InMemoryLogSink;
import ca.gc.cra.beacon.testutil.FakeClock;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BeaconRuntimeTest {
  private final InMemoryLogSink performanceSink = new InMemoryLogSink();
  private final InMemoryLogSink requestSink = new InMemoryLogSink();
  private final InMemoryLogSink trainingSink = new InMemoryLogSink();
  private final FakeClock clock = new FakeClock();

  @AfterEach
  void resetGlobal() {
    BeaconRuntime.installGlobal(null);
  }

  @Test
  void trackerCreatedOnceOnFirstAccess() {
    BeaconRuntime runtime = runtime(LogConfig.defaults());

    PerformanceTracker first = runtime.performanceTracker();

    assertSame(first, runtime.performanceTracker());
    assertEquals(1000d, first.config().thresholdMs());
  }

  @Test
  void logPerformanceEmitsAboveThreshold() {
    BeaconRuntime runtime = runtime(LogConfig.defaults());

    runtime.logPerformance("fast", 0.2);
    runtime.logPerformance("slow", 1.5);

    assertEquals(2, runtime.performanceTracker().size());
    assertEquals(1, performanceSink.size());
    assertEquals("Performance: slow took 1.500s", performanceSink.entries().get(0).message());
  }

  @Test
  void setupPerformanceLoggingDiscardsPreviousSamples() {
    BeaconRuntime runtime = runtime(LogConfig.defaults());
    PerformanceTracker original = runtime.performanceTracker();
    runtime.logPerformance("query", 0.3);

    PerformanceTracker replacement =
        runtime.setupPerformanceLogging(PerformanceConfig.defaults().withThresholdMs(100));

    assertNotSame(original, replacement);
    assertSame(replacement, runtime.performanceTracker());
    assertEquals(0, replacement.size());
    runtime.logPerformance("query", 0.3);
    assertEquals(1, performanceSink.size());
  }

  @Test
  void trackOperationRecordsOnDefaultTracker() {
    BeaconRuntime runtime = runtime(LogConfig.defaults());

    try (TrackedOperation op = runtime.trackOperation("export", null, "u-1", null, null)) {
      clock.advanceSeconds(0.25);
    }

    assertEquals(0.25, runtime.performanceTracker().getMetrics().get(0).duration(), 1e-9);
    assertEquals("u-1", runtime.performanceTracker().getMetrics().get(0).userId());
  }

  @Test
  void requestAndTrainingLoggersUseNamedSinks() {
    BeaconRuntime runtime = runtime(LogConfig.defaults());

    assertSame(runtime.requestLogger(), runtime.requestLogger());
    runtime.requestLogger().logRequest("GET", "/health", 200, 0.001);
    runtime.trainingLogger().logModelLoad(3L, "/models/3", null);

    assertEquals(LogLevel.INFO, requestSink.entries().get(0).level());
    assertEquals("Model event: model_loaded", trainingSink.entries().get(0).message());
  }

  @Test
  void loggersHonourConfiguredSections() {
    LogConfig config = LogConfig.defaults()
        .withRequest(RequestLoggingConfig.defaults().withEnabled(false))
        .withTraining(new TrainingLoggingConfig(false, true, true, true, true));
    BeaconRuntime runtime = runtime(config);

    runtime.requestLogger().logRequest("GET", "/", 200, 0.1);
    runtime.trainingLogger().logTrainingEvent("s", "x", null);

    assertEquals(0, requestSink.size());
    assertEquals(0, trainingSink.size());
  }

  @Test
  void globalCreatedLazilyAndReplaceable() {
    BeaconRuntime installed = runtime(LogConfig.defaults());

    assertNull(BeaconRuntime.installGlobal(installed));
    assertSame(installed, BeaconRuntime.global());
    assertSame(installed, BeaconRuntime.installGlobal(null));
    BeaconRuntime fresh = BeaconRuntime.global();
    assertNotSame(installed, fresh);
    assertSame(fresh, BeaconRuntime.global());
  }

  private BeaconRuntime runtime(LogConfig config) {
    Map<String, InMemoryLogSink> sinks = Map.of(
        BeaconRuntime.PERFORMANCE_LOGGER, performanceSink,
        BeaconRuntime.REQUEST_LOGGER, requestSink,
        BeaconRuntime.TRAINING_LOGGER, trainingSink);
    return new BeaconRuntime(config, MetricsPort.NO_OP, clock, sinks::get);
  }
}
