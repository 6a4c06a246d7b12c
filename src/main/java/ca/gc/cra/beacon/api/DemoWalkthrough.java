package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.perf.PerformanceTracker;
import ca.gc.cra.beacon.application.perf.TrackedOperation;
import ca.gc.cra.beacon.application.request.RequestExchange;
import ca.gc.cra.beacon.application.request.RequestLogEntry;
import ca.gc.cra.beacon.application.request.RequestLogger;
import ca.gc.cra.beacon.application.request.RequestMiddleware;
import ca.gc.cra.beacon.application.training.TrainingLogger;
import ca.gc.cra.beacon.config.BeaconRuntime;
import ca.gc.cra.beacon.domain.perf.PerformanceStatistics;
import ca.gc.cra.beacon.domain.value.LogValue;
import ca.gc.cra.beacon.infrastructure.logging.LevelMapping;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.zip.CRC32;
import org.slf4j.Logger;

/**
 * Exercises each logging surface once so the configured handlers show representative output.
 */
final class DemoWalkthrough {
  private static final String USER_ID = "user123";
  private static final String SESSION_ID = "session-7f3a";

  private final Logger logger;
  private final BeaconRuntime runtime;

  DemoWalkthrough(Logger logger, BeaconRuntime runtime) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
  }

  void run() throws Exception {
    basicLogging();
    structuredLogging();
    performanceLogging();
    requestLogging();
    trainingLogging();
  }

  void basicLogging() {
    logger.debug("Debug details are visible when the level is DEBUG");
    logger.info("Application started");
    logger.warn("Disk usage above 80%");
    logger.error("Failed to reach the payment service", new IllegalStateException("connection refused"));
    logger.atError().addMarker(LevelMapping.CRITICAL).log("Primary database unavailable");
  }

  void structuredLogging() {
    logger.atInfo()
        .addKeyValue("user_id", USER_ID)
        .addKeyValue("session_id", SESSION_ID)
        .addKeyValue("action", "login")
        .addKeyValue("ip_address", "192.168.1.10")
        .log("User logged in");
    logger.atInfo()
        .addKeyValue("request_id", "req-001")
        .addKeyValue("items", 3)
        .addKeyValue("total", 59.97)
        .log("Order placed");
  }

  void performanceLogging() throws Exception {
    runtime.logPerformance("database_query", 0.15, Map.of("table", LogValue.of("users")), USER_ID, null, null);
    runtime.logPerformance("report_generation", 1.25, Map.of("rows", LogValue.of(5_000L)), USER_ID,
        SESSION_ID, "req-002");

    try (TrackedOperation ignored = runtime.trackOperation(
        "checksum", Map.of("blocks", LogValue.of(2_000L)), null, null, "req-003")) {
      checksum(2_000);
    }
    PerformanceTracker tracker = runtime.performanceTracker();
    long value = tracker.time("checksum", () -> checksum(500));
    logger.debug("Checksum result {}", value);
  }

  void requestLogging() {
    RequestLogger requests = runtime.requestLogger();
    requests.logRequest(RequestLogEntry.builder("GET", "/api/users", 200, 0.042)
        .userAgent("Mozilla/5.0")
        .ipAddress("192.168.1.10")
        .header("Accept", "application/json")
        .header("Authorization", "Bearer secret-token")
        .queryParam("page", LogValue.of(1L))
        .userId(USER_ID)
        .requestId("req-004")
        .build());
    requests.logRequest("GET", "/api/users/999", 404, 0.008);
    requests.logRequest(RequestLogEntry.builder("POST", "/api/orders", 500, 1.317)
        .body("{\"sku\":\"A-100\",\"quantity\":2}")
        .requestId("req-005")
        .extra("error_code", LogValue.of("ORD-17"))
        .build());

    RequestMiddleware middleware = new RequestMiddleware(requests);
    middleware.handle(new DemoExchange("DELETE", "/api/sessions/" + SESSION_ID, 204), 0.011,
        Map.of("reason", LogValue.of("logout")));
  }

  void trainingLogging() {
    TrainingLogger training = runtime.trainingLogger();
    String session = "train-001";
    Map<String, LogValue> hyperparameters = new LinkedHashMap<>();
    hyperparameters.put("learning_rate", LogValue.of(0.001));
    hyperparameters.put("batch_size", LogValue.of(32L));
    training.logTrainingStart(session, "sentiment-classifier", hyperparameters,
        Map.of("samples", LogValue.of(10_000L)), null);
    double loss = 0.9;
    for (long step = 1; step <= 3; step++) {
      loss *= 0.7;
      training.logTrainingStep(session, step, 1, loss, Map.of("accuracy", LogValue.of(0.6 + step * 0.1)), null);
    }
    training.logValidation(session, 1, loss * 1.1, Map.of("accuracy", LogValue.of(0.88)), null);
    training.logCheckpoint(session, "checkpoints/epoch-1.ckpt", 1, Map.of("loss", LogValue.of(loss)), null);
    training.logTrainingEnd(session, Map.of("accuracy", LogValue.of(0.9)), 12.5, null);
    training.logModelSave(42L, "models/sentiment-v1.bin", Map.of("format", LogValue.of("onnx")), null);
    training.logModelLoad(42L, "models/sentiment-v1.bin", null);
  }

  void printStatistics() {
    PerformanceTracker tracker = runtime.performanceTracker();
    CliPrinter.println("Performance statistics");
    print("all", tracker.getStatistics());
    Set<String> operations = new LinkedHashSet<>();
    tracker.getMetrics().forEach(sample -> operations.add(sample.operation()));
    for (String operation : operations) {
      print(operation, tracker.getStatistics(operation, null));
    }
  }

  private static void print(String label, PerformanceStatistics stats) {
    CliPrinter.printf("  %-18s count=%d total=%.3fs avg=%.3fs min=%.3fs max=%.3fs p95=%.3fs p99=%.3fs%n",
        label, stats.count(), stats.totalDuration(), stats.avgDuration(), stats.minDuration(),
        stats.maxDuration(), stats.p95Duration(), stats.p99Duration());
  }

  private static long checksum(int blocks) {
    CRC32 crc = new CRC32();
    byte[] block = "beacon-demo-block".getBytes(StandardCharsets.UTF_8);
    for (int i = 0; i < blocks; i++) {
      crc.update(block);
      crc.update(i);
    }
    return crc.getValue();
  }

  private record DemoExchange(String method, String path, Integer statusCode) implements RequestExchange {
    @Override
    public Map<String, String> headers() {
      return Map.of("User-Agent", "beacon-demo/0.1");
    }
  }
}
