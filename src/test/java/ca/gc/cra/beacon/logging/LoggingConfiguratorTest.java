package ca.gc.cra.beacon.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.MetricsPort;
import ca.gc.cra.beacon.config.BeaconRuntime;
import ca.gc.cra.beacon.config.ConsoleHandlerConfig;
import ca.gc.cra.beacon.config.LogConfig;
import ca.gc.cra.beacon.config.PerformanceConfig;
import ca.gc.cra.beacon.infrastructure.logging.HandlerFactory;
import ca.gc.cra.beacon.infrastructure.logging.InMemoryLogSink;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.util.ContextInitializer;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  @TempDir Path tempDir;

  @AfterEach
  void restoreLogback() throws Exception {
    LoggerContext context = HandlerFactory.loggerContext();
    context.reset();
    new ContextInitializer(context).autoConfig();
  }

  @Test
  void setupLoggerWritesToLogDirectory() throws Exception {
    Logger logger = (Logger) LoggingConfigurator.setupLogger("orders.audit", tempDir, true);

    logger.info("order accepted");

    assertEquals(Level.DEBUG, logger.getLevel());
    assertFalse(logger.isAdditive());
    assertNotNull(logger.getAppender("orders.audit.file"));
    assertTrue(Files.readString(tempDir.resolve("orders.audit.log")).contains("order accepted"));
  }

  @Test
  void setupLoggerReplacesPreviousHandlers() {
    LoggingConfigurator.setupLogger("orders.replace", tempDir, false);
    Logger logger = (Logger) LoggingConfigurator.setupLogger("orders.replace", tempDir, false);

    assertEquals(Level.INFO, logger.getLevel());
    assertEquals(2, appenders(logger).size());
  }

  @Test
  void setupLoggerRejectsInvalidName() {
    assertThrows(IllegalArgumentException.class, () -> LoggingConfigurator.setupLogger("bad name", tempDir, false));
  }

  @Test
  void setupLoggingFromMapUsesConfiguredName() {
    Logger logger = (Logger) LoggingConfigurator.setupLoggingFromMap(
        Map.of("name", "svc.map", "level", "warning", "console.enabled", "false", "propagate", "true"));

    assertEquals("svc.map", logger.getName());
    assertEquals(Level.WARN, logger.getLevel());
    assertTrue(logger.isAdditive());
    assertTrue(appenders(logger).isEmpty());
  }

  @Test
  void setupLoggingFromEnvReadsBeaconVariables() {
    Logger logger = (Logger) LoggingConfigurator.setupLoggingFromEnv(
        Map.of("BEACON_LOG_NAME", "svc.env", "BEACON_LOG_LEVEL", "error", "BEACON_LOG_DIR", tempDir.toString()));

    assertEquals("svc.env", logger.getName());
    assertEquals(Level.ERROR, logger.getLevel());
    assertTrue(Files.exists(tempDir.resolve("svc.env.log")));
  }

  @Test
  void logRotationAttachesRollingAppFile() {
    LoggingConfigurator.setupLogRotation(tempDir, 1024 * 1024, 3, null, 1);

    Logger root = root();
    assertEquals(Level.DEBUG, root.getLevel());
    assertInstanceOf(RollingFileAppender.class, root.getAppender("root.file"));
    assertNotNull(root.getAppender("root.console"));
    assertTrue(Files.exists(tempDir.resolve(HandlerFactory.APP_FILE)));
  }

  @Test
  void logAggregationSplitsFilesByConcern() throws Exception {
    LogConfig config = LogConfig.forLogDir(tempDir)
        .withConsole(new ConsoleHandlerConfig(false, ConsoleHandlerConfig.defaults().level(),
            ConsoleHandlerConfig.defaults().format(), ConsoleHandlerConfig.defaults().stream(), false));

    LoggingConfigurator.setupLogAggregation(tempDir, config);
    LoggerFactory.getLogger("agg.service").info("service started");
    LoggerFactory.getLogger("agg.service").error("service failed");
    LoggerFactory.getLogger(LoggingConfigurator.PERFORMANCE_LOGGER).info("Performance: sync took 2.000s");
    LoggerFactory.getLogger(LoggingConfigurator.REQUEST_LOGGER).warn("HTTP GET /missing - 404 (0.010s)");

    String app = Files.readString(tempDir.resolve(HandlerFactory.APP_FILE));
    String errors = Files.readString(tempDir.resolve(HandlerFactory.ERROR_FILE));
    String performance = Files.readString(tempDir.resolve(HandlerFactory.PERFORMANCE_FILE));
    String requests = Files.readString(tempDir.resolve(HandlerFactory.REQUEST_FILE));

    assertTrue(app.contains("service started"), app);
    assertTrue(app.contains("Performance: sync took 2.000s"), app);
    assertTrue(errors.contains("service failed"), errors);
    assertFalse(errors.contains("service started"), errors);
    assertTrue(performance.contains("\"message\":\"Performance: sync took 2.000s\""), performance);
    assertFalse(performance.contains("service started"), performance);
    assertTrue(requests.contains("HTTP GET /missing - 404"), requests);
    assertNull(root().getAppender("root.console"));
  }

  @Test
  void productionLoggingWritesJson() throws Exception {
    LoggingConfigurator.setupProductionLogging(tempDir);
    LoggerFactory.getLogger("prod.service").info("ready");

    String app = Files.readString(tempDir.resolve(HandlerFactory.APP_FILE));
    assertTrue(app.contains("\"message\":\"ready\""), app);
    assertTrue(Files.exists(tempDir.resolve(HandlerFactory.ERROR_FILE)));
  }

  @Test
  void developmentLoggingUsesDebugConsole() {
    LoggingConfigurator.setupDevelopmentLogging();

    assertEquals(Level.DEBUG, root().getLevel());
    assertNotNull(root().getAppender("root.console"));
  }

  @Test
  void performanceMonitoringReplacesTrackerAndFileHandler() {
    BeaconRuntime runtime = new BeaconRuntime(
        LogConfig.defaults(), MetricsPort.NO_OP, ClockPort.SYSTEM, name -> new InMemoryLogSink());
    runtime.logPerformance("warmup", 0.1);

    LoggingConfigurator.setupPerformanceMonitoring(runtime, PerformanceConfig.defaults().withThresholdMs(50), tempDir);
    LoggingConfigurator.setupPerformanceMonitoring(runtime, PerformanceConfig.defaults().withThresholdMs(50), tempDir);

    assertEquals(0, runtime.performanceTracker().size());
    assertEquals(50d, runtime.performanceTracker().config().thresholdMs());
    Logger performance = (Logger) LoggerFactory.getLogger(LoggingConfigurator.PERFORMANCE_LOGGER);
    assertEquals(1, appenders(performance).size());
    assertEquals(Level.INFO, performance.getLevel());
  }

  @Test
  void verboseLoggingRaisesRootToDebug() {
    LoggingConfigurator.enableVerboseLogging();

    assertEquals(Level.DEBUG, root().getLevel());
  }

  @Test
  void blankNameResolvesToRoot() {
    assertEquals(org.slf4j.Logger.ROOT_LOGGER_NAME, LoggingConfigurator.getLogger(" ").getName());
    assertEquals("svc", LoggingConfigurator.getLogger("svc").getName());
  }

  private static Logger root() {
    return HandlerFactory.loggerContext().getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  }

  private static List<Appender<ILoggingEvent>> appenders(Logger logger) {
    List<Appender<ILoggingEvent>> result = new ArrayList<>();
    for (Iterator<Appender<ILoggingEvent>> it = logger.iteratorForAppenders(); it.hasNext(); ) {
      result.add(it.next());
    }
    return result;
  }
}
