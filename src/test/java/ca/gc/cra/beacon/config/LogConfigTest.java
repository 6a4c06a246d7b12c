package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.log.LogLevel;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LogConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    LogConfig config = LogConfig.defaults();

    assertEquals(LogLevel.INFO, config.level());
    assertEquals(LogFormat.TEXT, config.format());
    assertNull(config.name());
    assertEquals("beacon", config.effectiveName());
    assertTrue(config.console().enabled());
    assertEquals(ConsoleStream.STDOUT, config.console().stream());
    assertTrue(config.fileHandler().isEmpty());
    assertEquals(1000d, config.performance().thresholdMs());
    assertFalse(config.request().logHeaders());
    assertTrue(config.request().logQueryParams());
    assertTrue(config.training().logHyperparameters());
    assertFalse(config.propagate());
  }

  @Test
  void fromMapReadsNestedSections() {
    Map<String, String> kv = Map.of(
        "level", "debug",
        "format", "json",
        "name", "svc.api",
        "console.colored", "true",
        "console.stream", "stderr",
        "performance.thresholdMs", "250",
        "request.logHeaders", "yes",
        "request.sensitiveHeaders", "[Authorization, X-Api-Key]",
        "training.logMetrics", "off",
        "propagate", "true");

    LogConfig config = LogConfig.fromMap(kv);

    assertEquals(LogLevel.DEBUG, config.level());
    assertEquals(LogFormat.JSON, config.format());
    assertEquals("svc.api", config.effectiveName());
    assertTrue(config.console().colored());
    assertEquals(ConsoleStream.STDERR, config.console().stream());
    assertEquals(LogFormat.JSON, config.console().format());
    assertEquals(250d, config.performance().thresholdMs());
    assertTrue(config.request().logHeaders());
    assertEquals(List.of("Authorization", "X-Api-Key"), config.request().sensitiveHeaders());
    assertFalse(config.training().logMetrics());
    assertTrue(config.propagate());
  }

  @Test
  void logDirFillsFileDirectory() {
    LogConfig config = LogConfig.fromMap(Map.of("logDir", "/var/log/beacon", "file.level", "warning"));

    FileHandlerConfig file = config.fileHandler().orElseThrow();
    assertEquals(Path.of("/var/log/beacon"), file.directory());
    assertEquals(LogLevel.WARNING, file.level());
    assertEquals(Path.of("/var/log/beacon", "beacon.log"), file.resolveFile(config.effectiveName()));
  }

  @Test
  void disabledFileSectionYieldsNoHandler() {
    LogConfig config = LogConfig.fromMap(Map.of("file.directory", "/tmp/logs", "file.enabled", "false"));

    assertTrue(config.fileHandler().isEmpty());
  }

  @Test
  void withFormatPropagatesToHandlers() {
    LogConfig config = LogConfig.forLogDir(Path.of("logs")).withFormat(LogFormat.STRUCTURED);

    assertEquals(LogFormat.STRUCTURED, config.console().format());
    assertEquals(LogFormat.STRUCTURED, config.fileHandler().orElseThrow().format());
  }

  @Test
  void blankNameFallsBackToDefault() {
    assertEquals("beacon", LogConfig.defaults().withName("  ").effectiveName());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> LogConfig.fromMap(Map.of("level", "loud")));
    assertThrows(IllegalArgumentException.class, () -> LogConfig.fromMap(Map.of("format", "xml")));
    assertThrows(IllegalArgumentException.class, () -> LogConfig.fromMap(Map.of("propagate", "maybe")));
    assertThrows(
        IllegalArgumentException.class, () -> LogConfig.fromMap(Map.of("performance.thresholdMs", "-1")));
    assertThrows(IllegalArgumentException.class, () -> LogConfig.fromMap(Map.of("console.stream", "tty")));
  }
}
