package ca.gc.cra.beacon.infrastructure.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.config.ConsoleHandlerConfig;
import ca.gc.cra.beacon.config.FileHandlerConfig;
import ca.gc.cra.beacon.config.LogConfig;
import ca.gc.cra.beacon.config.LogFormat;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HandlerFactoryTest {
  @TempDir Path tempDir;

  private LoggerContext context;
  private HandlerFactory factory;

  @BeforeEach
  void setUp() {
    context = new LoggerContext();
    factory = new HandlerFactory(context);
  }

  @AfterEach
  void tearDown() {
    context.stop();
  }

  @Test
  void createsConsoleAndFileHandlers() {
    LogConfig config = LogConfig.forLogDir(tempDir);

    List<Appender<ILoggingEvent>> appenders = factory.createHandlers("orders", config);

    assertEquals(2, appenders.size());
    assertEquals("orders.console", appenders.get(0).getName());
    assertInstanceOf(ConsoleAppender.class, appenders.get(0));
    assertEquals("orders.file", appenders.get(1).getName());
    assertTrue(Files.exists(tempDir.resolve("orders.log")));
    appenders.forEach(Appender::stop);
  }

  @Test
  void noHandlersWhenEverythingDisabled() {
    ConsoleHandlerConfig console = ConsoleHandlerConfig.defaults();
    LogConfig config = LogConfig.defaults().withConsole(
        new ConsoleHandlerConfig(false, console.level(), console.format(), console.stream(), false));

    assertTrue(factory.createHandlers("orders", config).isEmpty());
  }

  @Test
  void fileHandlerWithoutTargetRejected() {
    LogConfig config = LogConfig.defaults().withFile(FileHandlerConfig.defaults());

    assertThrows(IllegalArgumentException.class, () -> factory.createHandlers("orders", config));
  }

  @Test
  void fileAppenderFiltersBelowThreshold() throws Exception {
    Path file = tempDir.resolve("nested/dir/app.log");
    FileHandlerConfig config = FileHandlerConfig.inDirectory(tempDir).withLevel(LogLevel.WARNING);

    Appender<ILoggingEvent> appender = factory.fileAppender("test.file", file, config, false);
    appender.doAppend(Events.at(Level.INFO, "routine").build());
    appender.doAppend(Events.at(Level.WARN, "unusual").build());
    appender.stop();

    String content = Files.readString(file, StandardCharsets.UTF_8);
    assertFalse(content.contains("routine"), content);
    assertTrue(content.contains(" - orders - WARNING - unusual"), content);
  }

  @Test
  void rotationStrategyFollowsConfig() {
    FileHandlerConfig base = FileHandlerConfig.inDirectory(tempDir);

    Appender<ILoggingEvent> sized = factory.fileAppender(
        "sized", tempDir.resolve("sized.log"), base.withRotation(1024, 4), false);
    Appender<ILoggingEvent> plain = factory.fileAppender(
        "plain", tempDir.resolve("plain.log"), base.withRotation(1024, 0), false);
    Appender<ILoggingEvent> timed = factory.fileAppender(
        "timed", tempDir.resolve("timed.log"), base.withSchedule("midnight", 1), false);

    RollingFileAppender<?> sizedRolling = assertInstanceOf(RollingFileAppender.class, sized);
    FixedWindowRollingPolicy window =
        assertInstanceOf(FixedWindowRollingPolicy.class, sizedRolling.getRollingPolicy());
    assertEquals(4, window.getMaxIndex());
    assertInstanceOf(FileAppender.class, plain);
    assertFalse(plain instanceof RollingFileAppender);
    RollingFileAppender<?> timedRolling = assertInstanceOf(RollingFileAppender.class, timed);
    assertInstanceOf(TimeBasedRollingPolicy.class, timedRolling.getRollingPolicy());
    List.of(sized, plain, timed).forEach(Appender::stop);
  }

  @Test
  void errorFileAcceptsOnlyErrors() throws Exception {
    Appender<ILoggingEvent> appender = factory.errorFileAppender(tempDir);
    appender.doAppend(Events.at(Level.WARN, "warned").build());
    appender.doAppend(Events.at(Level.ERROR, "failed").build());
    appender.stop();

    String content = Files.readString(tempDir.resolve(HandlerFactory.ERROR_FILE), StandardCharsets.UTF_8);
    assertFalse(content.contains("warned"), content);
    assertTrue(content.contains("\"message\":\"failed\""), content);
    assertTrue(content.contains("\"logger_name\":\"orders\""), content);
  }

  @Test
  void performanceAndRequestFilesUseJson() throws Exception {
    Appender<ILoggingEvent> performance = factory.performanceFileAppender(tempDir);
    Appender<ILoggingEvent> requests = factory.requestFileAppender(tempDir);
    performance.doAppend(Events.at(Level.INFO, "Performance: q took 1.200s").build());
    requests.doAppend(Events.at(Level.INFO, "HTTP GET / - 200 (0.010s)").build());
    performance.stop();
    requests.stop();

    assertTrue(Files.readString(tempDir.resolve(HandlerFactory.PERFORMANCE_FILE))
        .contains("\"message\":\"Performance: q took 1.200s\""));
    assertTrue(Files.readString(tempDir.resolve(HandlerFactory.REQUEST_FILE))
        .contains("\"message\":\"HTTP GET / - 200 (0.010s)\""));
  }

  @Test
  void layoutMatchesFormat() {
    assertInstanceOf(ColoredTextLayout.class, factory.layout(LogFormat.TEXT, true, false));
    assertEquals(TextLayout.class, factory.layout(LogFormat.TEXT, false, false).getClass());
    JsonLayout json = assertInstanceOf(JsonLayout.class, factory.layout(LogFormat.JSON, false, true));
    assertTrue(json.isFlatten());
    assertInstanceOf(StructuredLayout.class, factory.layout(LogFormat.STRUCTURED, false, false));
  }

  @Test
  void datePatternPerUnit() {
    assertEquals("yyyy-MM-dd_HH-mm-ss", HandlerFactory.datePattern("S"));
    assertEquals("yyyy-MM-dd_HH", HandlerFactory.datePattern("H"));
    assertEquals("yyyy-MM-dd", HandlerFactory.datePattern("MIDNIGHT"));
    assertEquals("yyyy-ww", HandlerFactory.datePattern("W3"));
  }
}
