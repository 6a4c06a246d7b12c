package ca.gc.cra.beacon.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FileHandlerConfigTest {

  @Test
  void explicitFilenameWins() {
    FileHandlerConfig config = FileHandlerConfig.inDirectory(Path.of("logs"))
        .withFilename(Path.of("/srv/app/custom.log"));

    assertEquals(Path.of("/srv/app/custom.log"), config.resolveFile("beacon"));
  }

  @Test
  void directoryResolvesLoggerNamedFile() {
    assertEquals(
        Path.of("logs", "orders.log"),
        FileHandlerConfig.inDirectory(Path.of("logs")).resolveFile("orders"));
  }

  @Test
  void missingTargetRejected() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class, () -> FileHandlerConfig.defaults().resolveFile("beacon"));
    assertEquals("Either filename or directory must be specified for file handler", ex.getMessage());
  }

  @Test
  void parsesSizesAndSchedule() {
    FileHandlerConfig config = FileHandlerConfig.fromMap(
        Map.of("directory", "logs", "maxBytes", "2MB", "backupCount", "3", "when", "midnight", "interval", "2"),
        LogFormat.JSON);

    assertEquals(2L * 1024 * 1024, config.maxBytes());
    assertEquals(3, config.backupCount());
    assertEquals("MIDNIGHT", config.when());
    assertEquals(2, config.interval());
    assertEquals(LogFormat.JSON, config.format());
    assertTrue(config.timeBased());
  }

  @Test
  void sizeRotationIsDefault() {
    FileHandlerConfig config = FileHandlerConfig.defaults();

    assertFalse(config.timeBased());
    assertEquals(FileHandlerConfig.DEFAULT_MAX_BYTES, config.maxBytes());
    assertEquals(FileHandlerConfig.DEFAULT_BACKUP_COUNT, config.backupCount());
  }

  @Test
  void rejectsInvalidRotation() {
    FileHandlerConfig base = FileHandlerConfig.defaults();

    assertThrows(IllegalArgumentException.class, () -> base.withRotation(0, 1));
    assertThrows(IllegalArgumentException.class, () -> base.withRotation(1024, -1));
    assertThrows(IllegalArgumentException.class, () -> base.withSchedule("fortnight", 1));
    assertThrows(IllegalArgumentException.class, () -> base.withSchedule("H", 0));
    assertThrows(
        IllegalArgumentException.class,
        () -> FileHandlerConfig.fromMap(Map.of("maxBytes", "lots"), LogFormat.TEXT));
  }
}
