package ca.gc.cra.beacon.infrastructure.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.beacon.domain.log.LogLevel;
import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

class LevelMappingTest {

  @Test
  void mapsToLogbackLevels() {
    assertEquals(Level.DEBUG, LevelMapping.toLogback(LogLevel.DEBUG));
    assertEquals(Level.INFO, LevelMapping.toLogback(LogLevel.INFO));
    assertEquals(Level.WARN, LevelMapping.toLogback(LogLevel.WARNING));
    assertEquals(Level.ERROR, LevelMapping.toLogback(LogLevel.ERROR));
    assertEquals(Level.ERROR, LevelMapping.toLogback(LogLevel.CRITICAL));
  }

  @Test
  void displayNamesUseBeaconVocabulary() {
    assertEquals("WARNING", LevelMapping.displayName(Events.at(Level.WARN, "w").build()));
    assertEquals("ERROR", LevelMapping.displayName(Events.at(Level.ERROR, "e").build()));
    assertEquals(
        "CRITICAL",
        LevelMapping.displayName(Events.at(Level.ERROR, "c").marker(LevelMapping.CRITICAL).build()));
    assertEquals("DEBUG", LevelMapping.displayName(Events.at(Level.DEBUG, "d").build()));
  }
}
