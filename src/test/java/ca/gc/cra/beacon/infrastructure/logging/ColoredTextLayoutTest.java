package ca.gc.cra.beacon.infrastructure.logging;

import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

class ColoredTextLayoutTest {

  @Test
  void wrapsLevelInColour() {
    ColoredTextLayout layout = new ColoredTextLayout();

    String error = layout.doLayout(Events.at(Level.ERROR, "boom").build());
    String info = layout.doLayout(Events.at(Level.INFO, "ok").build());

    assertTrue(error.contains("\u001B[31mERROR" + ColoredTextLayout.RESET + " - boom"), error);
    assertTrue(info.contains("\u001B[32mINFO" + ColoredTextLayout.RESET), info);
  }

  @Test
  void criticalUsesMagenta() {
    String line = new ColoredTextLayout().doLayout(
        Events.at(Level.ERROR, "halt").marker(LevelMapping.CRITICAL).build());

    assertTrue(line.contains("\u001B[35mCRITICAL" + ColoredTextLayout.RESET), line);
  }
}
