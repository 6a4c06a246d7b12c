package ca.gc.cra.beacon.infrastructure.logging;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

class TextLayoutTest {

  @Test
  void rendersNameLevelAndMessage() {
    TextLayout layout = new TextLayout();

    String line = layout.doLayout(Events.at(Level.WARN, "Disk almost full").build());

    assertTrue(line.contains(" - orders - WARNING - Disk almost full"), line);
    assertFalse(line.contains("["), line);
  }

  @Test
  void correlationIdsPrecedeContext() {
    TextLayout layout = new TextLayout();

    String line = layout.doLayout(Events.at(Level.INFO, "Order placed")
        .kv("order_id", 42L)
        .kv("session_id", "s-9")
        .kv("user_id", "u-1")
        .build());

    assertTrue(line.contains("Order placed [user=u-1 session=s-9 order_id=42]"), line);
  }

  @Test
  void contextCanBeDisabled() {
    TextLayout layout = new TextLayout();
    layout.setIncludeContext(false);

    String line = layout.doLayout(Events.at(Level.INFO, "Order placed").kv("user_id", "u-1").build());

    assertFalse(line.contains("user=u-1"), line);
  }

  @Test
  void appendsStackTrace() {
    TextLayout layout = new TextLayout();

    String text = layout.doLayout(
        Events.at(Level.ERROR, "Payment failed").thrown(new IllegalStateException("card declined")).build());

    assertTrue(text.contains("java.lang.IllegalStateException: card declined"), text);
  }

  @Test
  void criticalMarkerRendered() {
    String line = new TextLayout().doLayout(
        Events.at(Level.ERROR, "Halting").marker(LevelMapping.CRITICAL).build());

    assertTrue(line.contains(" - CRITICAL - Halting"), line);
  }
}
