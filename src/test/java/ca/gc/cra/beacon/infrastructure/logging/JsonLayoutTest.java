package ca.gc.cra.beacon.infrastructure.logging;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.beacon.domain.value.LogValue;
import ch.qos.logback.classic.Level;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonLayoutTest {

  @Test
  void rendersFixedFields() {
    String json = new JsonLayout().doLayout(Events.at(Level.WARN, "Slow \"query\"").build());

    assertTrue(json.startsWith("{\"timestamp\":\""), json);
    assertTrue(json.contains("\"level\":\"WARNING\""), json);
    assertTrue(json.contains("\"logger\":\"orders\""), json);
    assertTrue(json.contains("\"message\":\"Slow \\\"query\\\"\""), json);
    assertTrue(json.contains("\"thread\":\"main\""), json);
    assertTrue(json.contains("\"module\":\"OrderService\""), json);
    assertTrue(json.contains("\"function\":\"placeOrder\""), json);
    assertTrue(json.contains("\"line\":87"), json);
    assertFalse(json.contains("\"exception\""), json);
    assertTrue(json.endsWith("}" + System.lineSeparator()), json);
  }

  @Test
  void nestsAttributesUnderExtra() {
    String json = new JsonLayout().doLayout(Events.at(Level.INFO, "Order placed")
        .kv("order_id", 42L)
        .kv("total", 19.5)
        .kv("paid", true)
        .build());

    assertTrue(json.contains("\"extra\":{\"order_id\":42,\"total\":19.5,\"paid\":true}"), json);
  }

  @Test
  void flattenPromotesAttributes() {
    JsonLayout layout = new JsonLayout();
    layout.setFlatten(true);

    String json = layout.doLayout(Events.at(Level.INFO, "Order placed").kv("order_id", 42L).build());

    assertTrue(json.contains(",\"order_id\":42}"), json);
    assertFalse(json.contains("\"extra\""), json);
  }

  @Test
  void extraCanBeSuppressed() {
    JsonLayout layout = new JsonLayout();
    layout.setIncludeExtra(false);

    String json = layout.doLayout(Events.at(Level.INFO, "Order placed").kv("order_id", 42L).build());

    assertFalse(json.contains("order_id"), json);
  }

  @Test
  void nestedValuesSerialized() {
    LogValue headers = LogValue.of(Map.of("accept", LogValue.of("text/html")));

    String json = new JsonLayout().doLayout(Events.at(Level.INFO, "req").kv("headers", headers).build());

    assertTrue(json.contains("\"headers\":{\"accept\":\"text/html\"}"), json);
  }

  @Test
  void exceptionIncluded() {
    String json = new JsonLayout().doLayout(
        Events.at(Level.ERROR, "failed").thrown(new IllegalArgumentException("bad input")).build());

    assertTrue(json.contains("\"exception\":\"java.lang.IllegalArgumentException: bad input"), json);
  }
}
