package ca.gc.cra.beacon.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void requireLoggerNameAllowsDottedNames() {
    assertEquals("app.orders-v2$inner_1", Strings.requireLoggerName("name", " app.orders-v2$inner_1 "));
  }

  @Test
  void requireLoggerNameRejectsInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireLoggerName("name", "app orders"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireLoggerName("name", "app/orders"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("format", "v☃l", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("format", "abc", 2));
  }
}
