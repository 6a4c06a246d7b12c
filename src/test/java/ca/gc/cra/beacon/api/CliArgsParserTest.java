package ca.gc.cra.beacon.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"level=debug", "logDir=/tmp/beacon logs"});

    assertEquals(List.of("level", "logDir"), List.copyOf(map.keySet()));
    assertEquals("debug", map.get("level"));
    assertEquals("/tmp/beacon logs", map.get("logDir"));
  }

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelEndpoint=http://collector:4317/?a=b"});

    assertEquals("http://collector:4317/?a=b", map.get("otelEndpoint"));
  }

  @Test
  void skipsBlankArguments() {
    assertTrue(CliArgsParser.toMap(new String[] {" ", ""}).isEmpty());
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedArguments() {
    IllegalArgumentException missing = assertThrows(
        IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertEquals("argument must be key=value (was 'invalid')", missing.getMessage());
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=value"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    IllegalArgumentException badKey = assertThrows(
        IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=value"}));
    assertEquals("invalid argument name: bad key", badKey.getMessage());
  }
}
