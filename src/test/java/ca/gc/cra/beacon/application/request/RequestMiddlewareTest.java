package ca.gc.cra.beacon.application.request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.beacon.config.RequestLoggingConfig;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.value.LogValue;
import ca.gc.cra.beacon.infrastructure.logging.InMemoryLogSink;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RequestMiddlewareTest {

  @Test
  void missingValuesFallBackToDefaults() {
    InMemoryLogSink sink = new InMemoryLogSink();
    RequestMiddleware middleware = new RequestMiddleware(
        new RequestLogger(sink, RequestLoggingConfig.defaults()));

    middleware.handle(new Exchange(null, null, null, null, null), 0.05);

    InMemoryLogSink.Entry entry = sink.entries().get(0);
    assertEquals(LogLevel.INFO, entry.level());
    assertEquals("HTTP UNKNOWN / - 200 (0.050s)", entry.message());
    assertNull(entry.attribute("user_agent"));
  }

  @Test
  void userAgentMatchedCaseInsensitively() {
    InMemoryLogSink sink = new InMemoryLogSink();
    RequestMiddleware middleware = new RequestMiddleware(
        new RequestLogger(sink, RequestLoggingConfig.defaults().withHeaders(true)));
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("user-agent", "Mozilla/5.0");
    headers.put("Authorization", "Basic xyz");

    middleware.handle(
        new Exchange("DELETE", "/items/4", 204, headers, "192.168.1.20"),
        0.3,
        Map.of("route", LogValue.of("items")));

    InMemoryLogSink.Entry entry = sink.entries().get(0);
    assertEquals("HTTP DELETE /items/4 - 204 (0.300s)", entry.message());
    assertEquals("Mozilla/5.0", entry.attribute("user_agent").asString());
    assertEquals("192.168.1.20", entry.attribute("ip_address").asString());
    assertEquals(Map.of("user-agent", LogValue.of("Mozilla/5.0")), entry.attribute("headers").asMap());
    assertEquals("items", entry.attribute("route").asString());
  }

  @Test
  void serverErrorStatusLoggedAsError() {
    InMemoryLogSink sink = new InMemoryLogSink();
    RequestMiddleware middleware = new RequestMiddleware(
        new RequestLogger(sink, RequestLoggingConfig.defaults()));

    middleware.handle(new Exchange("PUT", "/jobs", 502, Map.of(), null), 2.0, null);

    assertEquals(LogLevel.ERROR, sink.entries().get(0).level());
  }

  private record Exchange(
      String method, String path, Integer statusCode, Map<String, String> headers, String clientIp)
      implements RequestExchange {}
}
