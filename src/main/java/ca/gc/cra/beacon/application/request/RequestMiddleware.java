package ca.gc.cra.beacon.application.request;

import ca.gc.cra.beacon.domain.value.LogValue;
import java.util.Map;
import java.util.Objects;

/**
 * Adapts framework request/response objects to {@link RequestLogger}.
 *
 * <p>Missing values default to method {@code UNKNOWN}, path {@code /} and status {@code 200}. The user agent is
 * read from the {@code User-Agent} header, matched case-insensitively.</p>
 *
 * @since 0.1.0
 */
public final class RequestMiddleware {
  static final String DEFAULT_METHOD = "UNKNOWN";
  static final String DEFAULT_PATH = "/";
  static final int DEFAULT_STATUS = 200;

  private final RequestLogger requestLogger;

  public RequestMiddleware(RequestLogger requestLogger) {
    this.requestLogger = Objects.requireNonNull(requestLogger, "requestLogger");
  }

  /**
   * Logs a finished exchange.
   *
   * @param exchange request/response view; must not be {@code null}
   * @param durationSeconds elapsed time in seconds
   * @param extras additional attributes; may be {@code null}
   */
  public void handle(RequestExchange exchange, double durationSeconds, Map<String, LogValue> extras) {
    Objects.requireNonNull(exchange, "exchange");
    Map<String, String> headers = exchange.headers() == null ? Map.of() : exchange.headers();
    RequestLogEntry entry = RequestLogEntry.builder(
            orDefault(exchange.method(), DEFAULT_METHOD),
            orDefault(exchange.path(), DEFAULT_PATH),
            exchange.statusCode() == null ? DEFAULT_STATUS : exchange.statusCode(),
            durationSeconds)
        .userAgent(header(headers, "User-Agent"))
        .ipAddress(exchange.clientIp())
        .headers(headers)
        .userId(exchange.userId())
        .sessionId(exchange.sessionId())
        .requestId(exchange.requestId())
        .extras(extras)
        .build();
    requestLogger.logRequest(entry);
  }

  public void handle(RequestExchange exchange, double durationSeconds) {
    handle(exchange, durationSeconds, Map.of());
  }

  private static String orDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value;
  }

  private static String header(Map<String, String> headers, String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (name.equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }
}
