package ca.gc.cra.beacon.application.request;

import ca.gc.cra.beacon.application.port.LogSink;
import ca.gc.cra.beacon.config.RequestLoggingConfig;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.value.LogValue;
import ca.gc.cra.beacon.logging.Logs;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Writes one structured log entry per completed HTTP request.
 * <p><strong>Why:</strong> Gives operators method, path, status and latency for every request in a form that
 * JSON handlers can index.</p>
 * <p><strong>Role:</strong> Application service used directly or through {@link RequestMiddleware}.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use if the sink is.</p>
 *
 * @implNote Level follows the status class: ERROR for 5xx, WARNING for 4xx, INFO otherwise.
 * @since 0.1.0
 */
public final class RequestLogger {
  private final LogSink sink;
  private final RequestLoggingConfig config;
  private final Set<String> sensitiveHeaders;

  /**
   * Creates a request logger.
   *
   * @param sink destination sink; must not be {@code null}
   * @param config request logging settings; must not be {@code null}
   */
  public RequestLogger(LogSink sink, RequestLoggingConfig config) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.config = Objects.requireNonNull(config, "config");
    this.sensitiveHeaders = config.sensitiveHeaderSet();
  }

  public RequestLoggingConfig config() {
    return config;
  }

  /**
   * Logs a completed request. Nothing is emitted when request logging is disabled.
   *
   * @param entry request data; must not be {@code null}
   */
  public void logRequest(RequestLogEntry entry) {
    Objects.requireNonNull(entry, "entry");
    if (!config.enabled()) {
      return;
    }
    sink.emit(levelFor(entry.statusCode()), message(entry), attributes(entry));
  }

  /**
   * Logs a request given only the required fields.
   *
   * @param method HTTP method
   * @param path request path
   * @param statusCode response status code
   * @param durationSeconds duration in seconds
   */
  public void logRequest(String method, String path, int statusCode, double durationSeconds) {
    logRequest(RequestLogEntry.builder(method, path, statusCode, durationSeconds).build());
  }

  static LogLevel levelFor(int statusCode) {
    if (statusCode >= 500) {
      return LogLevel.ERROR;
    }
    if (statusCode >= 400) {
      return LogLevel.WARNING;
    }
    return LogLevel.INFO;
  }

  static String message(RequestLogEntry entry) {
    return "HTTP " + entry.method() + " " + entry.path() + " - " + entry.statusCode()
        + " (" + Logs.seconds(entry.durationSeconds()) + "s)";
  }

  Map<String, LogValue> attributes(RequestLogEntry entry) {
    Map<String, LogValue> attributes = new LinkedHashMap<>();
    attributes.put("method", LogValue.of(entry.method()));
    attributes.put("path", LogValue.of(entry.path()));
    attributes.put("status_code", LogValue.of((long) entry.statusCode()));
    attributes.put("duration_ms", LogValue.of(entry.durationSeconds() * 1000));
    attributes.put("duration_seconds", LogValue.of(entry.durationSeconds()));

    if (config.logHeaders() && !entry.headers().isEmpty()) {
      Map<String, LogValue> safe = new LinkedHashMap<>();
      entry.headers().forEach((name, value) -> {
        if (!sensitiveHeaders.contains(name.toLowerCase(Locale.ROOT))) {
          safe.put(name, LogValue.of(value));
        }
      });
      attributes.put("headers", LogValue.of(safe));
    }
    if (config.logQueryParams() && !entry.queryParams().isEmpty()) {
      attributes.put("query_params", LogValue.of(entry.queryParams()));
    }
    if (config.logBody() && entry.body() != null && !entry.body().isEmpty()) {
      attributes.put("body", LogValue.of(Logs.truncate(entry.body(), config.maxBodyBytes())));
    }
    putIfPresent(attributes, "user_agent", entry.userAgent());
    putIfPresent(attributes, "ip_address", entry.ipAddress());
    putIfPresent(attributes, "user_id", entry.userId());
    putIfPresent(attributes, "session_id", entry.sessionId());
    putIfPresent(attributes, "request_id", entry.requestId());
    attributes.putAll(entry.extras());
    return attributes;
  }

  private static void putIfPresent(Map<String, LogValue> attributes, String key, String value) {
    if (value != null && !value.isEmpty()) {
      attributes.put(key, LogValue.of(value));
    }
  }
}
