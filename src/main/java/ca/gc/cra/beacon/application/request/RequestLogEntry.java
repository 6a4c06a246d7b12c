package ca.gc.cra.beacon.application.request;

import ca.gc.cra.beacon.domain.value.LogValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One completed HTTP request as handed to {@link RequestLogger}.
 *
 * @param method HTTP method
 * @param path request path
 * @param statusCode response status code
 * @param durationSeconds request duration in seconds; must be non-negative
 * @param userAgent optional user agent
 * @param ipAddress optional client address
 * @param headers request headers, insertion ordered; never {@code null}
 * @param queryParams query parameters; never {@code null}
 * @param body optional request body
 * @param userId optional user identifier
 * @param sessionId optional session identifier
 * @param requestId optional request identifier
 * @param extras additional attributes appended after the standard ones; never {@code null}
 * @since 0.1.0
 */
public record RequestLogEntry(
    String method,
    String path,
    int statusCode,
    double durationSeconds,
    String userAgent,
    String ipAddress,
    Map<String, String> headers,
    Map<String, LogValue> queryParams,
    String body,
    String userId,
    String sessionId,
    String requestId,
    Map<String, LogValue> extras) {

  public RequestLogEntry {
    method = Objects.requireNonNull(method, "method");
    path = Objects.requireNonNull(path, "path");
    if (Double.isNaN(durationSeconds) || durationSeconds < 0d) {
      throw new IllegalArgumentException("durationSeconds must be >= 0 (was " + durationSeconds + ")");
    }
    headers = copy(headers);
    queryParams = copy(queryParams);
    extras = copy(extras);
  }

  /**
   * Starts a builder for the required fields.
   *
   * @param method HTTP method
   * @param path request path
   * @param statusCode response status code
   * @param durationSeconds request duration in seconds
   * @return builder
   */
  public static Builder builder(String method, String path, int statusCode, double durationSeconds) {
    return new Builder(method, path, statusCode, durationSeconds);
  }

  private static <V> Map<String, V> copy(Map<String, V> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  /** Mutable builder for optional request fields. */
  public static final class Builder {
    private final String method;
    private final String path;
    private final int statusCode;
    private final double durationSeconds;
    private String userAgent;
    private String ipAddress;
    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, LogValue> queryParams = new LinkedHashMap<>();
    private String body;
    private String userId;
    private String sessionId;
    private String requestId;
    private final Map<String, LogValue> extras = new LinkedHashMap<>();

    private Builder(String method, String path, int statusCode, double durationSeconds) {
      this.method = method;
      this.path = path;
      this.statusCode = statusCode;
      this.durationSeconds = durationSeconds;
    }

    public Builder userAgent(String value) {
      this.userAgent = value;
      return this;
    }

    public Builder ipAddress(String value) {
      this.ipAddress = value;
      return this;
    }

    public Builder header(String name, String value) {
      headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder headers(Map<String, String> values) {
      if (values != null) {
        values.forEach(this::header);
      }
      return this;
    }

    public Builder queryParam(String name, LogValue value) {
      queryParams.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder queryParams(Map<String, LogValue> values) {
      if (values != null) {
        values.forEach(this::queryParam);
      }
      return this;
    }

    public Builder body(String value) {
      this.body = value;
      return this;
    }

    public Builder userId(String value) {
      this.userId = value;
      return this;
    }

    public Builder sessionId(String value) {
      this.sessionId = value;
      return this;
    }

    public Builder requestId(String value) {
      this.requestId = value;
      return this;
    }

    public Builder extra(String name, LogValue value) {
      extras.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder extras(Map<String, LogValue> values) {
      if (values != null) {
        values.forEach(this::extra);
      }
      return this;
    }

    public RequestLogEntry build() {
      return new RequestLogEntry(method, path, statusCode, durationSeconds, userAgent, ipAddress, headers,
          queryParams, body, userId, sessionId, requestId, extras);
    }
  }
}
