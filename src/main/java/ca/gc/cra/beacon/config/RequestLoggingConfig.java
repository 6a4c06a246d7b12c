package ca.gc.cra.beacon.config;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * HTTP request logging settings.
 *
 * @param enabled whether request entries are emitted at all
 * @param logHeaders include request headers (minus {@code sensitiveHeaders})
 * @param logBody include the request body, truncated to {@code maxBodyBytes}
 * @param logQueryParams include query parameters
 * @param logResponseTime carried for configuration compatibility; duration attributes are always emitted
 * @param logStatusCodes carried for configuration compatibility; the status attribute is always emitted
 * @param sensitiveHeaders header names removed before logging, matched case-insensitively
 * @param maxBodyBytes UTF-8 byte budget for logged bodies
 * @since 0.1.0
 */
public record RequestLoggingConfig(
    boolean enabled,
    boolean logHeaders,
    boolean logBody,
    boolean logQueryParams,
    boolean logResponseTime,
    boolean logStatusCodes,
    List<String> sensitiveHeaders,
    int maxBodyBytes) {

  /** Headers removed by default. */
  public static final List<String> DEFAULT_SENSITIVE_HEADERS = List.of("authorization", "cookie");
  /** Default body budget in bytes. */
  public static final int DEFAULT_MAX_BODY_BYTES = 4_096;

  public RequestLoggingConfig {
    sensitiveHeaders = sensitiveHeaders == null ? List.of() : List.copyOf(sensitiveHeaders);
    if (maxBodyBytes < 0) {
      throw new IllegalArgumentException("request.maxBodyBytes must be >= 0 (was " + maxBodyBytes + ")");
    }
  }

  public static RequestLoggingConfig defaults() {
    return new RequestLoggingConfig(
        true, false, false, true, true, true, DEFAULT_SENSITIVE_HEADERS, DEFAULT_MAX_BODY_BYTES);
  }

  public RequestLoggingConfig withHeaders(boolean newLogHeaders) {
    return new RequestLoggingConfig(enabled, newLogHeaders, logBody, logQueryParams, logResponseTime,
        logStatusCodes, sensitiveHeaders, maxBodyBytes);
  }

  public RequestLoggingConfig withBody(boolean newLogBody) {
    return new RequestLoggingConfig(enabled, logHeaders, newLogBody, logQueryParams, logResponseTime,
        logStatusCodes, sensitiveHeaders, maxBodyBytes);
  }

  public RequestLoggingConfig withEnabled(boolean newEnabled) {
    return new RequestLoggingConfig(newEnabled, logHeaders, logBody, logQueryParams, logResponseTime,
        logStatusCodes, sensitiveHeaders, maxBodyBytes);
  }

  /**
   * Returns the sensitive header names lower-cased for case-insensitive lookup.
   *
   * @return lower-case header names
   */
  public Set<String> sensitiveHeaderSet() {
    return sensitiveHeaders.stream()
        .map(h -> h.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }

  /**
   * Parses section-relative keys of the {@code request} section. {@code sensitiveHeaders} is a comma list.
   *
   * @param kv keys with the {@code request.} prefix removed
   * @return parsed configuration
   */
  public static RequestLoggingConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    RequestLoggingConfig d = defaults();
    return new RequestLoggingConfig(
        ConfigValues.parseBoolean("request.enabled", kv.get("enabled"), d.enabled()),
        ConfigValues.parseBoolean("request.logHeaders", kv.get("logHeaders"), d.logHeaders()),
        ConfigValues.parseBoolean("request.logBody", kv.get("logBody"), d.logBody()),
        ConfigValues.parseBoolean("request.logQueryParams", kv.get("logQueryParams"), d.logQueryParams()),
        ConfigValues.parseBoolean("request.logResponseTime", kv.get("logResponseTime"), d.logResponseTime()),
        ConfigValues.parseBoolean("request.logStatusCodes", kv.get("logStatusCodes"), d.logStatusCodes()),
        ConfigValues.parseList(kv.get("sensitiveHeaders"), d.sensitiveHeaders()),
        ConfigValues.parseInt("request.maxBodyBytes", kv.get("maxBodyBytes"), d.maxBodyBytes()));
  }
}
