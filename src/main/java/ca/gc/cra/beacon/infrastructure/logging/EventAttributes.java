package ca.gc.cra.beacon.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.classic.spi.ThrowableProxyUtil;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.event.KeyValuePair;

/**
 * Reads structured data off a Logback event for the Beacon layouts.
 */
final class EventAttributes {
  static final String USER_ID = "user_id";
  static final String SESSION_ID = "session_id";
  static final String REQUEST_ID = "request_id";
  static final Set<String> CORRELATION_KEYS = Set.of(USER_ID, SESSION_ID, REQUEST_ID);

  private EventAttributes() {}

  /**
   * Returns the event's key/value pairs in insertion order; later duplicates win.
   */
  static Map<String, Object> of(ILoggingEvent event) {
    List<KeyValuePair> pairs = event.getKeyValuePairs();
    if (pairs == null || pairs.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> attributes = new LinkedHashMap<>();
    for (KeyValuePair pair : pairs) {
      if (pair.key != null) {
        attributes.put(pair.key, pair.value);
      }
    }
    return attributes;
  }

  /**
   * Returns the attributes other than the correlation identifiers.
   */
  static Map<String, Object> context(Map<String, Object> attributes) {
    Map<String, Object> context = new LinkedHashMap<>();
    attributes.forEach((key, value) -> {
      if (!CORRELATION_KEYS.contains(key)) {
        context.put(key, value);
      }
    });
    return context;
  }

  static String correlation(Map<String, Object> attributes, String key) {
    Object value = attributes.get(key);
    if (value == null) {
      return null;
    }
    String text = value.toString();
    return text.isEmpty() ? null : text;
  }

  static StackTraceElement caller(ILoggingEvent event) {
    StackTraceElement[] callerData = event.getCallerData();
    return callerData == null || callerData.length == 0 ? null : callerData[0];
  }

  static String module(StackTraceElement caller) {
    if (caller == null) {
      return null;
    }
    String className = caller.getClassName();
    int dot = className.lastIndexOf('.');
    return dot < 0 ? className : className.substring(dot + 1);
  }

  static String exception(ILoggingEvent event) {
    IThrowableProxy proxy = event.getThrowableProxy();
    return proxy == null ? null : ThrowableProxyUtil.asString(proxy);
  }
}
