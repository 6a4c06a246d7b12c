package ca.gc.cra.beacon.application.request;

import java.util.Map;

/**
 * Read-only view of a finished request/response pair, implemented by web framework adapters.
 *
 * <p>Every accessor may return {@code null} when the framework does not expose the value;
 * {@link RequestMiddleware} applies defaults.</p>
 *
 * @since 0.1.0
 */
public interface RequestExchange {

  String method();

  String path();

  Map<String, String> headers();

  Integer statusCode();

  default String clientIp() {
    return null;
  }

  default String userId() {
    return null;
  }

  default String sessionId() {
    return null;
  }

  default String requestId() {
    return null;
  }
}
