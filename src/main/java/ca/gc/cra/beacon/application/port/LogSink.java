package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.value.LogValue;
import java.util.Map;

/**
 * <strong>What:</strong> Domain port that receives leveled log records with structured attributes.
 * <p><strong>Why:</strong> Lets the performance tracker, request logger, and training logger emit records without
 * binding to a logging backend.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code Slf4jLogSink} and
 * {@code InMemoryLogSink}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls.</p>
 * <p><strong>Performance:</strong> Callers never hold locks while emitting; implementations may block on IO.</p>
 *
 * @implNote Callers ignore any outcome of {@link #emit}; failures are the sink's concern and surface only as
 *     runtime exceptions.
 * @since 0.1.0
 */
public interface LogSink {
  /**
   * Emits one record.
   *
   * @param level severity; must not be {@code null}
   * @param message human-readable text; must not be {@code null}
   * @param attributes structured attributes in emission order; must not be {@code null}
   */
  void emit(LogLevel level, String message, Map<String, LogValue> attributes);

  /**
   * Sink that discards every record.
   *
   * <p><strong>Concurrency:</strong> Thread-safe.</p>
   * <p><strong>Observability:</strong> Drops all records; useful for tests.</p>
   */
  LogSink NO_OP = (level, message, attributes) -> {};
}
