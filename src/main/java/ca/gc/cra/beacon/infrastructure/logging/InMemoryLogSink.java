package ca.gc.cra.beacon.infrastructure.logging;

import ca.gc.cra.beacon.application.port.LogSink;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.value.LogValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LogSink} that keeps every emitted entry in memory, for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryLogSink implements LogSink {
  private final List<Entry> entries = new ArrayList<>();

  /**
   * One captured emission.
   *
   * @param level emitted level
   * @param message rendered message
   * @param attributes attribute snapshot
   */
  public record Entry(LogLevel level, String message, Map<String, LogValue> attributes) {
    public Entry {
      Objects.requireNonNull(level, "level");
      Objects.requireNonNull(message, "message");
      attributes = attributes == null || attributes.isEmpty()
          ? Map.of()
          : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public LogValue attribute(String key) {
      return attributes.get(key);
    }
  }

  @Override
  public synchronized void emit(LogLevel level, String message, Map<String, LogValue> attributes) {
    entries.add(new Entry(level, message, attributes));
  }

  public synchronized List<Entry> entries() {
    return List.copyOf(entries);
  }

  public synchronized int size() {
    return entries.size();
  }

  public synchronized void clear() {
    entries.clear();
  }
}
