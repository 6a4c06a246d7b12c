package ca.gc.cra.beacon.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * <strong>What:</strong> One JSON object per event.
 * <p>Fields: {@code timestamp}, {@code level}, {@code logger}, {@code message}, {@code thread}, {@code module},
 * {@code function}, {@code line}, {@code exception} when a throwable is attached, then the event's key/value
 * attributes nested under {@code extra} or, with {@code flatten}, written at the top level.</p>
 * <p><strong>Thread-safety:</strong> The shared {@link JsonFactory} is thread-safe; generators are per call.</p>
 *
 * @implNote Flattened attributes that collide with a base field name are written after it and win when the
 *     line is parsed into a map.
 * @since 0.1.0
 */
public class JsonLayout extends LayoutBase<ILoggingEvent> {
  private static final JsonFactory JSON = new JsonFactory();
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneId.systemDefault());

  private boolean flatten;
  private boolean includeExtra = true;

  public boolean isFlatten() {
    return flatten;
  }

  public void setFlatten(boolean flatten) {
    this.flatten = flatten;
  }

  public boolean isIncludeExtra() {
    return includeExtra;
  }

  public void setIncludeExtra(boolean includeExtra) {
    this.includeExtra = includeExtra;
  }

  @Override
  public String doLayout(ILoggingEvent event) {
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      StackTraceElement caller = EventAttributes.caller(event);
      gen.writeStartObject();
      gen.writeStringField("timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp())));
      gen.writeStringField("level", LevelMapping.displayName(event));
      gen.writeStringField("logger", event.getLoggerName());
      gen.writeStringField("message", event.getFormattedMessage());
      gen.writeStringField("thread", event.getThreadName());
      JsonValues.writeField(gen, "module", EventAttributes.module(caller));
      JsonValues.writeField(gen, "function", caller == null ? null : caller.getMethodName());
      JsonValues.writeField(gen, "line", caller == null ? null : caller.getLineNumber());
      String exception = EventAttributes.exception(event);
      if (exception != null) {
        gen.writeStringField("exception", exception);
      }
      Map<String, Object> attributes = EventAttributes.of(event);
      if (includeExtra && !attributes.isEmpty()) {
        if (flatten) {
          for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            JsonValues.writeField(gen, entry.getKey(), entry.getValue());
          }
        } else {
          JsonValues.writeField(gen, "extra", attributes);
        }
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON log event", ex);
    }
    return out.append(CoreConstants.LINE_SEPARATOR).toString();
  }
}
