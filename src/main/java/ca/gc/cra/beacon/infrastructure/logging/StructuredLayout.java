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
 * Fixed-shape JSON layout used by the dedicated error handler and the {@code structured} format.
 *
 * <p>Every line carries {@code timestamp, level, logger_name, message, module, function, line_number,
 * exception_info, context, user_id, session_id, request_id}. Absent values are written as JSON {@code null};
 * correlation identifiers are lifted out of the attributes and the rest land in {@code context}.</p>
 *
 * @since 0.1.0
 */
public class StructuredLayout extends LayoutBase<ILoggingEvent> {
  private static final JsonFactory JSON = new JsonFactory();
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ISO_LOCAL_DATE_TIME.withZone(ZoneId.systemDefault());

  private boolean includeContext = true;

  public boolean isIncludeContext() {
    return includeContext;
  }

  public void setIncludeContext(boolean includeContext) {
    this.includeContext = includeContext;
  }

  @Override
  public String doLayout(ILoggingEvent event) {
    Map<String, Object> attributes = EventAttributes.of(event);
    StackTraceElement caller = EventAttributes.caller(event);
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = JSON.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp())));
      gen.writeStringField("level", LevelMapping.displayName(event));
      gen.writeStringField("logger_name", event.getLoggerName());
      gen.writeStringField("message", event.getFormattedMessage());
      JsonValues.writeField(gen, "module", EventAttributes.module(caller));
      JsonValues.writeField(gen, "function", caller == null ? null : caller.getMethodName());
      JsonValues.writeField(gen, "line_number", caller == null ? null : caller.getLineNumber());
      JsonValues.writeField(gen, "exception_info", EventAttributes.exception(event));
      JsonValues.writeField(gen, "context", includeContext ? EventAttributes.context(attributes) : Map.of());
      JsonValues.writeField(gen, "user_id", EventAttributes.correlation(attributes, EventAttributes.USER_ID));
      JsonValues.writeField(gen, "session_id", EventAttributes.correlation(attributes, EventAttributes.SESSION_ID));
      JsonValues.writeField(gen, "request_id", EventAttributes.correlation(attributes, EventAttributes.REQUEST_ID));
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render structured log event", ex);
    }
    return out.append(CoreConstants.LINE_SEPARATOR).toString();
  }
}
