package ca.gc.cra.beacon.infrastructure.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <strong>What:</strong> Human-readable single-line layout.
 * <p>Renders {@code <timestamp> - <logger> - <LEVEL> - <message>}, then a bracketed suffix
 * {@code [user=.. session=.. request=.. key=value ...]} when the event carries correlation identifiers or other
 * key/value attributes, then the stack trace of an attached throwable on the following lines.</p>
 * <p><strong>Thread-safety:</strong> Stateless after start; Logback serializes calls per appender.</p>
 *
 * @since 0.1.0
 */
public class TextLayout extends LayoutBase<ILoggingEvent> {
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss,SSS").withZone(ZoneId.systemDefault());

  private boolean includeContext = true;

  public boolean isIncludeContext() {
    return includeContext;
  }

  /**
   * Enables or disables the bracketed context suffix.
   *
   * @param includeContext {@code false} prints only the base line
   */
  public void setIncludeContext(boolean includeContext) {
    this.includeContext = includeContext;
  }

  @Override
  public String doLayout(ILoggingEvent event) {
    StringBuilder line = new StringBuilder(128);
    line.append(TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp())))
        .append(" - ")
        .append(event.getLoggerName())
        .append(" - ")
        .append(renderLevel(LevelMapping.displayName(event)))
        .append(" - ")
        .append(event.getFormattedMessage());
    if (includeContext) {
      appendContext(line, EventAttributes.of(event));
    }
    line.append(CoreConstants.LINE_SEPARATOR);
    String exception = EventAttributes.exception(event);
    if (exception != null) {
      line.append(exception);
    }
    return line.toString();
  }

  /**
   * Renders the level name; subclasses may decorate it.
   *
   * @param levelName display name such as {@code INFO} or {@code CRITICAL}
   * @return rendered level
   */
  protected String renderLevel(String levelName) {
    return levelName;
  }

  private static void appendContext(StringBuilder line, Map<String, Object> attributes) {
    if (attributes.isEmpty()) {
      return;
    }
    List<String> parts = new ArrayList<>();
    addCorrelation(parts, "user", EventAttributes.correlation(attributes, EventAttributes.USER_ID));
    addCorrelation(parts, "session", EventAttributes.correlation(attributes, EventAttributes.SESSION_ID));
    addCorrelation(parts, "request", EventAttributes.correlation(attributes, EventAttributes.REQUEST_ID));
    EventAttributes.context(attributes).forEach((key, value) -> parts.add(key + "=" + value));
    if (!parts.isEmpty()) {
      line.append(" [").append(String.join(" ", parts)).append(']');
    }
  }

  private static void addCorrelation(List<String> parts, String label, String value) {
    if (value != null) {
      parts.add(label + "=" + value);
    }
  }
}
