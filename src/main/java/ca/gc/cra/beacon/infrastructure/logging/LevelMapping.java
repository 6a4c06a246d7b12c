package ca.gc.cra.beacon.infrastructure.logging;

import ca.gc.cra.beacon.domain.log.LogLevel;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import java.util.List;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Maps Beacon levels onto Logback levels and back for display.
 *
 * <p>Logback has no level above ERROR, so CRITICAL travels as ERROR carrying the {@link #CRITICAL} marker.
 * Layouts render it as {@code CRITICAL} again and render WARN as {@code WARNING}.</p>
 *
 * @since 0.1.0
 */
public final class LevelMapping {
  /** Marker attached to events logged at {@link LogLevel#CRITICAL}. */
  public static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

  private LevelMapping() {
    // Utility
  }

  /**
   * Returns the Logback level used for a Beacon level.
   *
   * @param level Beacon level; must not be {@code null}
   * @return Logback level; CRITICAL maps to ERROR
   */
  public static Level toLogback(LogLevel level) {
    return switch (level) {
      case DEBUG -> Level.DEBUG;
      case INFO -> Level.INFO;
      case WARNING -> Level.WARN;
      case ERROR, CRITICAL -> Level.ERROR;
    };
  }

  /**
   * Returns the level name printed for an event.
   *
   * @param event logging event
   * @return {@code CRITICAL} for marked ERROR events, {@code WARNING} for WARN, otherwise the Logback level name
   */
  public static String displayName(ILoggingEvent event) {
    Level level = event.getLevel();
    if (Level.ERROR.equals(level) && isCritical(event)) {
      return LogLevel.CRITICAL.name();
    }
    if (Level.WARN.equals(level)) {
      return LogLevel.WARNING.name();
    }
    return level.toString();
  }

  static boolean isCritical(ILoggingEvent event) {
    List<Marker> markers = event.getMarkerList();
    if (markers == null) {
      return false;
    }
    for (Marker marker : markers) {
      if (marker.contains(CRITICAL)) {
        return true;
      }
    }
    return false;
  }
}
