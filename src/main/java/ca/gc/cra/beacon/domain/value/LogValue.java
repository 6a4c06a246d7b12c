package ca.gc.cra.beacon.domain.value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Closed tagged value attached to structured log records and performance samples.
 * <p><strong>Why:</strong> Keeps sink contracts well-typed; callers pass strings, numbers, booleans, or nested maps
 * instead of arbitrary objects whose rendering would depend on {@code toString()}.</p>
 * <p><strong>Role:</strong> Domain value shared by the performance tracker, request logger, training logger, and
 * every {@code LogSink} adapter.</p>
 * <p><strong>Thread-safety:</strong> Immutable; nested maps are copied on construction.</p>
 *
 * @since 0.1.0
 */
public final class LogValue {

  /** Discriminator for the four supported shapes. */
  public enum Kind {
    /** Text value. */
    STRING,
    /** Integral or floating point value. */
    NUMBER,
    /** Boolean flag. */
    BOOLEAN,
    /** Nested string-keyed map of further values. */
    MAP
  }

  private final Kind kind;
  private final Object value;

  private LogValue(Kind kind, Object value) {
    this.kind = kind;
    this.value = value;
  }

  /**
   * Wraps a string.
   *
   * @param value text; must not be {@code null}
   * @return string value
   */
  public static LogValue of(String value) {
    return new LogValue(Kind.STRING, Objects.requireNonNull(value, "value"));
  }

  /**
   * Wraps a number. {@link Integer}, {@link Long}, {@link Double} and other {@link Number} types are kept as given.
   *
   * @param value number; must not be {@code null}
   * @return number value
   */
  public static LogValue of(Number value) {
    return new LogValue(Kind.NUMBER, Objects.requireNonNull(value, "value"));
  }

  /**
   * Wraps a primitive double.
   *
   * @param value number
   * @return number value
   */
  public static LogValue of(double value) {
    return new LogValue(Kind.NUMBER, value);
  }

  /**
   * Wraps a primitive long.
   *
   * @param value number
   * @return number value
   */
  public static LogValue of(long value) {
    return new LogValue(Kind.NUMBER, value);
  }

  /**
   * Wraps a boolean.
   *
   * @param value flag
   * @return boolean value
   */
  public static LogValue of(boolean value) {
    return new LogValue(Kind.BOOLEAN, value);
  }

  /**
   * Wraps a nested map. Iteration order of {@code value} is preserved.
   *
   * @param value nested entries; must not be {@code null} and must not contain {@code null} keys or values
   * @return map value
   */
  public static LogValue of(Map<String, LogValue> value) {
    Objects.requireNonNull(value, "value");
    Map<String, LogValue> copy = new LinkedHashMap<>();
    for (Map.Entry<String, LogValue> entry : value.entrySet()) {
      copy.put(
          Objects.requireNonNull(entry.getKey(), "key"),
          Objects.requireNonNull(entry.getValue(), "value for " + entry.getKey()));
    }
    return new LogValue(Kind.MAP, Collections.unmodifiableMap(copy));
  }

  /**
   * Converts a plain Java object into a value.
   *
   * <p>Accepts {@link LogValue}, {@link CharSequence}, {@link Number}, {@link Boolean}, and {@link Map} with string
   * keys (converted recursively). Any other object, such as an enum or a {@code Path}, becomes its string form.</p>
   *
   * @param raw plain value; must not be {@code null}
   * @return converted value
   * @throws IllegalArgumentException if a nested map contains a non-string key
   */
  public static LogValue from(Object raw) {
    Objects.requireNonNull(raw, "raw");
    if (raw instanceof LogValue logValue) {
      return logValue;
    }
    if (raw instanceof CharSequence text) {
      return of(text.toString());
    }
    if (raw instanceof Number number) {
      return of(number);
    }
    if (raw instanceof Boolean flag) {
      return of(flag.booleanValue());
    }
    if (raw instanceof Map<?, ?> map) {
      Map<String, LogValue> converted = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("nested map keys must be strings (was " + entry.getKey() + ")");
        }
        if (entry.getValue() != null) {
          converted.put(key, from(entry.getValue()));
        }
      }
      return of(converted);
    }
    return of(raw.toString());
  }

  /**
   * Converts a map of plain Java objects. {@code null} values are skipped.
   *
   * @param raw plain entries; {@code null} yields an empty map
   * @return ordered, unmodifiable map of values
   */
  public static Map<String, LogValue> fromMap(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return Map.of();
    }
    Map<String, LogValue> converted = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      if (entry.getValue() != null) {
        converted.put(Objects.requireNonNull(entry.getKey(), "key"), from(entry.getValue()));
      }
    }
    return Collections.unmodifiableMap(converted);
  }

  /**
   * Returns the discriminator.
   *
   * @return value kind
   */
  public Kind kind() {
    return kind;
  }

  /**
   * Returns the text of a {@link Kind#STRING} value.
   *
   * @return text
   * @throws IllegalStateException if this is not a string value
   */
  public String asString() {
    requireKind(Kind.STRING);
    return (String) value;
  }

  /**
   * Returns the number of a {@link Kind#NUMBER} value.
   *
   * @return number as supplied
   * @throws IllegalStateException if this is not a number value
   */
  public Number asNumber() {
    requireKind(Kind.NUMBER);
    return (Number) value;
  }

  /**
   * Returns the flag of a {@link Kind#BOOLEAN} value.
   *
   * @return flag
   * @throws IllegalStateException if this is not a boolean value
   */
  public boolean asBoolean() {
    requireKind(Kind.BOOLEAN);
    return (Boolean) value;
  }

  /**
   * Returns the entries of a {@link Kind#MAP} value.
   *
   * @return unmodifiable nested entries
   * @throws IllegalStateException if this is not a map value
   */
  @SuppressWarnings("unchecked")
  public Map<String, LogValue> asMap() {
    requireKind(Kind.MAP);
    return (Map<String, LogValue>) value;
  }

  /**
   * Unwraps into plain Java objects ({@code String}, {@code Number}, {@code Boolean}, or an ordered
   * {@code Map<String, Object>}) for hand-off to logging backends.
   *
   * @return plain representation
   */
  public Object toPlainObject() {
    if (kind != Kind.MAP) {
      return value;
    }
    Map<String, Object> plain = new LinkedHashMap<>();
    for (Map.Entry<String, LogValue> entry : asMap().entrySet()) {
      plain.put(entry.getKey(), entry.getValue().toPlainObject());
    }
    return Collections.unmodifiableMap(plain);
  }

  private void requireKind(Kind expected) {
    if (kind != expected) {
      throw new IllegalStateException("value is " + kind + ", not " + expected);
    }
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof LogValue that)) {
      return false;
    }
    return kind == that.kind && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  /**
   * Renders the value the way text layouts print it: strings verbatim, maps as {@code {k=v, ...}}.
   *
   * @return display text
   */
  @Override
  public String toString() {
    return String.valueOf(value);
  }
}
