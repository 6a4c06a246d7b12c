package ca.gc.cra.beacon.infrastructure.logging;

import ca.gc.cra.beacon.domain.value.LogValue;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;

/**
 * Writes plain Java attribute values with a Jackson streaming generator.
 */
final class JsonValues {

  private JsonValues() {}

  static void write(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof LogValue logValue) {
      write(gen, logValue.toPlainObject());
    } else if (value instanceof CharSequence text) {
      gen.writeString(text.toString());
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      gen.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof Number number) {
      double d = number.doubleValue();
      if (Double.isFinite(d)) {
        gen.writeNumber(d);
      } else {
        gen.writeString(Double.toString(d));
      }
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        write(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        write(gen, item);
      }
      gen.writeEndArray();
    } else {
      gen.writeString(value.toString());
    }
  }

  static void writeField(JsonGenerator gen, String name, Object value) throws IOException {
    gen.writeFieldName(name);
    write(gen, value);
  }
}
