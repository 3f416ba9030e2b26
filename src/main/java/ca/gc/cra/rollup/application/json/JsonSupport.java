package ca.gc.cra.rollup.application.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming JSON helper built on Jackson core.
 *
 * <p>Documents are read into a graph of {@link LinkedHashMap}, {@link ArrayList}, {@link String},
 * {@link Number} and {@link Boolean}. Integers stay {@link Integer}/{@link Long}/{@link BigInteger};
 * fractional numbers become {@link BigDecimal} so their decimal digits survive, although exponent
 * notation is normalized ({@code 1e3} reads back as {@code 1000}). Duplicate keys keep the first
 * value; later occurrences are skipped.</p>
 *
 * <p>Instances are thread-safe; the underlying {@link JsonFactory} is shared.</p>
 *
 * @since 0.1.0
 */
public final class JsonSupport {
  private static final double MAX_EXACT_INTEGRAL = 1e15;

  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a UTF-8 JSON document.
   *
   * @param json document bytes; never {@code null}
   * @return parsed graph; {@code null} for a literal {@code null} document
   * @throws IllegalArgumentException when the payload is empty, malformed, or has trailing content
   */
  public Object parse(byte[] json) {
    Objects.requireNonNull(json, "json");
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new IllegalArgumentException("JSON document is empty");
      }
      Object value = readValue(parser, token);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("JSON document contains trailing content");
      }
      return value;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON payload", ex);
    }
  }

  /**
   * Writes a list of flat records as a compact JSON array.
   *
   * <p>Integral doubles below 10<sup>15</sup> in magnitude are written without a fractional part.</p>
   *
   * @param records records to write; values may be strings, numbers, booleans, or {@code null}
   * @return UTF-8 encoded JSON array
   * @throws IllegalStateException if a value is NaN or infinite
   */
  public byte[] writeArray(List<? extends Map<String, ?>> records) {
    Objects.requireNonNull(records, "records");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartArray();
      for (Map<String, ?> record : records) {
        writeValue(generator, record);
      }
      generator.writeEndArray();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write JSON array", ex);
    }
    return out.toByteArray();
  }

  /**
   * Renders any parsed value as compact JSON text.
   *
   * @param value parsed value (map, list, primitive, or {@code null})
   * @return JSON text
   */
  public String toJson(Object value) {
    StringWriter writer = new StringWriter();
    try (JsonGenerator generator = factory.createGenerator(writer)) {
      writeValue(generator, value);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render JSON", ex);
    }
    return writer.toString();
  }

  private void writeValue(JsonGenerator generator, Object value) throws IOException {
    if (value == null) {
      generator.writeNull();
    } else if (value instanceof String text) {
      generator.writeString(text);
    } else if (value instanceof Boolean flag) {
      generator.writeBoolean(flag);
    } else if (value instanceof Double || value instanceof Float) {
      writeDouble(generator, ((Number) value).doubleValue());
    } else if (value instanceof BigDecimal decimal) {
      generator.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      generator.writeNumber(integer);
    } else if (value instanceof Number number) {
      generator.writeNumber(number.longValue());
    } else if (value instanceof Map<?, ?> map) {
      generator.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        generator.writeFieldName(String.valueOf(entry.getKey()));
        writeValue(generator, entry.getValue());
      }
      generator.writeEndObject();
    } else if (value instanceof Collection<?> items) {
      generator.writeStartArray();
      for (Object item : items) {
        writeValue(generator, item);
      }
      generator.writeEndArray();
    } else {
      generator.writeString(value.toString());
    }
  }

  private static void writeDouble(JsonGenerator generator, double value) throws IOException {
    if (!Double.isFinite(value)) {
      throw new IllegalStateException("value " + value + " cannot be represented in JSON");
    }
    if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGRAL) {
      generator.writeNumber((long) value);
    } else {
      generator.writeNumber(value);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT -> parser.getNumberValue();
      case VALUE_NUMBER_FLOAT -> parser.getDecimalValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      JsonToken valueToken = parser.nextToken();
      if (map.containsKey(fieldName)) {
        parser.skipChildren();
        continue;
      }
      map.put(fieldName, readValue(parser, valueToken));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
