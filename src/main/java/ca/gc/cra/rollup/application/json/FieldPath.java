package ca.gc.cra.rollup.application.json;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compiled field path used to read timestamps, values, and grouping fields from a record.
 *
 * <p>Syntax:
 * <ul>
 *   <li>{@code host} reads a top-level key;</li>
 *   <li>{@code meta.host} walks nested objects;</li>
 *   <li>{@code tags.0} or {@code tags[0]} indexes an array (a numeric dotted segment still reads an
 *       object key named {@code "0"} when the parent is an object);</li>
 *   <li>{@code ['a.b']} or {@code ["a.b"]} addresses a key containing dots or brackets.</li>
 * </ul>
 * A path that walks through a JSON {@code null} is absent. A field that is itself {@code null} is
 * present: {@link #read(Object)} reports it as empty, {@link #read(Object, Object)} as the caller's
 * substitute.
 *
 * @since 0.1.0
 */
public final class FieldPath {
  private static final Object MISSING = new Object();

  private final String expression;
  private final List<Segment> segments;

  private FieldPath(String expression, List<Segment> segments) {
    this.expression = expression;
    this.segments = segments;
  }

  /**
   * Compiles a field path.
   *
   * @param expression path text, taken verbatim; whitespace is part of the key
   * @return compiled path
   * @throws IllegalArgumentException if the path is empty or malformed
   */
  public static FieldPath compile(String expression) {
    Objects.requireNonNull(expression, "expression");
    String text = expression;
    if (text.isEmpty()) {
      throw new IllegalArgumentException("field path must not be empty");
    }
    List<Segment> segments = new ArrayList<>();
    int i = 0;
    boolean expectSegment = true;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '[') {
        i = readBracket(expression, text, i + 1, segments);
        expectSegment = false;
      } else if (c == '.') {
        if (expectSegment) {
          throw new IllegalArgumentException("Empty segment in field path: " + expression);
        }
        i++;
        expectSegment = true;
        if (i >= text.length()) {
          throw new IllegalArgumentException("Field path must not end with '.': " + expression);
        }
      } else {
        if (!expectSegment) {
          throw new IllegalArgumentException("Expected '.' or '[' at offset " + i + " in field path: " + expression);
        }
        int start = i;
        while (i < text.length() && text.charAt(i) != '.' && text.charAt(i) != '[') {
          i++;
        }
        String name = text.substring(start, i);
        segments.add(new Segment(name, isDigits(name) ? Integer.parseInt(name) : -1, true));
        expectSegment = false;
      }
    }
    return new FieldPath(expression, List.copyOf(segments));
  }

  /**
   * Reads the value at this path.
   *
   * @param root parsed record
   * @return value, or empty when any segment is missing or the field is {@code null}
   */
  public Optional<Object> read(Object root) {
    Object current = resolve(root);
    return current == MISSING ? Optional.empty() : Optional.ofNullable(current);
  }

  /**
   * Reads the value at this path, substituting {@code nullReading} when the field exists with a
   * JSON {@code null} value.
   *
   * @param root parsed record
   * @param nullReading value returned for a present {@code null}; must not be {@code null}
   * @return value, or empty only when the field is missing
   */
  public Optional<Object> read(Object root, Object nullReading) {
    Objects.requireNonNull(nullReading, "nullReading");
    Object current = resolve(root);
    if (current == MISSING) {
      return Optional.empty();
    }
    return Optional.of(current == null ? nullReading : current);
  }

  /**
   * Returns the path as configured; used as the output field name.
   *
   * @return original expression
   */
  public String expression() {
    return expression;
  }

  @Override
  public String toString() {
    return expression;
  }

  private Object resolve(Object root) {
    Object current = root;
    for (Segment segment : segments) {
      if (current == null) {
        return MISSING;
      }
      current = segment.resolve(current);
      if (current == MISSING) {
        return MISSING;
      }
    }
    return current;
  }

  private static int readBracket(String expression, String text, int i, List<Segment> segments) {
    if (i >= text.length()) {
      throw new IllegalArgumentException("Unterminated bracket in field path: " + expression);
    }
    char next = text.charAt(i);
    if (next == '\'' || next == '"') {
      StringBuilder sb = new StringBuilder();
      i++;
      boolean closed = false;
      while (i < text.length()) {
        char ch = text.charAt(i);
        if (ch == '\\') {
          if (i + 1 >= text.length()) {
            throw new IllegalArgumentException("Invalid escape in field path: " + expression);
          }
          sb.append(text.charAt(i + 1));
          i += 2;
        } else if (ch == next) {
          closed = true;
          i++;
          break;
        } else {
          sb.append(ch);
          i++;
        }
      }
      if (!closed) {
        throw new IllegalArgumentException("Unterminated string in field path: " + expression);
      }
      if (i >= text.length() || text.charAt(i) != ']') {
        throw new IllegalArgumentException("Missing closing ] in field path: " + expression);
      }
      segments.add(new Segment(sb.toString(), -1, true));
      return i + 1;
    }
    int start = i;
    while (i < text.length() && Character.isDigit(text.charAt(i))) {
      i++;
    }
    if (start == i || i >= text.length() || text.charAt(i) != ']') {
      throw new IllegalArgumentException("Invalid array index in field path: " + expression);
    }
    String digits = text.substring(start, i);
    int index;
    try {
      index = Integer.parseInt(digits);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Array index too large in field path: " + expression, ex);
    }
    segments.add(new Segment(digits, index, false));
    return i + 1;
  }

  private static boolean isDigits(String value) {
    if (value.isEmpty() || value.length() > 9) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isDigit(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  /** One step of a path: a key, an index, or a dotted number that may be either. */
  private record Segment(String name, int index, boolean matchesKey) {
    Object resolve(Object current) {
      if (current instanceof Map<?, ?> map) {
        return matchesKey && map.containsKey(name) ? map.get(name) : MISSING;
      }
      if (current instanceof List<?> list && index >= 0) {
        return index < list.size() ? list.get(index) : MISSING;
      }
      return MISSING;
    }
  }
}
