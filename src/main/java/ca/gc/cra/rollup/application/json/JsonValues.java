package ca.gc.cra.rollup.application.json;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Lenient conversions from parsed JSON values to the numbers and text the grouping engine needs.
 *
 * <p>None of these throw: a value that cannot be read as a number becomes {@code 0}.</p>
 *
 * @since 0.1.0
 */
public final class JsonValues {
  private JsonValues() {
    // Utility
  }

  /**
   * Reads a value as a whole number. Numbers truncate toward zero, numeric strings are parsed,
   * {@code true} reads as {@code 1}; anything else reads as {@code 0}.
   *
   * @param value parsed JSON value, may be {@code null}
   * @return integer reading
   */
  public static long toLong(Object value) {
    if (value instanceof Integer || value instanceof Long) {
      return ((Number) value).longValue();
    }
    if (value instanceof Number number) {
      return (long) number.doubleValue();
    }
    if (value instanceof Boolean flag) {
      return flag ? 1 : 0;
    }
    if (value instanceof String text) {
      String trimmed = text.trim();
      try {
        return Long.parseLong(trimmed);
      } catch (NumberFormatException notInteger) {
        double parsed = parseDouble(trimmed);
        return Double.isFinite(parsed) ? (long) parsed : 0;
      }
    }
    return 0;
  }

  /**
   * Reads a value as a double. Numeric strings are parsed, {@code true} reads as {@code 1};
   * anything else reads as {@code 0}.
   *
   * @param value parsed JSON value, may be {@code null}
   * @return floating-point reading
   */
  public static double toDouble(Object value) {
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    if (value instanceof Boolean flag) {
      return flag ? 1 : 0;
    }
    if (value instanceof String text) {
      return parseDouble(text.trim());
    }
    return 0;
  }

  /**
   * Renders a scalar as tag text: strings as-is, numbers in plain decimal notation, booleans as
   * {@code true}/{@code false}. Objects and arrays are handed to {@code json}.
   *
   * @param value parsed JSON value; must not be {@code null}
   * @param json renderer for compound values
   * @return textual value
   */
  public static String toText(Object value, JsonSupport json) {
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
      return value.toString();
    }
    if (value instanceof Number number) {
      double d = number.doubleValue();
      return Double.isFinite(d) ? BigDecimal.valueOf(d).stripTrailingZeros().toPlainString() : Double.toString(d);
    }
    if (value instanceof Boolean flag) {
      return flag.toString();
    }
    return json.toJson(value);
  }

  private static double parseDouble(String text) {
    if (text.isEmpty()) {
      return 0;
    }
    try {
      return Double.parseDouble(text);
    } catch (NumberFormatException ex) {
      return 0;
    }
  }
}
