package ca.gc.cra.rollup.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonValuesTest {
  private final JsonSupport json = new JsonSupport();

  @Test
  void toLongTruncatesAndParses() {
    assertEquals(1000L, JsonValues.toLong(1000));
    assertEquals(1000L, JsonValues.toLong(new BigDecimal("1000.9")));
    assertEquals(-5L, JsonValues.toLong(new BigDecimal("-5.7")));
    assertEquals(42L, JsonValues.toLong(" 42 "));
    assertEquals(12L, JsonValues.toLong("12.9"));
    assertEquals(1L, JsonValues.toLong(true));
    assertEquals(0L, JsonValues.toLong("soon"));
    assertEquals(0L, JsonValues.toLong(Map.of("a", 1)));
  }

  @Test
  void toDoubleReadsNumbersStringsAndBooleans() {
    assertEquals(2.5, JsonValues.toDouble(new BigDecimal("2.5")));
    assertEquals(3.0, JsonValues.toDouble("3"));
    assertEquals(1.0, JsonValues.toDouble(true));
    assertEquals(0.0, JsonValues.toDouble(false));
    assertEquals(0.0, JsonValues.toDouble("n/a"));
    assertEquals(0.0, JsonValues.toDouble(List.of(1)));
  }

  @Test
  void toTextKeepsRawNumberForm() {
    assertEquals("web-1", JsonValues.toText("web-1", json));
    assertEquals("21.50", JsonValues.toText(new BigDecimal("21.50"), json));
    assertEquals("7", JsonValues.toText(7, json));
    assertEquals("2.5", JsonValues.toText(2.5d, json));
    assertEquals("false", JsonValues.toText(false, json));
    assertEquals("[1,2]", JsonValues.toText(List.of(1, 2), json));
  }
}
