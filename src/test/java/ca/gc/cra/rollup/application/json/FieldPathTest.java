package ca.gc.cra.rollup.application.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FieldPathTest {
  private final JsonSupport json = new JsonSupport();

  private Object parse(String text) {
    return json.parse(text.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void readsTopLevelAndNestedFields() {
    Object record = parse("{\"host\":\"a\",\"device\":{\"id\":\"d-1\",\"meta\":{\"rack\":7}}}");

    assertEquals(Optional.of("a"), FieldPath.compile("host").read(record));
    assertEquals(Optional.of("d-1"), FieldPath.compile("device.id").read(record));
    assertEquals(Optional.of(7), FieldPath.compile("device.meta.rack").read(record));
  }

  @Test
  void numericSegmentIndexesArraysAndMatchesNumericKeys() {
    Object record = parse("{\"tags\":[\"x\",\"y\"],\"byCode\":{\"0\":\"zero\"}}");

    assertEquals(Optional.of("y"), FieldPath.compile("tags.1").read(record));
    assertEquals(Optional.of("x"), FieldPath.compile("tags[0]").read(record));
    assertEquals(Optional.of("zero"), FieldPath.compile("byCode.0").read(record));
    assertFalse(FieldPath.compile("tags.5").read(record).isPresent());
  }

  @Test
  void quotedSegmentsMayContainDots() {
    Object record = parse("{\"a.b\":{\"c\":1}}");

    assertEquals(Optional.of(1), FieldPath.compile("['a.b'].c").read(record));
  }

  @Test
  void missingOrNullFieldsAreAbsent() {
    Object record = parse("{\"host\":null,\"n\":5}");

    assertFalse(FieldPath.compile("host").read(record).isPresent());
    assertFalse(FieldPath.compile("missing.deeper").read(record).isPresent());
    assertFalse(FieldPath.compile("n.x").read(record).isPresent());
  }

  @Test
  void presentNullReadsAsSubstitute() {
    Object record = parse("{\"host\":null,\"tags\":[null],\"meta\":null}");

    assertEquals(Optional.of(""), FieldPath.compile("host").read(record, ""));
    assertEquals(Optional.of(0L), FieldPath.compile("tags.0").read(record, 0L));
    assertFalse(FieldPath.compile("missing").read(record, "").isPresent());
    assertFalse(FieldPath.compile("meta.id").read(record, "").isPresent());
    assertFalse(FieldPath.compile("tags.1").read(record, "").isPresent());
  }

  @Test
  void rejectsMalformedExpressions() {
    assertThrows(IllegalArgumentException.class, () -> FieldPath.compile(""));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.compile("a..b"));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.compile("a."));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.compile("a[x]"));
    assertThrows(IllegalArgumentException.class, () -> FieldPath.compile("a['b"));
  }

  @Test
  void expressionIsKeptVerbatim() {
    assertEquals("device.id", FieldPath.compile("device.id").expression());
  }
}
