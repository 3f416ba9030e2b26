package ca.gc.cra.rollup.application.compress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rollup.config.CompressorConfig;
import ca.gc.cra.rollup.domain.aggregate.AggregationResult;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class WindowedGroupingEngineTest {

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  private static CompressorConfig config(
      List<String> values, List<String> groupBy, List<String> unique, String method, Duration window) {
    return new CompressorConfig("timestamp", values, groupBy, unique, method, window, 0);
  }

  private static WindowedGroupingEngine engine(String method) {
    return new WindowedGroupingEngine(config(null, List.of(), List.of(), method, null));
  }

  @Test
  void sumsValuesWithinOneWindowAndEmitsMidpoint() {
    String input = "[{\"timestamp\":1000,\"value\":10},{\"timestamp\":1010,\"value\":20}]";

    byte[] out = engine("sum").compress(bytes(input));

    assertEquals("[{\"timestamp\":1005,\"value\":30}]", new String(out, StandardCharsets.UTF_8));
  }

  @Test
  void firstAndLastUseBoundaryTimestamps() {
    String input = "[{\"timestamp\":1010,\"value\":20},{\"timestamp\":1000,\"value\":10}]";

    AggregationResult first = engine("first").aggregate(bytes(input)).get(0);
    AggregationResult last = engine("last").aggregate(bytes(input)).get(0);

    assertEquals(1000L, first.timestamp());
    assertEquals(20.0, first.value(), "first takes the value scanned first");
    assertEquals(1010L, last.timestamp());
    assertEquals(10.0, last.value());
  }

  @Test
  void splitsRecordsAcrossWindows() {
    String input = "[{\"timestamp\":1000,\"value\":1},{\"timestamp\":1010,\"value\":2}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of(), List.of(), "sum", Duration.ofSeconds(10)));

    List<AggregationResult> results = engine.aggregate(bytes(input));

    assertEquals(2, results.size());
  }

  @Test
  void groupByFieldsSeparateGroupsAndBecomeTags() {
    String input = "["
        + "{\"timestamp\":1000,\"value\":1,\"host\":\"a\"},"
        + "{\"timestamp\":1001,\"value\":2,\"host\":\"b\"},"
        + "{\"timestamp\":1002,\"value\":3,\"host\":\"a\"}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of("host"), List.of(), "sum", null));

    List<AggregationResult> results = engine.aggregate(bytes(input));

    assertEquals(2, results.size());
    AggregationResult a = results.stream().filter(r -> r.tags().get("host").equals("a")).findFirst().orElseThrow();
    AggregationResult b = results.stream().filter(r -> r.tags().get("host").equals("b")).findFirst().orElseThrow();
    assertEquals(4.0, a.value());
    assertEquals(1001L, a.timestamp());
    assertEquals(2.0, b.value());
  }

  @Test
  void uniqueFieldsAreNeverMerged() {
    String input = "["
        + "{\"timestamp\":1000,\"value\":1,\"sensor\":\"s1\"},"
        + "{\"timestamp\":1000,\"value\":1,\"sensor\":\"s2\"}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of(), List.of("sensor"), "sum", null));

    List<AggregationResult> results = engine.aggregate(bytes(input));

    assertEquals(2, results.size());
    assertEquals(Map.of("sensor", "s1"), results.get(0).tags());
    assertEquals(Map.of("sensor", "s2"), results.get(1).tags());
  }

  @Test
  void recordWithoutGroupFieldFormsItsOwnGroup() {
    String input = "["
        + "{\"timestamp\":1000,\"value\":1,\"host\":\"a\"},"
        + "{\"timestamp\":1000,\"value\":5}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of("host"), List.of(), "sum", null));

    List<AggregationResult> results = engine.aggregate(bytes(input));

    assertEquals(2, results.size());
    AggregationResult untagged = results.stream().filter(r -> r.tags().isEmpty()).findFirst().orElseThrow();
    assertEquals(5.0, untagged.value());
    assertFalse(untagged.toRecord("timestamp").containsKey("host"));
  }

  @Test
  void skipsNonObjectsAndRecordsWithoutTimestamp() {
    String input = "[1,\"x\",null,{\"value\":7},{\"timestamp\":0,\"value\":7},"
        + "{\"timestamp\":null,\"value\":7},{\"timestamp\":1000,\"value\":2}]";

    List<AggregationResult> results = engine("sum").aggregate(bytes(input));

    assertEquals(1, results.size());
    assertEquals(2.0, results.get(0).value());
  }

  @Test
  void nullValuesCountAsZero() {
    String input = "[{\"timestamp\":1000,\"value\":10},{\"timestamp\":1001,\"value\":null}]";

    assertEquals(2.0, engine("count").aggregate(bytes(input)).get(0).value());
    assertEquals(5.0, engine("avg").aggregate(bytes(input)).get(0).value());
    assertEquals(0.0, engine("min").aggregate(bytes(input)).get(0).value());
  }

  @Test
  void nullTagIsEmptyTextAndDistinctFromAbsentTag() {
    String input = "["
        + "{\"timestamp\":1000,\"value\":1,\"host\":null},"
        + "{\"timestamp\":1000,\"value\":2,\"host\":null},"
        + "{\"timestamp\":1000,\"value\":4}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of("host"), List.of(), "sum", null));

    byte[] out = engine.compress(bytes(input));

    assertEquals("[{\"timestamp\":1000,\"value\":3,\"host\":\"\"},{\"timestamp\":1000,\"value\":4}]",
        new String(out, StandardCharsets.UTF_8));
  }

  @Test
  void arrayWithoutUsableRecordsCompressesToEmptyArray() {
    assertEquals("[]", new String(engine("sum").compress(bytes("[]")), StandardCharsets.UTF_8));
    assertEquals("[]", new String(engine("sum").compress(bytes("[{\"value\":1}]")), StandardCharsets.UTF_8));
  }

  @Test
  void rejectsDocumentsThatAreNotArrays() {
    WindowedGroupingEngine engine = engine("sum");

    InputFormatException ex =
        assertThrows(InputFormatException.class, () -> engine.compress(bytes("{\"timestamp\":1}")));
    assertTrue(ex.getMessage().contains("expected JSON array"));
    assertThrows(InputFormatException.class, () -> engine.compress(bytes("not json")));
    assertThrows(InputFormatException.class, () -> engine.compress(bytes("")));
    assertThrows(InputFormatException.class, () -> engine.compress(null));
  }

  @Test
  void nonFiniteAggregateFailsSerialization() {
    String input = "[{\"timestamp\":1000,\"value\":1e308},{\"timestamp\":1001,\"value\":1e308}]";

    assertThrows(SerializationException.class, () -> engine("sum").compress(bytes(input)));
  }

  @Test
  void multipleValueFieldsPoolIntoValue() {
    String input = "[{\"timestamp\":1000,\"rx\":3,\"tx\":4},{\"timestamp\":1001,\"rx\":5}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(List.of("rx", "tx"), List.of(), List.of(), "count", null));

    byte[] out = engine.compress(bytes(input));

    assertEquals("[{\"timestamp\":1000,\"value\":3}]", new String(out, StandardCharsets.UTF_8));
  }

  @Test
  void groupWithoutValuesAggregatesToZero() {
    String input = "[{\"timestamp\":1000,\"other\":3}]";

    AggregationResult result = engine("max").aggregate(bytes(input)).get(0);

    assertEquals(0.0, result.value());
  }

  @Test
  void nestedPathsReadValuesAndTags() {
    String input = "["
        + "{\"ts\":\"1000\",\"device\":{\"id\":\"d1\"},\"metrics\":{\"temp\":21.5}},"
        + "{\"ts\":\"1010\",\"device\":{\"id\":\"d1\"},\"metrics\":{\"temp\":22.5}}]";
    WindowedGroupingEngine engine = new WindowedGroupingEngine(new CompressorConfig(
        "ts", List.of("metrics.temp"), List.of("device.id"), List.of(), "avg", null, 0));

    byte[] out = engine.compress(bytes(input));

    assertEquals("[{\"ts\":1005,\"metrics.temp\":22,\"device.id\":\"d1\"}]",
        new String(out, StandardCharsets.UTF_8));
  }

  @Test
  void numericTagsKeepTheirSourceText() {
    String input = "[{\"timestamp\":1000,\"value\":1,\"rate\":1.50},{\"timestamp\":1000,\"value\":1,\"rate\":1.5}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of("rate"), List.of(), "sum", null));

    List<AggregationResult> results = engine.aggregate(bytes(input));

    assertEquals(2, results.size());
    assertEquals("1.50", results.get(0).tags().get("rate"));
    assertEquals("1.5", results.get(1).tags().get("rate"));
  }

  @Test
  void negativeTimestampsFloorToTheirWindow() {
    String input = "[{\"timestamp\":-1,\"value\":1},{\"timestamp\":-59,\"value\":1},{\"timestamp\":1,\"value\":1}]";

    List<AggregationResult> results = engine("sum").aggregate(bytes(input));

    assertEquals(2, results.size());
    assertEquals(2.0, results.get(0).value());
    assertEquals(-30L, results.get(0).timestamp());
  }

  @Test
  void negativeWindowBucketsByItsMagnitude() {
    String input = "[{\"timestamp\":1000,\"value\":1},{\"timestamp\":1019,\"value\":1},"
        + "{\"timestamp\":1020,\"value\":1}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of(), List.of(), "sum", Duration.ofSeconds(-60)));

    List<AggregationResult> results = engine.aggregate(bytes(input));

    assertEquals(2, results.size());
    assertEquals(2.0, results.get(0).value());
    assertEquals(1.0, results.get(1).value());
  }

  @Test
  void whitespaceTimestampFieldIsReadVerbatim() {
    String input = "[{\" \":1000,\"value\":1},{\"timestamp\":1000,\"value\":2}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(new CompressorConfig(" ", null, null, null, null, null, 0));

    List<AggregationResult> results = engine.aggregate(bytes(input));

    assertEquals(1, results.size());
    assertEquals(1.0, results.get(0).value());
  }

  @Test
  void differentlyCasedMethodAggregatesAsSum() {
    String input = "[{\"timestamp\":1000,\"value\":5},{\"timestamp\":1001,\"value\":2},"
        + "{\"timestamp\":1002,\"value\":8},{\"timestamp\":1002,\"value\":1}]";

    byte[] out = engine("AVG").compress(bytes(input));

    assertEquals("[{\"timestamp\":1001,\"value\":16}]", new String(out, StandardCharsets.UTF_8));
    assertEquals(1001L, engine("FIRST").aggregate(bytes(input)).get(0).timestamp());
  }

  @Test
  void subSecondWindowFallsBackToDefault() {
    String input = "[{\"timestamp\":1000,\"value\":1},{\"timestamp\":1019,\"value\":1}]";
    WindowedGroupingEngine engine =
        new WindowedGroupingEngine(config(null, List.of(), List.of(), "sum", Duration.ofMillis(500)));

    assertEquals(1, engine.aggregate(bytes(input)).size());
    assertEquals(60L, engine.config().windowSeconds());
  }

  @Test
  void unknownMethodSums() {
    String input = "[{\"timestamp\":1000,\"value\":2},{\"timestamp\":1001,\"value\":3}]";

    assertEquals(5.0, engine("median").aggregate(bytes(input)).get(0).value());
  }
}
