package ca.gc.cra.rollup.domain.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One aggregated output record.
 *
 * @param timestamp emitted timestamp in seconds
 * @param valueField name of the emitted value field
 * @param value aggregated value
 * @param tags group-by and unique values, in configuration order
 * @since 0.1.0
 */
public record AggregationResult(long timestamp, String valueField, double value, Map<String, String> tags) {
  public AggregationResult {
    Objects.requireNonNull(valueField, "valueField");
    tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
  }

  /**
   * Lays the result out as a flat record: timestamp, value, then tags. A tag named like the
   * timestamp or value field replaces it.
   *
   * @param timestampField output name of the timestamp
   * @return ordered field map
   */
  public Map<String, Object> toRecord(String timestampField) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(timestampField, timestamp);
    record.put(valueField, value);
    record.putAll(tags);
    return record;
  }
}
