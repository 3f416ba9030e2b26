package ca.gc.cra.rollup.domain.aggregate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable accumulator for the records sharing one {@link GroupKey}.
 *
 * <p>Not thread-safe; owned by a single compression call.</p>
 *
 * @since 0.1.0
 */
public final class Group {
  private final long windowStart;
  private final Map<String, String> tags;
  private final List<Double> values = new ArrayList<>();
  private long firstSeen;
  private long lastSeen;
  private int count;

  /**
   * Creates a group from its first record.
   *
   * @param key key of the first record; its tags become the group tags
   * @param timestamp timestamp of the first record
   */
  public Group(GroupKey key, long timestamp) {
    this.windowStart = key.windowStart();
    this.tags = new LinkedHashMap<>();
    for (GroupKey.Tag tag : key.groupBy()) {
      tags.put(tag.field(), tag.value());
    }
    for (GroupKey.Tag tag : key.unique()) {
      tags.put(tag.field(), tag.value());
    }
    this.firstSeen = timestamp;
    this.lastSeen = timestamp;
  }

  /**
   * Records that another record with {@code timestamp} joined the group.
   *
   * @param timestamp record timestamp in seconds
   */
  public void observe(long timestamp) {
    firstSeen = Math.min(firstSeen, timestamp);
    lastSeen = Math.max(lastSeen, timestamp);
    count++;
  }

  /**
   * Appends one value in scan order.
   *
   * @param value numeric value read from a record
   */
  public void addValue(double value) {
    values.add(value);
  }

  /**
   * Reduces the group into its output form.
   *
   * @param method aggregation method
   * @param valueField name of the emitted value field
   * @return aggregation result
   */
  public AggregationResult toResult(AggregationMethod method, String valueField) {
    return new AggregationResult(
        method.emittedTimestamp(firstSeen, lastSeen),
        valueField,
        Aggregator.aggregate(values, method),
        tags);
  }

  public long windowStart() {
    return windowStart;
  }

  public long firstSeen() {
    return firstSeen;
  }

  public long lastSeen() {
    return lastSeen;
  }

  public int count() {
    return count;
  }

  public List<Double> values() {
    return List.copyOf(values);
  }

  public Map<String, String> tags() {
    return Map.copyOf(tags);
  }
}
