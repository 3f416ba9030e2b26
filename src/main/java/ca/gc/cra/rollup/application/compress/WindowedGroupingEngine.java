package ca.gc.cra.rollup.application.compress;

import ca.gc.cra.rollup.application.json.FieldPath;
import ca.gc.cra.rollup.application.json.JsonSupport;
import ca.gc.cra.rollup.application.json.JsonValues;
import ca.gc.cra.rollup.config.CompressorConfig;
import ca.gc.cra.rollup.domain.aggregate.AggregationMethod;
import ca.gc.cra.rollup.domain.aggregate.AggregationResult;
import ca.gc.cra.rollup.domain.aggregate.Group;
import ca.gc.cra.rollup.domain.aggregate.GroupKey;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Buckets timestamped JSON records into fixed windows and grouping keys,
 * then emits one aggregated record per group.
 * <p><strong>Role:</strong> Core of the compressor; the batch runner and the relay both call
 * {@link #compress(byte[])}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip non-object elements and records without a non-zero timestamp.</li>
 *   <li>Key each record by window start plus the group-by and unique fields it carries; a field
 *       holding JSON {@code null} is carried as empty text.</li>
 *   <li>Collect the configured value fields per group, in scan order.</li>
 *   <li>Reduce each group with the configured {@link AggregationMethod}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction; each call keeps its groups in a
 * call-local map, so one instance may serve many threads.</p>
 * <p><strong>Observability:</strong> DEBUG log per payload with record, group, and skip counts.</p>
 *
 * @implNote Output order follows first appearance of each group but callers must not rely on it.
 * @since 0.1.0
 */
public final class WindowedGroupingEngine implements PayloadCompressor {
  private static final Logger log = LoggerFactory.getLogger(WindowedGroupingEngine.class);
  private static final String MULTI_VALUE_FIELD = "value";
  // A field present with JSON null still counts: 0 as a value, empty text as a tag.
  private static final Object NULL_VALUE = 0L;
  private static final Object NULL_TAG = "";

  private final CompressorConfig config;
  private final JsonSupport json;
  private final FieldPath timestampPath;
  private final List<FieldPath> valuePaths;
  private final List<FieldPath> groupByPaths;
  private final List<FieldPath> uniquePaths;
  private final AggregationMethod method;
  private final String valueFieldName;
  private final long windowSeconds;

  /**
   * Creates an engine for {@code config}; unset settings take their defaults.
   *
   * @param config compressor configuration
   * @throws IllegalArgumentException if a configured field path is malformed
   */
  public WindowedGroupingEngine(CompressorConfig config) {
    this(config, new JsonSupport());
  }

  WindowedGroupingEngine(CompressorConfig config, JsonSupport json) {
    this.config = Objects.requireNonNull(config, "config").resolve();
    this.json = Objects.requireNonNull(json, "json");
    this.timestampPath = FieldPath.compile(this.config.timestampField());
    this.valuePaths = compileAll(this.config.valueFields());
    this.groupByPaths = compileAll(this.config.groupByFields());
    this.uniquePaths = compileAll(this.config.uniqueFields());
    this.method = AggregationMethod.fromName(this.config.method());
    this.valueFieldName = valuePaths.size() == 1 ? valuePaths.get(0).expression() : MULTI_VALUE_FIELD;
    this.windowSeconds = Math.abs(this.config.windowSeconds());
  }

  /**
   * Compresses a JSON array of records into a JSON array of aggregated records.
   *
   * @param payload UTF-8 JSON array
   * @return UTF-8 JSON array; {@code []} when no record carried a timestamp
   * @throws InputFormatException if the payload is not a JSON array
   * @throws SerializationException if an aggregate is not finite
   */
  @Override
  public byte[] compress(byte[] payload) {
    List<AggregationResult> results = aggregate(payload);
    List<Map<String, Object>> records = new ArrayList<>(results.size());
    for (AggregationResult result : results) {
      records.add(result.toRecord(config.timestampField()));
    }
    try {
      return json.writeArray(records);
    } catch (IllegalStateException ex) {
      throw new SerializationException("aggregated output is not representable as JSON", ex);
    }
  }

  /**
   * Groups and aggregates a payload without serializing the result.
   *
   * @param payload UTF-8 JSON array
   * @return one result per group
   * @throws InputFormatException if the payload is not a JSON array
   */
  public List<AggregationResult> aggregate(byte[] payload) {
    List<?> elements = parseArray(payload);
    Map<GroupKey, Group> groups = new LinkedHashMap<>();
    int skipped = 0;
    for (Object element : elements) {
      if (!(element instanceof Map<?, ?> record)) {
        skipped++;
        continue;
      }
      long timestamp = timestampPath.read(record).map(JsonValues::toLong).orElse(0L);
      if (timestamp == 0) {
        skipped++;
        continue;
      }
      long window = Math.floorDiv(timestamp, windowSeconds) * windowSeconds;
      GroupKey key = new GroupKey(window, readTags(record, groupByPaths), readTags(record, uniquePaths));
      Group group = groups.computeIfAbsent(key, k -> new Group(k, timestamp));
      group.observe(timestamp);
      for (FieldPath valuePath : valuePaths) {
        Optional<Object> value = valuePath.read(record, NULL_VALUE);
        if (value.isPresent()) {
          group.addValue(JsonValues.toDouble(value.get()));
        }
      }
    }

    List<AggregationResult> results = new ArrayList<>(groups.size());
    for (Group group : groups.values()) {
      results.add(group.toResult(method, valueFieldName));
    }
    log.debug("Grouped {} elements into {} groups ({} skipped, window {}s, method {})",
        elements.size(), results.size(), skipped, windowSeconds, method);
    return results;
  }

  /**
   * Returns the resolved configuration this engine runs with.
   *
   * @return resolved configuration
   */
  public CompressorConfig config() {
    return config;
  }

  private List<?> parseArray(byte[] payload) {
    if (payload == null) {
      throw new InputFormatException("expected JSON array");
    }
    Object document;
    try {
      document = json.parse(payload);
    } catch (IllegalArgumentException ex) {
      throw new InputFormatException("expected JSON array", ex);
    }
    if (!(document instanceof List<?> elements)) {
      throw new InputFormatException("expected JSON array");
    }
    return elements;
  }

  private List<GroupKey.Tag> readTags(Map<?, ?> record, List<FieldPath> paths) {
    if (paths.isEmpty()) {
      return List.of();
    }
    List<GroupKey.Tag> tags = new ArrayList<>(paths.size());
    for (FieldPath path : paths) {
      Optional<Object> value = path.read(record, NULL_TAG);
      if (value.isPresent()) {
        tags.add(new GroupKey.Tag(path.expression(), JsonValues.toText(value.get(), json)));
      }
    }
    return tags;
  }

  private static List<FieldPath> compileAll(List<String> expressions) {
    List<FieldPath> paths = new ArrayList<>(expressions.size());
    for (String expression : expressions) {
      paths.add(FieldPath.compile(expression));
    }
    return List.copyOf(paths);
  }
}
