package ca.gc.cra.rollup.config;

import ca.gc.cra.rollup.validation.Durations;
import ca.gc.cra.rollup.validation.Numbers;
import ca.gc.cra.rollup.validation.Strings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for the windowed grouping engine and its batch runner.
 * <p><strong>Why:</strong> Callers build partial configurations (a YAML section, a test fixture,
 * a handful of CLI keys); {@link #resolve()} turns any of them into a fully populated value.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; lists are copied on construction.</p>
 *
 * @param timestampField field path holding the record timestamp (seconds); blank means unset
 * @param valueFields ordered field paths whose numbers are aggregated; empty means unset
 * @param groupByFields ordered field paths that form the grouping key
 * @param uniqueFields ordered field paths that further split groups
 * @param method aggregation method name, see {@link ca.gc.cra.rollup.domain.aggregate.AggregationMethod}
 * @param window bucket width; {@code null} or zero means unset
 * @param workers maximum concurrent compressions for batches; non-positive means unset
 * @since 0.1.0
 */
public record CompressorConfig(
    String timestampField,
    List<String> valueFields,
    List<String> groupByFields,
    List<String> uniqueFields,
    String method,
    Duration window,
    int workers) {

  /** Default timestamp field. */
  public static final String DEFAULT_TIMESTAMP_FIELD = "timestamp";
  /** Default value field. */
  public static final String DEFAULT_VALUE_FIELD = "value";
  /** Default aggregation method. */
  public static final String DEFAULT_METHOD = "sum";
  /** Default window width. */
  public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);
  /** Default batch concurrency. */
  public static final int DEFAULT_WORKERS = 4;
  /** Upper bound accepted from configuration files and the command line. */
  public static final int MAX_WORKERS = 1024;

  public CompressorConfig {
    valueFields = valueFields == null ? null : List.copyOf(valueFields);
    groupByFields = groupByFields == null ? null : List.copyOf(groupByFields);
    uniqueFields = uniqueFields == null ? null : List.copyOf(uniqueFields);
  }

  /**
   * Returns a configuration with every setting at its default.
   *
   * @return resolved default configuration
   */
  public static CompressorConfig defaults() {
    return new CompressorConfig(null, null, null, null, null, null, 0).resolve();
  }

  /**
   * Fills every unset setting with its default. Only zero values count as unset: {@code null} or
   * empty strings (a whitespace-only name is kept), {@code null} or empty lists, a {@code null} or
   * zero window, and workers {@code <= 0}. Never throws; resolving twice yields an equal value.
   *
   * @return fully populated configuration
   */
  public CompressorConfig resolve() {
    return new CompressorConfig(
        isEmpty(timestampField) ? DEFAULT_TIMESTAMP_FIELD : timestampField,
        valueFields == null || valueFields.isEmpty() ? List.of(DEFAULT_VALUE_FIELD) : valueFields,
        groupByFields == null ? List.of() : groupByFields,
        uniqueFields == null ? List.of() : uniqueFields,
        isEmpty(method) ? DEFAULT_METHOD : method,
        window == null || window.isZero() ? DEFAULT_WINDOW : window,
        workers <= 0 ? DEFAULT_WORKERS : workers);
  }

  /**
   * Whole seconds of the window, falling back to 60 when that truncates to zero (a sub-second
   * window). A negative window keeps its sign; the grouping engine buckets by its magnitude.
   *
   * @return bucket width in seconds, never zero
   */
  public long windowSeconds() {
    long seconds = window == null ? 0 : window.getSeconds();
    if (window != null && window.isNegative() && window.getNano() > 0) {
      // getSeconds() floors; truncate toward zero like the positive case.
      seconds++;
    }
    return seconds == 0 ? DEFAULT_WINDOW.getSeconds() : seconds;
  }

  /**
   * Parses compressor keys from a merged configuration map and resolves defaults.
   *
   * <p>Recognised keys: {@code timestamp}, {@code values}, {@code groupBy} (or {@code groupby}),
   * {@code unique}, {@code method}, {@code window}, {@code workers}. Unknown keys are ignored.</p>
   *
   * @param args flat configuration map; must not be {@code null}
   * @return resolved configuration
   * @throws IllegalArgumentException if a duration or worker count is malformed
   */
  public static CompressorConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String timestamp = trimToNull(args.get("timestamp"));
    if (timestamp != null) {
      Strings.requireNonBlank("timestamp", timestamp);
    }
    String rawWindow = trimToNull(args.get("window"));
    Duration window = rawWindow == null ? null : Durations.parse("window", rawWindow);
    String rawWorkers = trimToNull(args.get("workers"));
    int workers = rawWorkers == null ? 0 : Numbers.parseInt("workers", rawWorkers, 1, MAX_WORKERS);
    return new CompressorConfig(
        timestamp,
        Strings.splitList("values", args.get("values")),
        Strings.splitList("groupBy", firstNonBlank(args.get("groupBy"), args.get("groupby"))),
        Strings.splitList("unique", args.get("unique")),
        trimToNull(args.get("method")),
        window,
        workers).resolve();
  }

  private static boolean isEmpty(String value) {
    return value == null || value.isEmpty();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static String firstNonBlank(String primary, String fallback) {
    return isBlank(primary) ? fallback : primary;
  }
}
