package ca.gc.cra.rollup.domain.aggregate;

/**
 * <strong>What:</strong> Reduction applied to the values collected for one group.
 * <p><strong>Why:</strong> The method also decides which timestamp a group reports: the first or last
 * observation for {@link #FIRST}/{@link #LAST}, the midpoint otherwise.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum AggregationMethod {
  /** Sum of all values. */
  SUM,
  /** Arithmetic mean; also accepted as {@code mean}. */
  AVG,
  /** Smallest value. */
  MIN,
  /** Largest value. */
  MAX,
  /** Number of values collected. */
  COUNT,
  /** First value in scan order. */
  FIRST,
  /** Last value in scan order. */
  LAST;

  /**
   * Parses a method name. Names match exactly ({@code avg}, not {@code AVG}); anything else,
   * including blank or differently cased names, falls back to {@link #SUM}.
   *
   * @param name configured method name; may be {@code null}
   * @return matching method, never {@code null}
   */
  public static AggregationMethod fromName(String name) {
    if (name == null) {
      return SUM;
    }
    return switch (name) {
      case "avg", "mean" -> AVG;
      case "min" -> MIN;
      case "max" -> MAX;
      case "count" -> COUNT;
      case "first" -> FIRST;
      case "last" -> LAST;
      default -> SUM;
    };
  }

  /**
   * Picks the timestamp a group reports from its first- and last-seen observations.
   *
   * @param firstSeen smallest timestamp in the group
   * @param lastSeen largest timestamp in the group
   * @return emitted timestamp; the midpoint truncates toward zero
   */
  public long emittedTimestamp(long firstSeen, long lastSeen) {
    return switch (this) {
      case FIRST -> firstSeen;
      case LAST -> lastSeen;
      default -> (firstSeen + lastSeen) / 2;
    };
  }
}
