package ca.gc.cra.rollup.domain.aggregate;

import java.util.List;

/**
 * Reduces a list of numbers with an {@link AggregationMethod}.
 *
 * <p>Total: an empty or {@code null} list yields {@code 0} for every method, never NaN.</p>
 *
 * @since 0.1.0
 */
public final class Aggregator {
  private Aggregator() {
    // Utility
  }

  /**
   * Aggregates {@code values} with {@code method}.
   *
   * @param values values in scan order; may be {@code null}
   * @param method reduction to apply; {@code null} reads as {@link AggregationMethod#SUM}
   * @return aggregate, or {@code 0} for an empty list
   */
  public static double aggregate(List<Double> values, AggregationMethod method) {
    if (values == null || values.isEmpty()) {
      return 0;
    }
    AggregationMethod effective = method == null ? AggregationMethod.SUM : method;
    return switch (effective) {
      case SUM -> sum(values);
      case AVG -> sum(values) / values.size();
      case MIN -> {
        double min = values.get(0);
        for (double v : values) {
          min = Math.min(min, v);
        }
        yield min;
      }
      case MAX -> {
        double max = values.get(0);
        for (double v : values) {
          max = Math.max(max, v);
        }
        yield max;
      }
      case COUNT -> values.size();
      case FIRST -> values.get(0);
      case LAST -> values.get(values.size() - 1);
    };
  }

  private static double sum(List<Double> values) {
    double total = 0;
    for (double v : values) {
      total += v;
    }
    return total;
  }
}
