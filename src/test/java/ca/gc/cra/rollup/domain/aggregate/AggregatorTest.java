package ca.gc.cra.rollup.domain.aggregate;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class AggregatorTest {
  private static final List<Double> VALUES = List.of(5.0, 2.0, 8.0, 1.0);

  @Test
  void reducesWithEachMethod() {
    assertEquals(16.0, Aggregator.aggregate(VALUES, AggregationMethod.SUM));
    assertEquals(4.0, Aggregator.aggregate(VALUES, AggregationMethod.AVG));
    assertEquals(1.0, Aggregator.aggregate(VALUES, AggregationMethod.MIN));
    assertEquals(8.0, Aggregator.aggregate(VALUES, AggregationMethod.MAX));
    assertEquals(4.0, Aggregator.aggregate(VALUES, AggregationMethod.COUNT));
    assertEquals(5.0, Aggregator.aggregate(VALUES, AggregationMethod.FIRST));
    assertEquals(1.0, Aggregator.aggregate(VALUES, AggregationMethod.LAST));
  }

  @Test
  void emptyOrMissingValuesReduceToZero() {
    for (AggregationMethod method : AggregationMethod.values()) {
      assertEquals(0.0, Aggregator.aggregate(List.of(), method), method.name());
    }
    assertEquals(0.0, Aggregator.aggregate(null, AggregationMethod.MAX));
  }

  @Test
  void negativeValuesKeepTheirSign() {
    List<Double> values = List.of(-3.0, -7.5);
    assertEquals(-3.0, Aggregator.aggregate(values, AggregationMethod.MAX));
    assertEquals(-7.5, Aggregator.aggregate(values, AggregationMethod.MIN));
    assertEquals(-10.5, Aggregator.aggregate(values, AggregationMethod.SUM));
  }

  @Test
  void nullMethodSums() {
    assertEquals(16.0, Aggregator.aggregate(VALUES, null));
  }
}
