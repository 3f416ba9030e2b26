package ca.gc.cra.rollup.domain.aggregate;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class CompressionRatioTest {

  @Test
  void ratioIsFractionOfBytesSaved() {
    assertEquals(0.75, CompressionRatio.of(400, 100), 1e-9);
    assertEquals(0.0, CompressionRatio.of(100, 100), 1e-9);
  }

  @Test
  void emptyInputHasZeroRatio() {
    assertEquals(0.0, CompressionRatio.of(0, 2));
  }

  @Test
  void growthYieldsNegativeRatio() {
    assertEquals(-1.0, CompressionRatio.of(10, 20), 1e-9);
  }

  @Test
  void percentUsesTwoDecimals() {
    assertEquals("75.00%", CompressionRatio.percent(0.75));
    assertEquals("-12.50%", CompressionRatio.percent(-0.125));
  }
}
