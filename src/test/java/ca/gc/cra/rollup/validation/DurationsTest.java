package ca.gc.cra.rollup.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class DurationsTest {

  @Test
  void parsesBareSecondsUnitsAndIso() {
    assertEquals(Duration.ofSeconds(90), Durations.parse("window", "90"));
    assertEquals(Duration.ofSeconds(90), Durations.parse("window", "1m30s"));
    assertEquals(Duration.ofMinutes(90), Durations.parse("window", "1.5h"));
    assertEquals(Duration.ofMillis(500), Durations.parse("window", "500ms"));
    assertEquals(Duration.ofMinutes(1), Durations.parse("window", "PT1M"));
    assertEquals(Duration.ZERO, Durations.parse("window", "0s"));
  }

  @Test
  void rejectsNegativeOrUnknownForms() {
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("window", "-1s"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("window", "PT-1M"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("window", "5 minutes"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("window", "1d"));
    assertThrows(IllegalArgumentException.class, () -> Durations.parse("window", ""));
  }

  @Test
  void formatUsesLargestExactUnit() {
    assertEquals("60s", Durations.format(Duration.ofSeconds(60)));
    assertEquals("1500ms", Durations.format(Duration.ofMillis(1500)));
    assertEquals("1500ns", Durations.format(Duration.ofNanos(1500)));
  }
}
