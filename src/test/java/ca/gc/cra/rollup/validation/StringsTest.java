package ca.gc.cra.rollup.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void sanitizeTopicAllowsSafeCharacters() {
    assertEquals("timeseries.raw-1", Strings.sanitizeTopic("inputTopic", " timeseries.raw-1 "));
  }

  @Test
  void sanitizeTopicRejectsInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.sanitizeTopic("inputTopic", "raw topic"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAsciiAndExcessLength() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("attrs", "v☃l", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abc", 2));
  }

  @Test
  void splitListTrimsAndDropsEmptyEntries() {
    assertEquals(List.of("host", "device.id"), Strings.splitList("groupBy", " host , ,device.id,"));
    assertEquals(List.of(), Strings.splitList("groupBy", "  "));
    assertEquals(List.of(), Strings.splitList("groupBy", null));
  }
}
