package ca.gc.cra.rollup.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreReturnedUnchanged() {
    assertEquals("[1,2]", Logs.truncate("[1,2]", 16));
  }

  @Test
  void longPayloadsAreCutWithSizeSuffix() {
    byte[] payload = "abcdefghij".getBytes(StandardCharsets.UTF_8);

    assertEquals("abcd... (truncated, 4 of 10)", Logs.truncate(payload, 4));
  }

  @Test
  void cutNeverSplitsMultiByteCharacters() {
    byte[] payload = "aéb".getBytes(StandardCharsets.UTF_8);

    assertEquals("a... (truncated, 2 of 4)", Logs.truncate(payload, 2));
  }

  @Test
  void nullRendersPlaceholderAndLimitMustBePositive() {
    assertEquals("<null>", Logs.truncate((byte[]) null, 4));
    assertEquals("<null>", Logs.truncate((String) null, 4));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate(new byte[] {1}, 0));
  }
}
