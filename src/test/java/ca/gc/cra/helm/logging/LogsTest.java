package ca.gc.cra.helm.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreReturnedUnchanged() {
    String value = "say hi";

    assertSame(value, Logs.truncate(value));
  }

  @Test
  void longValuesAreCutWithLengthSuffix() {
    assertEquals("abc... (truncated, 3 of 6)", Logs.truncate("abcdef", 3));
  }

  @Test
  void cutInsideMultibyteCharacterDropsThePartialCodepoint() {
    assertEquals("a... (truncated, 2 of 4)", Logs.truncate("a\u00e9b", 2));
  }

  @Test
  void nullValueAndNonPositiveLimit() {
    assertEquals("<null>", Logs.truncate(null));
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }
}
