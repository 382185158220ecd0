package ca.gc.cra.helm.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("Ann", Strings.requireNonBlank("name", "  Ann "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertTrue(blank.getMessage().startsWith("name "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "An\u0007n"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void requireTokenAcceptsSingleTokens() {
    assertEquals("wave", Strings.requireToken("command", "wave"));
    assertEquals("look.around_2-x", Strings.requireToken("command", "look.around_2-x"));
  }

  @Test
  void requireTokenRejectsWhitespaceAndPunctuation() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireToken("command", "two words"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireToken("command", "go!"));
  }
}
