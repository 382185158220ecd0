package ca.gc.cra.helm.domain.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SessionIdTest {

  @Test
  void valueIsTrimmedAndComparedByValue() {
    assertEquals(SessionId.of("s1"), SessionId.of(" s1 "));
    assertEquals("s1", SessionId.of("s1").toString());
  }

  @Test
  void rejectsBlankIds() {
    assertThrows(IllegalArgumentException.class, () -> SessionId.of(""));
    assertThrows(NullPointerException.class, () -> SessionId.of(null));
  }
}
