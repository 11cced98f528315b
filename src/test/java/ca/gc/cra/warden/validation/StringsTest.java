package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("alice", Strings.requireNonBlank("username", "  alice  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("username", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsNull() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("username", null));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("token", "t☃k", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("token", "abc", 2));
  }

  @Test
  void trimToNullMapsBlankToNull() {
    assertNull(Strings.trimToNull("   "));
    assertNull(Strings.trimToNull(null));
    assertEquals("x", Strings.trimToNull(" x "));
  }
}
