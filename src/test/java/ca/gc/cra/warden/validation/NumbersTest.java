package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1L, Numbers.requireRange("timeout", 1, 1, 10));
    assertEquals(10L, Numbers.requireRange("timeout", 10, 1, 10));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("timeout", 0, 1, 10));
    assertEquals("timeout must be between 1 and 10 (was 0)", ex.getMessage());
  }

  @Test
  void parseInRangeRejectsNonNumeric() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInRange("timeout", "ten", 1, 10));
  }

  @Test
  void parseInRangeTrims() {
    assertEquals(5L, Numbers.parseInRange("timeout", " 5 ", 1, 10));
  }
}
