package ca.gc.cra.backstack.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("test", null));
  }

  @Test
  void parsePositiveIntUsesDefaultForBlank() {
    assertEquals(16, Strings.parsePositiveInt("initialCapacity", " ", 16));
    assertEquals(8, Strings.parsePositiveInt("initialCapacity", " 8 ", 16));
  }

  @Test
  void parsePositiveIntRejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> Strings.parsePositiveInt("initialCapacity", "0", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.parsePositiveInt("initialCapacity", "abc", 16));
  }
}
