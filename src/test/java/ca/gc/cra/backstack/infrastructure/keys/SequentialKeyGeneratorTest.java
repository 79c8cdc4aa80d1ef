package ca.gc.cra.backstack.infrastructure.keys;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class SequentialKeyGeneratorTest {

  @Test
  void countsUpFromOne() {
    SequentialKeyGenerator keys = new SequentialKeyGenerator("screen");

    assertEquals("screen-1", keys.nextKey());
    assertEquals("screen-2", keys.nextKey());
  }

  @Test
  void continuesAfterLastIssued() {
    SequentialKeyGenerator keys = new SequentialKeyGenerator(" nav ", 41L);

    assertEquals("nav-42", keys.nextKey());
  }

  @Test
  void defaultPrefixIsRecord() {
    assertEquals("record-1", new SequentialKeyGenerator().nextKey());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new SequentialKeyGenerator(" "));
    assertThrows(IllegalArgumentException.class, () -> new SequentialKeyGenerator("nav", -1L));
    assertThrows(NullPointerException.class, () -> new SequentialKeyGenerator(null));
  }
}
