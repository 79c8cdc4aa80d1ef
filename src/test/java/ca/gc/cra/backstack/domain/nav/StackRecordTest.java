package ca.gc.cra.backstack.domain.nav;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.backstack.testutil.TestScreen;
import org.junit.jupiter.api.Test;

class StackRecordTest {

  @Test
  void explicitKeyIsTrimmedAndKept() {
    StackRecord record = new StackRecord("  home-1  ", TestScreen.HOME);

    assertEquals("home-1", record.key());
    assertSame(TestScreen.HOME, record.destination());
  }

  @Test
  void blankKeyIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new StackRecord("   ", TestScreen.HOME));
  }

  @Test
  void nullDestinationIsRejected() {
    assertThrows(NullPointerException.class, () -> new StackRecord("k", null));
  }

  @Test
  void ofMintsDistinctKeysForTheSameDestination() {
    StackRecord first = StackRecord.of(TestScreen.DETAIL);
    StackRecord second = StackRecord.of(TestScreen.DETAIL);

    assertEquals(RecordKeys.KEY_LENGTH, first.key().length());
    assertNotEquals(first.key(), second.key());
    assertEquals(first.destination(), second.destination());
    assertNotEquals(first, second);
  }
}
