package ca.gc.cra.backstack.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.backstack.testutil.TestScreen;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void describeKeepsShortValues() {
    assertEquals("TestScreen[name=home]", Logs.describe(TestScreen.HOME, 64));
  }

  @Test
  void describeTruncatesLongValues() {
    String described = Logs.describe(new TestScreen("x".repeat(200)), 32);

    assertTrue(described.startsWith("TestScreen[name=xxxxxxxxxxxxxxxx"));
    assertTrue(described.endsWith("(truncated, 32 of 217)"));
  }

  @Test
  void describeNullUsesPlaceholder() {
    assertEquals("<null>", Logs.describe(null, 8));
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("value", 0));
  }
}
