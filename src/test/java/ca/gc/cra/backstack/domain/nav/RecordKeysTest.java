package ca.gc.cra.backstack.domain.nav;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.backstack.testutil.TestScreen;
import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RecordKeysTest {
  private static final String ALPHABET = "0123456789ABCDEFGHJKMNPQRSTVWXYZ";

  @Test
  void generates26CharKeyFromCrockfordAlphabet() {
    String key = RecordKeys.newKey();

    assertEquals(26, key.length());
    for (char c : key.toCharArray()) {
      assertTrue(ALPHABET.indexOf(c) >= 0, "unexpected character " + c + " in " + key);
    }
  }

  @Test
  void timePrefixSortsByEpochMillis() {
    String earlier = RecordKeys.newKey(1_000L);
    String later = RecordKeys.newKey(2_000L);

    assertTrue(earlier.substring(0, 10).compareTo(later.substring(0, 10)) < 0);
  }

  @Test
  void autoGeneratedKeysNeverCollide() {
    int count = 200_000;
    Set<String> seen = new HashSet<>(count * 2);
    for (int i = 0; i < count; i++) {
      String key = StackRecord.of(TestScreen.HOME).key();
      assertTrue(seen.add(key), "duplicate key minted after " + i + " records: " + key);
    }
  }
}
