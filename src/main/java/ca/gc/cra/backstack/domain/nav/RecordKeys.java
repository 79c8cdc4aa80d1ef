package ca.gc.cra.backstack.domain.nav;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * <strong>What:</strong> Mints ULID-style opaque keys for back stack records.
 * <p><strong>Why:</strong> Records pushed as bare destinations need a key that does not collide with any
 * other minted key, even when two records wrap the same destination.</p>
 * <p><strong>Role:</strong> Domain utility behind {@link StackRecord#of(Destination)} and the default
 * {@code KeyGenerator}.</p>
 * <p><strong>Thread-safety:</strong> Stateless static methods leveraging {@link ThreadLocalRandom}; safe for
 * concurrent use.</p>
 * <p><strong>Performance:</strong> Allocates a 26-character {@link String} per key.</p>
 *
 * @implNote 48 bits of epoch millis followed by 80 random bits, Crockford base32. Not suitable for
 * cryptographic purposes.
 * @since 0.1.0
 */
public final class RecordKeys {
  /** Length of every key produced by this class. */
  public static final int KEY_LENGTH = 26;

  private static final char[] ENC = "0123456789ABCDEFGHJKMNPQRSTVWXYZ".toCharArray();

  private RecordKeys() {}

  /**
   * Mints a key stamped with the current time.
   *
   * @return 26-character key
   */
  public static String newKey() {
    return newKey(Instant.now().toEpochMilli());
  }

  /**
   * Mints a key stamped with the given time.
   *
   * @param epochMillis epoch milliseconds component of the key
   * @return 26-character key
   */
  public static String newKey(long epochMillis) {
    ThreadLocalRandom random = ThreadLocalRandom.current();
    return buildKey(epochMillis, random.nextLong(), random.nextLong());
  }

  private static String buildKey(long epochMillis, long r1, long r2) {
    char[] out = new char[KEY_LENGTH];
    encodeTime(epochMillis, out);
    encodeRandom(r1, r2, out);
    return new String(out);
  }

  private static void encodeTime(long v, char[] d) {
    for (int i = 9; i >= 0; i--) {
      d[i] = ENC[(int) (v & 31)];
      v >>>= 5;
    }
  }

  // 80 random bits: 16 chars, the low 40 bits of r2 fill 18..25 and 40 bits from r1 fill 10..17.
  private static void encodeRandom(long r1, long r2, char[] d) {
    long high = r1;
    long low = r2;
    for (int i = KEY_LENGTH - 1; i >= 18; i--) {
      d[i] = ENC[(int) (low & 31)];
      low >>>= 5;
    }
    for (int i = 17; i >= 10; i--) {
      d[i] = ENC[(int) (high & 31)];
      high >>>= 5;
    }
  }
}
