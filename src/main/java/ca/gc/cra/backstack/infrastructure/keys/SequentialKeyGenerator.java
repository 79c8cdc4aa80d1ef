package ca.gc.cra.backstack.infrastructure.keys;

import ca.gc.cra.backstack.application.port.KeyGenerator;
import ca.gc.cra.backstack.validation.Strings;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Key generator producing {@code <prefix>-<n>} from a monotonically increasing counter.
 *
 * <p>Readable keys for logs and tests. Keys are unique per generator instance only; two generators sharing a
 * prefix collide, so use one instance per stack family.</p>
 *
 * @since 0.1.0
 */
public final class SequentialKeyGenerator implements KeyGenerator {
  /** Prefix used when none is configured. */
  public static final String DEFAULT_PREFIX = "record";

  private final String prefix;
  private final AtomicLong counter;

  /**
   * Creates a generator whose first key is {@code <prefix>-1}.
   *
   * @param prefix non-blank key prefix
   * @throws IllegalArgumentException if {@code prefix} is blank or contains control characters
   */
  public SequentialKeyGenerator(String prefix) {
    this(prefix, 0L);
  }

  /**
   * Creates a generator continuing after {@code lastIssued}.
   *
   * @param prefix non-blank key prefix
   * @param lastIssued counter value already used; the next key uses {@code lastIssued + 1}
   * @throws IllegalArgumentException if {@code prefix} is invalid or {@code lastIssued} is negative
   */
  public SequentialKeyGenerator(String prefix, long lastIssued) {
    this.prefix = Strings.requireNonBlank("prefix", prefix);
    if (lastIssued < 0) {
      throw new IllegalArgumentException("lastIssued must be >= 0");
    }
    this.counter = new AtomicLong(lastIssued);
  }

  public SequentialKeyGenerator() {
    this(DEFAULT_PREFIX);
  }

  @Override
  public String nextKey() {
    return prefix + '-' + counter.incrementAndGet();
  }
}
