package ca.gc.cra.backstack.infrastructure.stack;

import java.util.Locale;

/**
 * What {@link ObservableBackStack} does when a pushed record reuses a key already on the stack.
 *
 * @since 0.1.0
 */
public enum DuplicateKeyPolicy {
  /** Accept the push without checking; key uniqueness stays the caller's obligation. */
  IGNORE,
  /** Accept the push, log a warning, and count {@code backstack.duplicateKey}. */
  WARN,
  /** Reject the push with {@link DuplicateKeyException}; meant for tests and debug builds. */
  FAIL;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code ignore}, {@code warn} or {@code fail}; blank yields {@link #IGNORE}
   * @return matching policy
   * @throws IllegalArgumentException if {@code raw} names no policy
   */
  public static DuplicateKeyPolicy from(String raw) {
    if (raw == null || raw.isBlank()) {
      return IGNORE;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "ignore" -> IGNORE;
      case "warn" -> WARN;
      case "fail" -> FAIL;
      default -> throw new IllegalArgumentException("duplicateKeys must be ignore|warn|fail, got: " + raw);
    };
  }
}
