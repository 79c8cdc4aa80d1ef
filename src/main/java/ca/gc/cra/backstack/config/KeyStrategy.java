package ca.gc.cra.backstack.config;

import java.util.Locale;

/**
 * How keys are minted for records pushed as bare destinations.
 *
 * @since 0.1.0
 */
public enum KeyStrategy {
  /** Time-prefixed random 26-character keys. */
  ULID,
  /** {@code <prefix>-<n>} keys from a per-factory counter shared by every stack the factory creates. */
  SEQUENTIAL;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code ulid} or {@code sequential}; blank yields {@link #ULID}
   * @return matching strategy
   * @throws IllegalArgumentException if {@code raw} names no strategy
   */
  public static KeyStrategy from(String raw) {
    if (raw == null || raw.isBlank()) {
      return ULID;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "ulid" -> ULID;
      case "sequential" -> SEQUENTIAL;
      default -> throw new IllegalArgumentException("keys.strategy must be ulid|sequential, got: " + raw);
    };
  }
}
