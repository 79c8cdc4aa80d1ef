package ca.gc.cra.backstack.domain.nav;

import ca.gc.cra.backstack.validation.Strings;
import java.util.Objects;

/**
 * Default immutable {@link BackStack.Record}.
 *
 * @param key stable identifier; trimmed and validated non-blank
 * @param destination destination descriptor; never {@code null}
 * @since 0.1.0
 */
public record StackRecord(String key, Destination destination) implements BackStack.Record {
  public StackRecord {
    key = Strings.requireNonBlank("key", key);
    Objects.requireNonNull(destination, "destination");
  }

  /**
   * Wraps {@code destination} with a freshly minted key from {@link RecordKeys#newKey()}.
   *
   * @param destination destination descriptor; must not be {@code null}
   * @return new record
   */
  public static StackRecord of(Destination destination) {
    return new StackRecord(RecordKeys.newKey(), destination);
  }
}
