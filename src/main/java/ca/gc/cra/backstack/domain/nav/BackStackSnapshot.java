package ca.gc.cra.backstack.domain.nav;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable, versioned view of a back stack taken right after a mutation.
 * <p><strong>Why:</strong> Rendering layers recompute from one consistent value instead of reading
 * {@code size}, {@code topRecord} and iteration separately while the stack changes.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to hand across threads.</p>
 *
 * @param version monotonically increasing mutation counter; {@code 0} before the first mutation
 * @param change mutation that produced this snapshot
 * @param records records in top-first order; copied on construction
 * @param <R> record type
 * @since 0.1.0
 */
public record BackStackSnapshot<R extends BackStack.Record>(
    long version, BackStackChange change, List<R> records) {

  public BackStackSnapshot {
    if (version < 0) {
      throw new IllegalArgumentException("version must be >= 0");
    }
    Objects.requireNonNull(change, "change");
    records = List.copyOf(records);
  }

  /**
   * Creates the version-zero snapshot of an untouched empty stack.
   *
   * @param <R> record type
   * @return empty initial snapshot
   */
  public static <R extends BackStack.Record> BackStackSnapshot<R> initial() {
    return new BackStackSnapshot<>(0L, BackStackChange.INITIAL, List.of());
  }

  public int size() {
    return records.size();
  }

  public Optional<R> top() {
    return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  public boolean isAtRoot() {
    return records.size() == 1;
  }

  /**
   * Returns the destinations in top-first order, e.g. for breadcrumbs.
   *
   * @return immutable destination list
   */
  public List<Destination> destinations() {
    return records.stream().map(BackStack.Record::destination).toList();
  }
}
