package ca.gc.cra.backstack.domain.nav;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Caller-supplied stack of {@link Record}s presented by a navigator.
 * <p><strong>Why:</strong> Gives navigation controllers a single history abstraction with push, pop, and
 * predicate-driven unwind.</p>
 * <p><strong>Role:</strong> Core domain contract; implemented by {@code ObservableBackStack} and decorated by
 * {@code SynchronizedBackStack}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold records in LIFO order; the most recently pushed record is the top.</li>
 *   <li>Iterate top-first: the first element is the top, the last is the root.</li>
 *   <li>Treat an empty pop as a normal outcome, never an error.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not required; implementations document their own guarantees.</p>
 * <p><strong>Performance:</strong> {@link #push(Record)} and {@link #pop()} are O(1);
 * {@link #popUntil(Predicate)} is O(k) for k removed records.</p>
 *
 * @param <R> record type held by this stack
 * @since 0.1.0
 */
public interface BackStack<R extends BackStack.Record> extends Iterable<R> {
  /**
   * Returns the number of records an iterator over this stack will see.
   *
   * @return record count; never negative
   */
  int size();

  /**
   * Returns the top-most record.
   *
   * @return the top record, or {@link Optional#empty()} when the stack is empty
   */
  Optional<R> topRecord();

  /**
   * Pushes a record; it becomes the new top.
   *
   * @param record record to push; must not be {@code null}
   * @throws NullPointerException if {@code record} is {@code null}
   */
  void push(R record);

  /**
   * Envelopes a destination in a freshly keyed record and pushes it.
   *
   * @param destination destination to present; must not be {@code null}
   * @throws NullPointerException if {@code destination} is {@code null}
   */
  void push(Destination destination);

  /**
   * Removes the top record.
   *
   * @return the removed record, or {@link Optional#empty()} if the stack was empty
   */
  Optional<R> pop();

  /**
   * Pops records off the top until the current top matches {@code predicate} or the stack is empty.
   *
   * <p>The predicate is evaluated on the current top before each pop decision and never on a record that
   * was already removed. A predicate that never matches drains the stack. On an empty stack the predicate is
   * not evaluated at all.</p>
   *
   * @param predicate stop condition evaluated top-down; must not be {@code null}
   * @throws NullPointerException if {@code predicate} is {@code null}
   */
  default void popUntil(Predicate<? super R> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    Optional<R> top = topRecord();
    while (top.isPresent() && !predicate.test(top.get())) {
      pop();
      top = topRecord();
    }
  }

  /**
   * Removes the top record only when more than {@code depth} records are held.
   *
   * <p>Implementations shared between threads must perform the size check and the pop as one step.</p>
   *
   * @param depth number of bottom records to keep; must not be negative
   * @return the removed record, or {@link Optional#empty()} if {@code size() <= depth}
   * @throws IllegalArgumentException if {@code depth} is negative
   */
  default Optional<R> popIfDeeperThan(int depth) {
    if (depth < 0) {
      throw new IllegalArgumentException("depth must not be negative: " + depth);
    }
    return size() > depth ? pop() : Optional.empty();
  }

  /**
   * Returns whether the stack holds no records.
   *
   * @return {@code true} iff {@code size() == 0}
   */
  default boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Returns whether the stack holds exactly its root record.
   *
   * @return {@code true} iff {@code size() == 1}
   */
  default boolean isAtRoot() {
    return size() == 1;
  }

  /**
   * <strong>What:</strong> Identity-bearing entry of a {@link BackStack}.
   * <p>Any type exposing a stable key and a destination qualifies.</p>
   *
   * <p><strong>Invariant:</strong> {@link #key()} must not change for the life of the record and should be
   * unique among records held by the same stack. Uniqueness is a caller obligation; consumers that associate
   * data by key see undefined results when it is violated.</p>
   */
  interface Record {
    /**
     * Identifies this record uniquely, even when another record wraps an equal destination.
     *
     * @return stable non-blank key
     */
    String key();

    /**
     * Returns the destination that presents this record.
     *
     * @return destination descriptor; never {@code null}
     */
    Destination destination();
  }
}
