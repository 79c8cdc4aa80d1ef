package ca.gc.cra.backstack.infrastructure.stack;

import ca.gc.cra.backstack.domain.nav.BackStack;
import ca.gc.cra.backstack.domain.nav.Destination;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Decorator that places every operation of a {@link BackStack} behind one mutual-exclusion boundary.
 *
 * <p>Use when more than one thread mutates the same history. {@link #popUntil(Predicate)} runs entirely under
 * the lock, so no other writer interleaves with an unwind; the predicate must not call back into this stack
 * from another thread. {@link #popIfDeeperThan(int)} checks the depth and pops under the same lock. Iteration
 * walks a copy taken under the lock.</p>
 *
 * @param <R> record type
 * @since 0.1.0
 */
public final class SynchronizedBackStack<R extends BackStack.Record> implements BackStack<R> {
  private final BackStack<R> delegate;
  private final Object lock = new Object();

  /**
   * Wraps {@code delegate}; callers must stop using the delegate directly.
   *
   * @param delegate stack to guard; must not be {@code null}
   */
  public SynchronizedBackStack(BackStack<R> delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public int size() {
    synchronized (lock) {
      return delegate.size();
    }
  }

  @Override
  public Optional<R> topRecord() {
    synchronized (lock) {
      return delegate.topRecord();
    }
  }

  @Override
  public void push(R record) {
    synchronized (lock) {
      delegate.push(record);
    }
  }

  @Override
  public void push(Destination destination) {
    synchronized (lock) {
      delegate.push(destination);
    }
  }

  @Override
  public Optional<R> pop() {
    synchronized (lock) {
      return delegate.pop();
    }
  }

  @Override
  public Optional<R> popIfDeeperThan(int depth) {
    synchronized (lock) {
      return delegate.popIfDeeperThan(depth);
    }
  }

  @Override
  public void popUntil(Predicate<? super R> predicate) {
    synchronized (lock) {
      delegate.popUntil(predicate);
    }
  }

  @Override
  public Iterator<R> iterator() {
    List<R> copy = new ArrayList<>();
    synchronized (lock) {
      for (R record : delegate) {
        copy.add(record);
      }
    }
    return List.copyOf(copy).iterator();
  }
}
