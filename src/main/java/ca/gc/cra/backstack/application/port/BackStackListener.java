package ca.gc.cra.backstack.application.port;

import ca.gc.cra.backstack.domain.nav.BackStack;
import ca.gc.cra.backstack.domain.nav.BackStackSnapshot;

/**
 * <strong>What:</strong> Outbound port notified once per back stack mutation.
 * <p><strong>Why:</strong> Reactive rendering layers recompute from a consistent snapshot instead of polling.</p>
 * <p><strong>Role:</strong> Implemented by rendering bridges, {@code LoggingBackStackListener}, and
 * {@code InMemoryBackStackListener}.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the mutating thread after the stack state is fully updated.</p>
 * <p><strong>Performance:</strong> Called synchronously inside the mutation; implementations should not block.</p>
 *
 * @param <R> record type of the observed stack
 * @since 0.1.0
 */
@FunctionalInterface
public interface BackStackListener<R extends BackStack.Record> {
  /**
   * Receives the snapshot produced by a mutation.
   *
   * @param snapshot post-mutation snapshot; never {@code null}
   */
  void onChanged(BackStackSnapshot<R> snapshot);

  /**
   * Handle returned on registration; closing it unregisters the listener.
   */
  interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
