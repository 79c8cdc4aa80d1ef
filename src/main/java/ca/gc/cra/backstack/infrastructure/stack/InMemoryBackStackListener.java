package ca.gc.cra.backstack.infrastructure.stack;

import ca.gc.cra.backstack.application.port.BackStackListener;
import ca.gc.cra.backstack.domain.nav.BackStack;
import ca.gc.cra.backstack.domain.nav.BackStackSnapshot;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory listener used for tests and diagnostics.
 *
 * @param <R> record type
 * @since 0.1.0
 */
public final class InMemoryBackStackListener<R extends BackStack.Record> implements BackStackListener<R> {
  private final CopyOnWriteArrayList<BackStackSnapshot<R>> snapshots = new CopyOnWriteArrayList<>();

  @Override
  public void onChanged(BackStackSnapshot<R> snapshot) {
    snapshots.add(Objects.requireNonNull(snapshot, "snapshot"));
  }

  /**
   * Returns the received snapshots in delivery order.
   *
   * @return immutable list of snapshots
   */
  public List<BackStackSnapshot<R>> snapshots() {
    return List.copyOf(snapshots);
  }

  public Optional<BackStackSnapshot<R>> last() {
    return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
  }

  /**
   * Clears the captured snapshots.
   */
  public void clear() {
    snapshots.clear();
  }
}
