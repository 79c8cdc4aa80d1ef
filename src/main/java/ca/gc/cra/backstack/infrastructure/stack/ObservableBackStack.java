package ca.gc.cra.backstack.infrastructure.stack;

import ca.gc.cra.backstack.application.port.BackStackListener;
import ca.gc.cra.backstack.application.port.KeyGenerator;
import ca.gc.cra.backstack.application.port.MetricsPort;
import ca.gc.cra.backstack.domain.nav.BackStack;
import ca.gc.cra.backstack.domain.nav.BackStackChange;
import ca.gc.cra.backstack.domain.nav.BackStackSnapshot;
import ca.gc.cra.backstack.domain.nav.Destination;
import ca.gc.cra.backstack.domain.nav.StackRecord;
import ca.gc.cra.backstack.logging.Logs;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Deque-backed {@link BackStack} that publishes a versioned snapshot after every mutation.
 * <p><strong>Why:</strong> Rendering layers subscribe once and always observe size, top, and order together.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep records in top-first order with O(1) push and pop.</li>
 *   <li>Mint records for bare destinations through the configured record factory.</li>
 *   <li>Publish exactly one snapshot per state change; an unwind publishes once, not per removed record.</li>
 *   <li>Apply the {@link DuplicateKeyPolicy} on push.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine to the navigation thread or wrap with
 * {@link SynchronizedBackStack}. {@link #snapshot()} and {@link #addListener(BackStackListener)} may be called
 * from any thread.</p>
 * <p><strong>Delivery:</strong> A listener that mutates the stack from {@code onChanged} does not interrupt the
 * current delivery; its snapshot is queued and delivered to every listener after the current one, so each
 * listener sees versions in ascending order and ends on the latest state.</p>
 * <p><strong>Observability:</strong> Emits {@code backstack.push}, {@code backstack.pop}, {@code backstack.pop.empty},
 * {@code backstack.popUntil.removed}, {@code backstack.size}, {@code backstack.duplicateKey} and
 * {@code backstack.listener.failure}.</p>
 *
 * @param <R> record type
 * @since 0.1.0
 */
public final class ObservableBackStack<R extends BackStack.Record> implements BackStack<R> {
  private static final Logger log = LoggerFactory.getLogger(ObservableBackStack.class);
  private static final int DESCRIBE_MAX_BYTES = 128;
  private static final int DEFAULT_INITIAL_CAPACITY = 16;

  private final ArrayDeque<R> records;
  private final Function<Destination, ? extends R> recordFactory;
  private final MetricsPort metrics;
  private final DuplicateKeyPolicy duplicateKeyPolicy;
  private final CopyOnWriteArrayList<BackStackListener<R>> listeners = new CopyOnWriteArrayList<>();

  private final ArrayDeque<BackStackSnapshot<R>> pending = new ArrayDeque<>();

  private volatile BackStackSnapshot<R> current = BackStackSnapshot.initial();
  private int batchDepth;
  private boolean publishing;

  /**
   * Creates a stack.
   *
   * @param recordFactory wraps a bare destination in a freshly keyed record; must not be {@code null}
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param duplicateKeyPolicy push-time key check; falls back to {@link DuplicateKeyPolicy#IGNORE} when {@code null}
   * @param initialCapacity expected depth; values below one use the default
   */
  public ObservableBackStack(
      Function<Destination, ? extends R> recordFactory,
      MetricsPort metrics,
      DuplicateKeyPolicy duplicateKeyPolicy,
      int initialCapacity) {
    this.recordFactory = Objects.requireNonNull(recordFactory, "recordFactory");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.duplicateKeyPolicy = duplicateKeyPolicy == null ? DuplicateKeyPolicy.IGNORE : duplicateKeyPolicy;
    this.records = new ArrayDeque<>(initialCapacity < 1 ? DEFAULT_INITIAL_CAPACITY : initialCapacity);
  }

  /**
   * Creates a permissive stack without metrics.
   *
   * @param recordFactory wraps a bare destination in a freshly keyed record; must not be {@code null}
   */
  public ObservableBackStack(Function<Destination, ? extends R> recordFactory) {
    this(recordFactory, MetricsPort.NO_OP, DuplicateKeyPolicy.IGNORE, DEFAULT_INITIAL_CAPACITY);
  }

  /**
   * Creates a stack of {@link StackRecord}s keyed by {@link KeyGenerator#ULID}.
   *
   * @return new empty stack
   */
  public static ObservableBackStack<StackRecord> create() {
    return withKeys(KeyGenerator.ULID);
  }

  /**
   * Creates a stack of {@link StackRecord}s keyed by the given generator.
   *
   * @param keys key source for bare destinations; must not be {@code null}
   * @return new empty stack
   */
  public static ObservableBackStack<StackRecord> withKeys(KeyGenerator keys) {
    Objects.requireNonNull(keys, "keys");
    return new ObservableBackStack<>(destination -> new StackRecord(keys.nextKey(), destination));
  }

  @Override
  public int size() {
    return records.size();
  }

  @Override
  public Optional<R> topRecord() {
    return Optional.ofNullable(records.peekFirst());
  }

  @Override
  public void push(R record) {
    Objects.requireNonNull(record, "record");
    checkKey(record);
    records.addFirst(record);
    metrics.increment("backstack.push");
    if (log.isDebugEnabled()) {
      log.debug("Pushed record {} -> {} (size={})",
          record.key(), Logs.describe(record.destination(), DESCRIBE_MAX_BYTES), records.size());
    }
    publish(BackStackChange.PUSH);
  }

  @Override
  public void push(Destination destination) {
    Objects.requireNonNull(destination, "destination");
    R record = Objects.requireNonNull(recordFactory.apply(destination), "recordFactory returned null");
    push(record);
  }

  @Override
  public Optional<R> pop() {
    R removed = records.pollFirst();
    if (removed == null) {
      metrics.increment("backstack.pop.empty");
      log.debug("Pop on empty back stack");
      return Optional.empty();
    }
    metrics.increment("backstack.pop");
    log.debug("Popped record {} (size={})", removed.key(), records.size());
    publish(BackStackChange.POP);
    return Optional.of(removed);
  }

  /**
   * Unwinds like {@link BackStack#popUntil(Predicate)} but publishes a single {@link BackStackChange#POP_UNTIL}
   * snapshot once the unwind stops, including when the predicate throws part way through.
   */
  @Override
  public void popUntil(Predicate<? super R> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    int before = records.size();
    batchDepth++;
    try {
      BackStack.super.popUntil(predicate);
    } finally {
      batchDepth--;
      int removed = before - records.size();
      metrics.observe("backstack.popUntil.removed", removed);
      if (removed > 0) {
        log.debug("Unwound {} record(s) (size={})", removed, records.size());
        publish(BackStackChange.POP_UNTIL);
      }
    }
  }

  /**
   * Iterates top-first over a read-only view; {@link Iterator#remove()} is unsupported.
   */
  @Override
  public Iterator<R> iterator() {
    return Collections.unmodifiableCollection(records).iterator();
  }

  /**
   * Returns the snapshot published by the most recent mutation.
   *
   * @return current snapshot; version {@code 0} before the first mutation
   */
  public BackStackSnapshot<R> snapshot() {
    return current;
  }

  /**
   * Registers a listener for subsequent mutations.
   *
   * @param listener listener to notify; must not be {@code null}
   * @return handle that unregisters the listener when closed
   */
  public BackStackListener.Subscription addListener(BackStackListener<R> listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  public DuplicateKeyPolicy duplicateKeyPolicy() {
    return duplicateKeyPolicy;
  }

  private void checkKey(R record) {
    if (duplicateKeyPolicy == DuplicateKeyPolicy.IGNORE) {
      return;
    }
    String key = record.key();
    for (R existing : records) {
      if (existing.key().equals(key)) {
        metrics.increment("backstack.duplicateKey");
        if (duplicateKeyPolicy == DuplicateKeyPolicy.FAIL) {
          throw new DuplicateKeyException(key);
        }
        log.warn("Record key {} pushed while already present on back stack", key);
        return;
      }
    }
  }

  private void publish(BackStackChange change) {
    metrics.observe("backstack.size", records.size());
    if (batchDepth > 0) {
      return;
    }
    BackStackSnapshot<R> snapshot =
        new BackStackSnapshot<>(current.version() + 1, change, List.copyOf(records));
    current = snapshot;
    pending.addLast(snapshot);
    if (publishing) {
      return;
    }
    publishing = true;
    try {
      BackStackSnapshot<R> next;
      while ((next = pending.pollFirst()) != null) {
        deliver(next);
      }
    } finally {
      publishing = false;
      pending.clear();
    }
  }

  private void deliver(BackStackSnapshot<R> snapshot) {
    for (BackStackListener<R> listener : listeners) {
      try {
        listener.onChanged(snapshot);
      } catch (RuntimeException ex) {
        metrics.increment("backstack.listener.failure");
        log.warn("Back stack listener {} failed on version {}", listener, snapshot.version(), ex);
      }
    }
  }
}
