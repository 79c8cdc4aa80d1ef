package ca.gc.cra.backstack.application.nav;

import ca.gc.cra.backstack.application.port.MetricsPort;
import ca.gc.cra.backstack.application.port.Navigator;
import ca.gc.cra.backstack.domain.nav.BackStack;
import ca.gc.cra.backstack.domain.nav.Destination;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link Navigator} that translates navigation intents into back stack operations.
 * <p><strong>Why:</strong> Keeps the rule "back never removes the root" out of individual screens.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>{@link #goTo(Destination)} pushes the destination.</li>
 *   <li>{@link #pop()} pops unless the stack is at its root; at the root it hands the root destination to the
 *   root-pop callback (typically closing the host) and leaves the stack untouched.</li>
 *   <li>{@link #resetRoot(Destination)} drains the stack and pushes the new root.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Same as the wrapped stack. Over a {@code SynchronizedBackStack} concurrent
 * {@link #pop()} calls never remove the root, since the depth check and the pop happen under one lock.</p>
 * <p><strong>Observability:</strong> Emits {@code navigator.goTo}, {@code navigator.pop}, {@code navigator.rootPop}
 * and {@code navigator.resetRoot}.</p>
 *
 * @param <R> record type of the wrapped stack
 * @since 0.1.0
 */
public final class BackStackNavigator<R extends BackStack.Record> implements Navigator {
  private static final Logger log = LoggerFactory.getLogger(BackStackNavigator.class);

  private final BackStack<R> backStack;
  private final Consumer<? super Destination> onRootPop;
  private final MetricsPort metrics;

  /**
   * Creates a navigator.
   *
   * @param backStack stack to drive; must not be {@code null}
   * @param onRootPop invoked with the root destination when back is requested at the root; {@code null} ignores it
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public BackStackNavigator(
      BackStack<R> backStack, Consumer<? super Destination> onRootPop, MetricsPort metrics) {
    this.backStack = Objects.requireNonNull(backStack, "backStack");
    this.onRootPop = onRootPop == null ? root -> {} : onRootPop;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Creates a navigator without metrics.
   *
   * @param backStack stack to drive; must not be {@code null}
   * @param onRootPop invoked with the root destination when back is requested at the root
   */
  public BackStackNavigator(BackStack<R> backStack, Consumer<? super Destination> onRootPop) {
    this(backStack, onRootPop, MetricsPort.NO_OP);
  }

  @Override
  public void goTo(Destination destination) {
    Objects.requireNonNull(destination, "destination");
    backStack.push(destination);
    metrics.increment("navigator.goTo");
  }

  @Override
  public Optional<Destination> pop() {
    Optional<Destination> left = backStack.popIfDeeperThan(1).map(BackStack.Record::destination);
    if (left.isPresent()) {
      metrics.increment("navigator.pop");
      return left;
    }
    Optional<Destination> root = backStack.topRecord().map(BackStack.Record::destination);
    if (root.isPresent()) {
      metrics.increment("navigator.rootPop");
      log.debug("Back requested at root; delegating to root-pop handler");
      onRootPop.accept(root.get());
    }
    return Optional.empty();
  }

  @Override
  public List<Destination> resetRoot(Destination newRoot) {
    Objects.requireNonNull(newRoot, "newRoot");
    List<Destination> removed = new ArrayList<>(backStack.size());
    for (R record : backStack) {
      removed.add(record.destination());
    }
    backStack.popUntil(record -> false);
    backStack.push(newRoot);
    metrics.increment("navigator.resetRoot");
    log.debug("Reset root; removed {} destination(s)", removed.size());
    return List.copyOf(removed);
  }

  public BackStack<R> backStack() {
    return backStack;
  }
}
