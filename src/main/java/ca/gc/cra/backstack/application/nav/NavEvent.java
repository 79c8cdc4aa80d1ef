package ca.gc.cra.backstack.application.nav;

import ca.gc.cra.backstack.domain.nav.Destination;
import java.util.Objects;

/**
 * Navigation intent raised by presentation logic and applied with
 * {@link Navigators#onNavEvent(ca.gc.cra.backstack.application.port.Navigator, NavEvent)}.
 *
 * @since 0.1.0
 */
public sealed interface NavEvent permits NavEvent.GoTo, NavEvent.Pop, NavEvent.ResetRoot {

  /**
   * Navigate forward to {@code destination}.
   *
   * @param destination target destination
   */
  record GoTo(Destination destination) implements NavEvent {
    public GoTo {
      Objects.requireNonNull(destination, "destination");
    }
  }

  /** Navigate back one step. */
  record Pop() implements NavEvent {}

  /**
   * Replace the whole history with {@code newRoot}.
   *
   * @param newRoot new root destination
   */
  record ResetRoot(Destination newRoot) implements NavEvent {
    public ResetRoot {
      Objects.requireNonNull(newRoot, "newRoot");
    }
  }
}
