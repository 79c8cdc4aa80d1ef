package ca.gc.cra.backstack.application.port;

import ca.gc.cra.backstack.domain.nav.Destination;
import java.util.List;
import java.util.Optional;

/**
 * <strong>What:</strong> Inbound navigation port used by presentation logic.
 * <p><strong>Why:</strong> Screens request navigation by intent; the navigator decides how that maps onto the
 * back stack.</p>
 * <p><strong>Thread-safety:</strong> Same rules as the underlying back stack.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.backstack.application.nav.BackStackNavigator
 */
public interface Navigator {
  /**
   * Navigates forward to {@code destination}.
   *
   * @param destination destination to present; must not be {@code null}
   */
  void goTo(Destination destination);

  /**
   * Navigates back one step.
   *
   * @return destination that was left, or empty if nothing was popped
   */
  Optional<Destination> pop();

  /**
   * Clears the history and makes {@code newRoot} the only destination.
   *
   * @param newRoot new root destination; must not be {@code null}
   * @return destinations that were removed, top-first
   */
  List<Destination> resetRoot(Destination newRoot);
}
