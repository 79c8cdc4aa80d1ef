package ca.gc.cra.backstack.application.nav;

import ca.gc.cra.backstack.application.port.Navigator;
import java.util.Objects;

/**
 * Helpers for driving a {@link Navigator} from {@link NavEvent}s.
 *
 * @since 0.1.0
 */
public final class Navigators {
  private Navigators() {}

  /**
   * Applies a navigation event to {@code navigator}.
   *
   * @param navigator navigator to drive; must not be {@code null}
   * @param event event to apply; must not be {@code null}
   */
  public static void onNavEvent(Navigator navigator, NavEvent event) {
    Objects.requireNonNull(navigator, "navigator");
    Objects.requireNonNull(event, "event");
    if (event instanceof NavEvent.GoTo goTo) {
      navigator.goTo(goTo.destination());
    } else if (event instanceof NavEvent.Pop) {
      navigator.pop();
    } else if (event instanceof NavEvent.ResetRoot reset) {
      navigator.resetRoot(reset.newRoot());
    } else {
      throw new IllegalArgumentException("Unsupported navigation event: " + event);
    }
  }
}
