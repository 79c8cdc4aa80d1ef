package ca.gc.cra.backstack.testutil;

import ca.gc.cra.backstack.domain.nav.Destination;

/**
 * Named destination used across tests.
 */
public record TestScreen(String name) implements Destination {
  public static final TestScreen HOME = new TestScreen("home");
  public static final TestScreen LIST = new TestScreen("list");
  public static final TestScreen DETAIL = new TestScreen("detail");
  public static final TestScreen ABOUT = new TestScreen("about");
}
