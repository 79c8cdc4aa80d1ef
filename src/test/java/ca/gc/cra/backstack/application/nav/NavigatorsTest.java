package ca.gc.cra.backstack.application.nav;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.backstack.application.port.Navigator;
import ca.gc.cra.backstack.domain.nav.Destination;
import ca.gc.cra.backstack.testutil.TestScreen;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class NavigatorsTest {

  @Test
  void dispatchesEachEventKind() {
    RecordingNavigator navigator = new RecordingNavigator();

    Navigators.onNavEvent(navigator, new NavEvent.GoTo(TestScreen.DETAIL));
    Navigators.onNavEvent(navigator, new NavEvent.Pop());
    Navigators.onNavEvent(navigator, new NavEvent.ResetRoot(TestScreen.HOME));

    assertEquals(List.of("goTo:detail", "pop", "resetRoot:home"), navigator.calls);
  }

  @Test
  void eventsRejectNullDestinations() {
    assertThrows(NullPointerException.class, () -> new NavEvent.GoTo(null));
    assertThrows(NullPointerException.class, () -> new NavEvent.ResetRoot(null));
    assertThrows(NullPointerException.class,
        () -> Navigators.onNavEvent(new RecordingNavigator(), null));
  }

  private static final class RecordingNavigator implements Navigator {
    private final List<String> calls = new ArrayList<>();

    @Override
    public void goTo(Destination destination) {
      calls.add("goTo:" + ((TestScreen) destination).name());
    }

    @Override
    public Optional<Destination> pop() {
      calls.add("pop");
      return Optional.empty();
    }

    @Override
    public List<Destination> resetRoot(Destination newRoot) {
      calls.add("resetRoot:" + ((TestScreen) newRoot).name());
      return List.of();
    }
  }
}
