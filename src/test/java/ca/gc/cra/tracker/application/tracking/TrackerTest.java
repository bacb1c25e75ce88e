package ca.gc.cra.tracker.application.tracking;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracker.domain.events.IdentifyEvent;
import ca.gc.cra.tracker.domain.events.NamedEvent;
import ca.gc.cra.tracker.domain.events.ViewEvent;
import ca.gc.cra.tracker.domain.scene.SceneRef;
import ca.gc.cra.tracker.domain.tracking.TrackingState;
import ca.gc.cra.tracker.domain.tracking.TrackingTask;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrackerTest {
  private final List<String> calls = new ArrayList<>();
  private RecordingOverlay overlay;
  private RecordingTrackingClient client;
  private DefaultHostApplication host;

  @BeforeEach
  void setUp() {
    overlay = new RecordingOverlay(calls);
    client = new RecordingTrackingClient(calls);
    host = new DefaultHostApplication("visitor-global", overlay, TrackerApp.delegateSlot());
    host.setTrackingClient(client);
    TrackerApp.install(host);
  }

  @AfterEach
  void tearDown() {
    TrackerApp.reset();
  }

  @Test
  void trackBuildsNamedEventForGlobalVisitor() {
    TrackingTask task = new Tracker().track("purchase", Map.of("amount", 500));

    NamedEvent event = assertInstanceOf(NamedEvent.class, task.event());
    assertEquals("purchase", event.eventName().value());
    assertEquals(Map.of("amount", 500), event.values());
    assertEquals("visitor-global", task.visitorId());
    assertEquals(TrackingState.PENDING, task.state());
    assertSame(task, client.tasks().get(0));
  }

  @Test
  void identifyBuildsIdentifyEvent() {
    TrackingTask task = new Tracker().identify(Map.of("email", "a@example.com"));

    IdentifyEvent event = assertInstanceOf(IdentifyEvent.class, task.event());
    assertEquals(Map.of("email", "a@example.com"), event.values());
  }

  @Test
  void viewDefaultsTitleAndDismissesOverlayBeforeDispatch() {
    overlay.present();

    TrackingTask task = new Tracker().view("product_detail");

    ViewEvent event = assertInstanceOf(ViewEvent.class, task.event());
    assertEquals("product_detail", event.viewName());
    assertEquals("product_detail", event.title());
    assertTrue(event.values().isEmpty());
    assertEquals(1, overlay.dismissals());
    assertEquals(List.of("dismiss", "transition:product_detail", "track:view"), calls);
  }

  @Test
  void replacedOverlayHandlesLaterTransitions() {
    List<String> replacementCalls = new ArrayList<>();
    RecordingOverlay replacement = new RecordingOverlay(replacementCalls);
    replacement.present();
    host.setOverlay(replacement);

    new Tracker().view("checkout");

    assertEquals(1, replacement.dismissals());
    assertEquals(List.of("dismiss", "transition:checkout"), replacementCalls);
    assertEquals(List.of("track:view"), calls);
  }

  @Test
  void viewWithTitleKeepsTitle() {
    TrackingTask task = new Tracker().view("product_detail", "Product");

    ViewEvent event = assertInstanceOf(ViewEvent.class, task.event());
    assertEquals("Product", event.title());
    assertEquals(0, overlay.dismissals());
    assertEquals(List.of("transition:product_detail", "track:view"), calls);
  }

  @Test
  void nonViewEventsLeaveOverlayAlone() {
    overlay.present();

    new Tracker().track("add_to_cart");
    new Tracker().identify(Map.of());

    assertEquals(0, overlay.dismissals());
    assertEquals(List.of("track:add_to_cart", "track:identify"), calls);
  }

  @Test
  void visitorIdIsFrozenAtConstruction() {
    Tracker tracker = new Tracker();
    host.setVisitorId("visitor-renewed");

    assertEquals("visitor-global", tracker.visitorId());
    assertEquals("visitor-global", tracker.track("purchase").visitorId());
    assertEquals("visitor-renewed", new Tracker().visitorId());
  }

  @Test
  void taskIsStampedFromClock() {
    Tracker tracker = new Tracker(null, null, TrackerApp::host, () -> 1_700_000_000_000L);

    TrackingTask task = tracker.track("purchase");

    assertEquals(1_700_000_000_000L, task.createdAtMillis());
    assertEquals("visitor-global", task.visitorId());
  }

  @Test
  void explicitVisitorIdWins() {
    TrackingTask task = new Tracker("visitor-explicit").track("purchase");

    assertEquals("visitor-explicit", task.visitorId());
  }

  @Test
  void sceneBoundTrackerStampsSceneAndRoutesTransition() {
    Object window = new Object();
    Tracker tracker = Tracker.forScene(window);

    TrackingTask task = tracker.view("cart");

    SceneRef scene = task.scene().orElseThrow();
    assertSame(window, scene.resolve().orElseThrow());
    assertSame(scene, overlay.scenes().get(0));
    assertEquals("visitor-global", tracker.visitorId());
  }

  @Test
  void returnsPendingTaskWithoutClient() {
    host.setTrackingClient(null);

    TrackingTask task = new Tracker().track("purchase");

    assertNotNull(task);
    assertEquals(TrackingState.PENDING, task.state());
    assertTrue(client.tasks().isEmpty());
  }

  @Test
  void clientFailureDropsTaskWithoutThrowing() {
    client.failWith(new IllegalStateException("broken"));

    TrackingTask task = assertDoesNotThrow(() -> new Tracker().track("purchase"));

    assertEquals(TrackingState.DROPPED, task.state());
  }

  @Test
  void overlayFailureStillDispatches() {
    DefaultHostApplication failingHost = new DefaultHostApplication("visitor-global", new RecordingOverlay(calls) {
      @Override
      public boolean isPresenting() {
        throw new IllegalStateException("overlay not ready");
      }
    }, TrackerApp.delegateSlot());
    failingHost.setTrackingClient(client);
    TrackerApp.install(failingHost);

    TrackingTask task = new Tracker().view("home");

    assertSame(task, client.tasks().get(0));
  }

  @Test
  void staticFormsUseDefaultTracker() {
    TrackingTask named = Tracking.track("purchase", Map.of("amount", 500));
    TrackingTask view = Tracking.view("product_detail", "Product", Map.of("sku", "A-1"));

    assertEquals("visitor-global", named.visitorId());
    assertEquals("Product", ((ViewEvent) view.event()).title());
    assertEquals(2, client.tasks().size());
  }
}
