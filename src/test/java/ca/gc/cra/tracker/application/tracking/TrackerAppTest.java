package ca.gc.cra.tracker.application.tracking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracker.application.port.HostApplication;
import ca.gc.cra.tracker.application.port.OverlayPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TrackerAppTest {

  @AfterEach
  void tearDown() {
    TrackerApp.reset();
  }

  @Test
  void defaultHostHasVisitorButNoClient() {
    TrackerApp.reset();

    HostApplication host = TrackerApp.host();

    assertTrue(host.trackingClient().isEmpty());
    assertTrue(!host.visitorId().isBlank());
    assertSame(host, TrackerApp.host());
  }

  @Test
  void installReturnsPreviousHost() {
    DefaultHostApplication first = new DefaultHostApplication("a", OverlayPort.NO_OP, TrackerApp.delegateSlot());
    DefaultHostApplication second = new DefaultHostApplication("b", OverlayPort.NO_OP, TrackerApp.delegateSlot());
    TrackerApp.reset();

    assertNull(TrackerApp.install(first));
    assertSame(first, TrackerApp.install(second));
    assertEquals("b", TrackerApp.host().visitorId());
  }

  @Test
  void renewVisitorIdIssuesFreshId() {
    DefaultHostApplication host = new DefaultHostApplication("a", OverlayPort.NO_OP, TrackerApp.delegateSlot());

    String renewed = host.renewVisitorId();

    assertNotEquals("a", renewed);
    assertEquals(renewed, host.visitorId());
  }
}
