package ca.gc.cra.tracker.infrastructure.transmission;

import ca.gc.cra.tracker.application.port.TrackingTransport;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory transport used for tests and diagnostics.
 *
 * @since 0.1.0
 */
public final class InMemoryTrackingTransport implements TrackingTransport {
  private final CopyOnWriteArrayList<EncodedEvent> events = new CopyOnWriteArrayList<>();

  @Override
  public void send(EncodedEvent event) {
    events.add(Objects.requireNonNull(event, "event"));
  }

  /**
   * Returns a snapshot of sent events.
   *
   * @return immutable list of events in send order
   */
  public List<EncodedEvent> snapshot() {
    return List.copyOf(events);
  }
}
