package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.HostApplication;
import ca.gc.cra.tracker.application.port.TrackerDelegate;
import ca.gc.cra.tracker.application.port.TrackingClient;
import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weakly held, swappable {@link TrackerDelegate} shared by every tracker in the process.
 *
 * <p><strong>Writers:</strong> {@link #assign(TrackerDelegate, HostApplication)} is the only write path; it
 * overwrites the slot and pushes the new value into the host's active client, if any.</p>
 * <p><strong>Initialization order:</strong> a client installed after the slot was written is brought up to
 * date through {@link #bind(TrackingClient)}, which {@link TrackerApp#install(HostApplication)} and
 * {@link DefaultHostApplication#setTrackingClient(TrackingClient)} call for every new client.</p>
 * <p><strong>Thread-safety:</strong> Reads and writes go through an {@link AtomicReference}; the last writer wins.
 * Callers publish a client before binding it, and every push re-reads the slot after writing to the client, so a
 * client visible to a concurrent {@code assign} or bound after it ends up holding the latest value.</p>
 *
 * @since 0.1.0
 */
public final class TrackerDelegateSlot {
  private static final Logger log = LoggerFactory.getLogger(TrackerDelegateSlot.class);

  private final AtomicReference<WeakReference<TrackerDelegate>> slot =
      new AtomicReference<>(new WeakReference<>(null));

  /**
   * Returns the delegate currently held.
   *
   * @return delegate, or {@code null} when empty or already collected
   */
  public TrackerDelegate current() {
    return slot.get().get();
  }

  /**
   * Stores the delegate and propagates it to the host's active client.
   *
   * @param delegate new delegate; {@code null} empties the slot
   * @param host host whose client receives the delegate; never {@code null}
   */
  public void assign(TrackerDelegate delegate, HostApplication host) {
    slot.set(new WeakReference<>(delegate));
    host.trackingClient().ifPresentOrElse(
        this::push,
        () -> log.debug("Tracker delegate stored; no tracking client active yet"));
  }

  /**
   * Copies the slot's current value into a newly installed client. Call after the client is visible
   * through its host.
   *
   * @param client client being installed; {@code null} is ignored
   */
  public void bind(TrackingClient client) {
    if (client != null) {
      push(client);
    }
  }

  // Repeats until the slot did not change while the client was being updated.
  private void push(TrackingClient client) {
    WeakReference<TrackerDelegate> seen;
    do {
      seen = slot.get();
      client.setDelegate(seen.get());
    } while (slot.get() != seen);
  }
}
