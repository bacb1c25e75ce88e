package ca.gc.cra.tracker.application.port;

import ca.gc.cra.tracker.domain.events.Event;
import ca.gc.cra.tracker.domain.tracking.TrackingTask;

/**
 * Observer of tracking delivery, installed through {@code Tracker.setDelegate}.
 *
 * <p>Callbacks run on the transmission collaborator's dispatch thread and should return quickly. Every
 * method has a default so implementations override only what they need.</p>
 *
 * @since 0.1.0
 */
public interface TrackerDelegate {
  /**
   * Gives the host a chance to rewrite an event right before it is encoded and sent.
   *
   * @param event event about to be sent; never {@code null}
   * @return event to send instead; returning {@code null} keeps the original
   */
  default Event intercept(Event event) {
    return event;
  }

  default void onSent(TrackingTask task) {}

  default void onAcknowledged(TrackingTask task) {}

  default void onFailed(TrackingTask task, Throwable cause) {}
}
