package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.TrackerDelegate;
import ca.gc.cra.tracker.domain.events.Event;
import ca.gc.cra.tracker.domain.tracking.TrackingTask;
import java.util.Map;

/**
 * One-shot static forms of the {@link Tracker} operations. Each call builds a default tracker for the
 * host's current visitor and delegates to it.
 *
 * @since 0.1.0
 */
public final class Tracking {
  private Tracking() {}

  public static TrackingTask track(String name) {
    return new Tracker().track(name);
  }

  public static TrackingTask track(String name, Map<String, ?> values) {
    return new Tracker().track(name, values);
  }

  public static TrackingTask track(Event event) {
    return new Tracker().track(event);
  }

  public static TrackingTask identify(Map<String, ?> values) {
    return new Tracker().identify(values);
  }

  public static TrackingTask view(String viewName) {
    return new Tracker().view(viewName);
  }

  public static TrackingTask view(String viewName, String title) {
    return new Tracker().view(viewName, title);
  }

  public static TrackingTask view(String viewName, String title, Map<String, ?> values) {
    return new Tracker().view(viewName, title, values);
  }

  /**
   * Same as {@link Tracker#setDelegate(TrackerDelegate)}.
   *
   * @param delegate delegate; {@code null} clears it
   */
  public static void setDelegate(TrackerDelegate delegate) {
    Tracker.setDelegate(delegate);
  }
}
