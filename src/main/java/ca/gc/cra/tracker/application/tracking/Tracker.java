package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.ClockPort;
import ca.gc.cra.tracker.application.port.HostApplication;
import ca.gc.cra.tracker.application.port.TrackerDelegate;
import ca.gc.cra.tracker.application.port.TrackingClient;
import ca.gc.cra.tracker.domain.events.Event;
import ca.gc.cra.tracker.domain.events.Events;
import ca.gc.cra.tracker.domain.events.ViewEvent;
import ca.gc.cra.tracker.domain.scene.SceneRef;
import ca.gc.cra.tracker.domain.tracking.TrackingTask;
import ca.gc.cra.tracker.logging.Logs;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point for reporting events, visitor identity updates and screen views.
 * <p><strong>Why:</strong> Application code gets a uniform, non-blocking API while transport, retries and visitor
 * state stay with the host's collaborators.</p>
 * <p><strong>Role:</strong> Context carrier stamping events with a visitor id (frozen at construction) and an
 * optional scene, then handing the resulting {@link TrackingTask} to the active {@link TrackingClient}.</p>
 * <p><strong>View events:</strong> firing one also signals a screen transition: a displayed overlay is dismissed
 * and the transition is recorded for scene-scoped suppression, both before the task is handed off.</p>
 * <p><strong>Errors:</strong> No call throws because of SDK lifecycle ordering. Without an active client the task
 * is returned undispatched; a client that fails during handoff is logged and the task is dropped.</p>
 * <p><strong>Thread-safety:</strong> Immutable; calls on one instance from one thread happen in program order.</p>
 *
 * @since 0.1.0
 * @see Tracking
 */
public final class Tracker {
  private static final Logger log = LoggerFactory.getLogger(Tracker.class);

  private final String visitorId;
  private final SceneRef scene;
  private final Supplier<HostApplication> hosts;
  private final ClockPort clock;

  /**
   * Creates a tracker for the host's current visitor.
   */
  public Tracker() {
    this((String) null);
  }

  /**
   * Creates a tracker for the given visitor.
   *
   * @param visitorId visitor id; {@code null} resolves to the host's current visitor id
   */
  public Tracker(String visitorId) {
    this(visitorId, null, TrackerApp::host, ClockPort.SYSTEM);
  }

  /**
   * Creates a tracker for the host's current visitor, bound to a scene.
   *
   * @param scene scene the tracked events relate to; may be {@code null}
   */
  public Tracker(SceneRef scene) {
    this(null, scene, TrackerApp::host, ClockPort.SYSTEM);
  }

  Tracker(String visitorId, SceneRef scene, Supplier<HostApplication> hosts, ClockPort clock) {
    this.hosts = Objects.requireNonNull(hosts, "hosts");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.visitorId = visitorId != null ? visitorId : hosts.get().visitorId();
    this.scene = scene;
  }

  /**
   * Creates a tracker bound to the scene containing {@code view}. The view is held weakly.
   *
   * @param view host UI object used to identify the scene; {@code null} yields an unbound tracker
   * @return tracker for the host's current visitor
   */
  public static Tracker forScene(Object view) {
    return new Tracker(view == null ? null : SceneRef.of(view));
  }

  /**
   * Sets the process-wide delegate notified about delivery lifecycle. The delegate is held weakly and
   * pushed into the active client, if there is one; clients installed later pick it up on install.
   *
   * @param delegate delegate; {@code null} clears it
   */
  public static void setDelegate(TrackerDelegate delegate) {
    TrackerApp.delegateSlot().assign(delegate, TrackerApp.host());
  }

  public String visitorId() {
    return visitorId;
  }

  public Optional<SceneRef> scene() {
    return Optional.ofNullable(scene);
  }

  /**
   * Sends a named event without payload.
   *
   * @param name event name; never {@code null}
   * @return task tracking delivery
   */
  public TrackingTask track(String name) {
    return track(name, Map.of());
  }

  /**
   * Sends a named event.
   *
   * @param name event name; never {@code null}
   * @param values payload; may be {@code null}
   * @return task tracking delivery
   */
  public TrackingTask track(String name, Map<String, ?> values) {
    return track(Events.buildNamed(name, values));
  }

  /**
   * Sends an identify event carrying visitor attributes.
   *
   * @param values visitor attributes; may be empty
   * @return task tracking delivery
   */
  public TrackingTask identify(Map<String, ?> values) {
    return track(Events.buildIdentify(values));
  }

  /**
   * Sends a view event titled after the view name.
   *
   * @param viewName screen identifier; never {@code null}
   * @return task tracking delivery
   */
  public TrackingTask view(String viewName) {
    return view(viewName, null, Map.of());
  }

  /**
   * Sends a view event.
   *
   * @param viewName screen identifier; never {@code null}
   * @param title screen title; {@code null} uses {@code viewName}
   * @return task tracking delivery
   */
  public TrackingTask view(String viewName, String title) {
    return view(viewName, title, Map.of());
  }

  /**
   * Sends a view event.
   *
   * @param viewName screen identifier; never {@code null}
   * @param title screen title; {@code null} uses {@code viewName}
   * @param values payload; may be {@code null}
   * @return task tracking delivery
   */
  public TrackingTask view(String viewName, String title, Map<String, ?> values) {
    return track(Events.buildView(viewName, title, values));
  }

  /**
   * Sends an arbitrary event. Every other tracking call funnels through here.
   *
   * @param event event to send; never {@code null}
   * @return task tracking delivery, returned without waiting for dispatch
   */
  public TrackingTask track(Event event) {
    Objects.requireNonNull(event, "event");
    HostApplication host = hosts.get();
    TrackingTask task = new TrackingTask(event, visitorId, scene, clock.nowMillis());
    if (log.isDebugEnabled()) {
      log.debug("track event={} visitor={} keys={} task={}",
          event.eventName(), Logs.visitor(visitorId), Logs.keys(event.values()), task.taskId());
    }

    if (event instanceof ViewEvent view) {
      try {
        ViewTransitionSignal.fire(host.overlay(), scene, view);
      } catch (RuntimeException ex) {
        log.warn("Overlay transition handling failed for view {}", view.viewName(), ex);
      }
    }

    Optional<TrackingClient> client = host.trackingClient();
    if (client.isEmpty()) {
      log.debug("No tracking client active; task {} not dispatched", task.taskId());
      return task;
    }
    try {
      client.get().track(task);
    } catch (RuntimeException ex) {
      log.warn("Tracking client rejected task {}", task.taskId(), ex);
      task.tryClaim().ifPresent(completion -> completion.drop(ex));
    }
    return task;
  }
}
