package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.OverlayPort;
import ca.gc.cra.tracker.domain.events.ViewEvent;
import ca.gc.cra.tracker.domain.scene.SceneRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the screen-transition side effects of a view event.
 *
 * <p>Must run before the task leaves the tracker so a late response for the previous screen cannot
 * resurrect an overlay on a screen the user already left.</p>
 */
final class ViewTransitionSignal {
  private static final Logger log = LoggerFactory.getLogger(ViewTransitionSignal.class);

  private ViewTransitionSignal() {}

  static void fire(OverlayPort overlay, SceneRef scene, ViewEvent view) {
    if (overlay.isPresenting()) {
      log.debug("Dismissing overlay on transition to view {}", view.viewName());
      overlay.dismiss();
    }
    overlay.recordTransition(scene, view);
  }
}
