package ca.gc.cra.tracker.application.port;

import ca.gc.cra.tracker.domain.events.ViewEvent;
import ca.gc.cra.tracker.domain.scene.SceneRef;

/**
 * <strong>What:</strong> Port onto the in-app message (overlay) subsystem.
 * <p><strong>Why:</strong> View events double as screen-transition signals; the tracker dismisses a visible
 * overlay and records the transition so scene-scoped suppression policy can use it.</p>
 * <p><strong>Role:</strong> Outbound port; the suppression policy itself lives behind it.</p>
 * <p><strong>Thread-safety:</strong> Called synchronously on the tracking caller's thread.</p>
 *
 * @since 0.1.0
 */
public interface OverlayPort {
  /**
   * Reports whether an overlay is currently displayed.
   *
   * @return {@code true} when an overlay is on screen
   */
  boolean isPresenting();

  /**
   * Requests dismissal of the displayed overlay.
   */
  void dismiss();

  /**
   * Records a screen transition against a scene.
   *
   * @param scene scene the view belongs to; may be {@code null} for the default scene
   * @param view view event that triggered the transition; never {@code null}
   */
  void recordTransition(SceneRef scene, ViewEvent view);

  /**
   * Overlay port for hosts without an overlay subsystem.
   */
  OverlayPort NO_OP = new OverlayPort() {
    @Override public boolean isPresenting() {
      return false;
    }

    @Override public void dismiss() {}

    @Override public void recordTransition(SceneRef scene, ViewEvent view) {}
  };
}
