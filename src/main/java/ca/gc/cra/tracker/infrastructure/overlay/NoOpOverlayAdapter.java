package ca.gc.cra.tracker.infrastructure.overlay;

import ca.gc.cra.tracker.application.port.OverlayPort;
import ca.gc.cra.tracker.domain.events.ViewEvent;
import ca.gc.cra.tracker.domain.scene.SceneRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Overlay adapter for hosts without an in-app messaging module. Never presents; logs transitions at TRACE.
 *
 * @since 0.1.0
 */
public final class NoOpOverlayAdapter implements OverlayPort {
  private static final Logger log = LoggerFactory.getLogger(NoOpOverlayAdapter.class);

  @Override
  public boolean isPresenting() {
    return false;
  }

  @Override
  public void dismiss() {}

  @Override
  public void recordTransition(SceneRef scene, ViewEvent view) {
    log.trace("view transition to {} in scene {}", view.viewName(), scene == null ? "default" : scene.sceneId());
  }
}
