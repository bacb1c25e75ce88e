package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.OverlayPort;
import ca.gc.cra.tracker.domain.events.ViewEvent;
import ca.gc.cra.tracker.domain.scene.SceneRef;
import java.util.ArrayList;
import java.util.List;

/**
 * Overlay double that records dismissals and transitions into a shared call log.
 */
class RecordingOverlay implements OverlayPort {
  private final List<String> calls;
  private final List<SceneRef> scenes = new ArrayList<>();
  private boolean presenting;
  private int dismissals;

  RecordingOverlay(List<String> calls) {
    this.calls = calls;
  }

  void present() {
    presenting = true;
  }

  @Override
  public boolean isPresenting() {
    return presenting;
  }

  @Override
  public void dismiss() {
    calls.add("dismiss");
    dismissals++;
    presenting = false;
  }

  @Override
  public void recordTransition(SceneRef scene, ViewEvent view) {
    calls.add("transition:" + view.viewName());
    scenes.add(scene);
  }

  int dismissals() {
    return dismissals;
  }

  List<SceneRef> scenes() {
    return scenes;
  }
}
