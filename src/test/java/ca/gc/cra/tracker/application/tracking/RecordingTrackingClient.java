package ca.gc.cra.tracker.application.tracking;

import ca.gc.cra.tracker.application.port.TrackerDelegate;
import ca.gc.cra.tracker.application.port.TrackingClient;
import ca.gc.cra.tracker.domain.tracking.TrackingTask;
import java.util.ArrayList;
import java.util.List;

/**
 * Test double capturing handed-off tasks and the delegate assigned to it.
 */
class RecordingTrackingClient implements TrackingClient {
  private final List<String> calls;
  private final List<TrackingTask> tasks = new ArrayList<>();
  private TrackerDelegate delegate;
  private RuntimeException failure;

  RecordingTrackingClient(List<String> calls) {
    this.calls = calls;
  }

  RecordingTrackingClient() {
    this(new ArrayList<>());
  }

  @Override
  public void track(TrackingTask task) {
    calls.add("track:" + task.event().eventName());
    if (failure != null) {
      throw failure;
    }
    tasks.add(task);
  }

  @Override
  public TrackerDelegate delegate() {
    return delegate;
  }

  @Override
  public void setDelegate(TrackerDelegate delegate) {
    this.delegate = delegate;
  }

  void failWith(RuntimeException ex) {
    this.failure = ex;
  }

  List<TrackingTask> tasks() {
    return tasks;
  }
}
