package ca.gc.cra.tracker.application.port;

import ca.gc.cra.tracker.domain.tracking.TrackingTask;

/**
 * <strong>What:</strong> Port for the transmission collaborator that delivers tracking tasks.
 * <p><strong>Why:</strong> Keeps the tracker free of serialization, retry and transport concerns.</p>
 * <p><strong>Role:</strong> Outbound port owned by the {@link HostApplication}; the tracker hands every task to
 * the active client and returns immediately.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accept tasks without blocking the caller.</li>
 *   <li>Claim each task and drive it to a terminal state.</li>
 *   <li>Notify the current {@link TrackerDelegate} about delivery lifecycle.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #track(TrackingTask)} may be called from any thread; the delegate field
 * may be replaced concurrently with dispatch.</p>
 *
 * @since 0.1.0
 */
public interface TrackingClient extends AutoCloseable {
  /**
   * Accepts a task for asynchronous delivery.
   *
   * @param task task created by the tracker; never {@code null}
   */
  void track(TrackingTask task);

  /**
   * Returns the delegate currently notified about delivery lifecycle.
   *
   * @return delegate, or {@code null} when none is set or it has been collected
   */
  TrackerDelegate delegate();

  /**
   * Replaces the delegate notified about delivery lifecycle. Implementations hold it weakly.
   *
   * @param delegate new delegate; {@code null} clears it
   */
  void setDelegate(TrackerDelegate delegate);

  @Override
  default void close() {}
}
