package ca.gc.cra.tracker.domain.tracking;

import ca.gc.cra.tracker.domain.events.Event;
import ca.gc.cra.tracker.domain.scene.SceneRef;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Asynchronously completed handle binding one {@link Event} to a visitor and an optional scene.
 *
 * <p><strong>Role:</strong> Unit of work handed from the tracker to the transmission collaborator.</p>
 * <p><strong>Ownership:</strong> The creator never mutates the task after handoff. Completion state is
 * written only through the single {@link Completion} returned by {@link #tryClaim()}; any number of
 * observers may read {@link #state()} or subscribe through {@link #completion()} and
 * {@link #onComplete(Consumer)}.</p>
 * <p><strong>Thread-safety:</strong> All state is held in atomics; safe to inspect from any thread.</p>
 *
 * @since 0.1.0
 */
public final class TrackingTask {
  private final String taskId;
  private final Event event;
  private final String visitorId;
  private final SceneRef scene;
  private final long createdAtMillis;

  private final AtomicReference<TrackingState> state = new AtomicReference<>(TrackingState.PENDING);
  private final AtomicInteger attempts = new AtomicInteger();
  private final AtomicBoolean claimed = new AtomicBoolean();
  private final CompletableFuture<TrackingResult> result = new CompletableFuture<>();

  /**
   * Creates a pending task.
   *
   * @param event event to deliver; never {@code null}
   * @param visitorId visitor the event is attributed to; never {@code null}
   * @param scene scene context used for routing; may be {@code null}
   * @param createdAtMillis creation time in epoch milliseconds
   */
  public TrackingTask(Event event, String visitorId, SceneRef scene, long createdAtMillis) {
    this.taskId = UUID.randomUUID().toString();
    this.event = Objects.requireNonNull(event, "event");
    this.visitorId = Objects.requireNonNull(visitorId, "visitorId");
    this.scene = scene;
    this.createdAtMillis = createdAtMillis;
  }

  public String taskId() {
    return taskId;
  }

  public Event event() {
    return event;
  }

  public String visitorId() {
    return visitorId;
  }

  public Optional<SceneRef> scene() {
    return Optional.ofNullable(scene);
  }

  public long createdAtMillis() {
    return createdAtMillis;
  }

  public TrackingState state() {
    return state.get();
  }

  public int attempts() {
    return attempts.get();
  }

  /**
   * Returns a view of the eventual result. Completing the returned future does not affect the task.
   *
   * @return future completed when the task reaches a terminal state
   */
  public CompletableFuture<TrackingResult> completion() {
    return result.copy();
  }

  /**
   * Registers a callback invoked once the task reaches a terminal state. Runs immediately on the
   * calling thread when the task is already complete, otherwise on the completing thread.
   *
   * @param listener callback; never {@code null}
   */
  public void onComplete(Consumer<TrackingResult> listener) {
    Objects.requireNonNull(listener, "listener");
    result.thenAccept(listener);
  }

  /**
   * Hands out the write capability for this task. Succeeds exactly once.
   *
   * @return completion handle, or empty when another writer already claimed the task
   */
  public Optional<Completion> tryClaim() {
    if (!claimed.compareAndSet(false, true)) {
      return Optional.empty();
    }
    return Optional.of(new Completion());
  }

  /**
   * Hands out the write capability for this task.
   *
   * @return completion handle
   * @throws IllegalStateException when the task was already claimed
   */
  public Completion claim() {
    return tryClaim().orElseThrow(() -> new IllegalStateException("task " + taskId + " already claimed"));
  }

  @Override
  public String toString() {
    return "TrackingTask[" + taskId + ", event=" + event.eventName() + ", state=" + state.get() + "]";
  }

  /**
   * Single-writer mutation point for a {@link TrackingTask}.
   */
  public final class Completion {
    private Completion() {}

    public TrackingTask task() {
      return TrackingTask.this;
    }

    /**
     * Records the start of a delivery attempt, moving the task to {@link TrackingState#SENT}.
     *
     * @return attempt number, starting at 1
     */
    public int beginAttempt() {
      TrackingState current = state.get();
      if (current != TrackingState.SENT) {
        transition(TrackingState.SENT);
      }
      return attempts.incrementAndGet();
    }

    public void acknowledge() {
      complete(TrackingState.ACKNOWLEDGED, null);
    }

    public void fail(Throwable cause) {
      complete(TrackingState.FAILED, cause);
    }

    public void drop(Throwable cause) {
      complete(TrackingState.DROPPED, cause);
    }

    private void complete(TrackingState terminal, Throwable cause) {
      transition(terminal);
      result.complete(new TrackingResult(terminal, attempts.get(), cause));
    }

    private void transition(TrackingState next) {
      TrackingState current = state.get();
      if (!current.canMoveTo(next) || !state.compareAndSet(current, next)) {
        throw new IllegalStateException("illegal transition " + current + " -> " + next + " for task " + taskId);
      }
    }
  }
}
