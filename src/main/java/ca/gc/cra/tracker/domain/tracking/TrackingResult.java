package ca.gc.cra.tracker.domain.tracking;

import java.util.Objects;
import java.util.Optional;

/**
 * Final outcome of a {@link TrackingTask}.
 *
 * @param state terminal state; never {@code null}
 * @param attempts number of delivery attempts made
 * @param failure cause of failure or drop; may be {@code null}
 * @since 0.1.0
 */
public record TrackingResult(TrackingState state, int attempts, Throwable failure) {
  public TrackingResult {
    state = Objects.requireNonNull(state, "state");
    if (!state.isTerminal()) {
      throw new IllegalArgumentException("result state must be terminal: " + state);
    }
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0");
    }
  }

  public boolean isSuccess() {
    return state == TrackingState.ACKNOWLEDGED;
  }

  public Optional<Throwable> cause() {
    return Optional.ofNullable(failure);
  }
}
