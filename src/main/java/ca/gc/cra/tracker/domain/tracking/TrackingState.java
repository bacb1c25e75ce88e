package ca.gc.cra.tracker.domain.tracking;

/**
 * Delivery state of a {@link TrackingTask}.
 *
 * @since 0.1.0
 */
public enum TrackingState {
  /** Created and handed off; no delivery attempt yet. */
  PENDING,
  /** At least one delivery attempt has started. */
  SENT,
  /** Collection endpoint accepted the event. */
  ACKNOWLEDGED,
  /** Delivery gave up after exhausting attempts or failing to encode. */
  FAILED,
  /** Discarded without delivery, e.g. on shutdown or a full dispatch queue. */
  DROPPED;

  /**
   * Indicates whether no further transition is possible.
   *
   * @return {@code true} for {@link #ACKNOWLEDGED}, {@link #FAILED} and {@link #DROPPED}
   */
  public boolean isTerminal() {
    return this == ACKNOWLEDGED || this == FAILED || this == DROPPED;
  }

  boolean canMoveTo(TrackingState next) {
    return switch (this) {
      case PENDING -> next != PENDING;
      case SENT -> next.isTerminal();
      case ACKNOWLEDGED, FAILED, DROPPED -> false;
    };
  }
}
