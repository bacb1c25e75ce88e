package ca.gc.cra.tracker.domain.events;

import java.util.Map;

/**
 * Immutable tracking event reported by host application code.
 *
 * <p><strong>Variants:</strong> {@link NamedEvent} for freeform events, {@link IdentifyEvent} for visitor
 * attribute updates and {@link ViewEvent} for screen transitions. Every variant carries a payload of
 * encodable values keyed by string.</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable records and safe to share across threads.</p>
 *
 * @since 0.1.0
 * @see Events
 */
public sealed interface Event permits NamedEvent, IdentifyEvent, ViewEvent {
  /**
   * Returns the wire name of the event.
   *
   * @return event name token; never {@code null}
   */
  EventName eventName();

  /**
   * Returns the payload attached to the event.
   *
   * @return unmodifiable payload; never {@code null}
   */
  Map<String, Object> values();
}
