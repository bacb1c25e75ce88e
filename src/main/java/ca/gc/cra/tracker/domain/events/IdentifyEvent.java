package ca.gc.cra.tracker.domain.events;

import java.util.Map;

/**
 * Visitor attribute update (user id, name, email and similar). The payload may be empty.
 *
 * @param values payload; {@code null} is treated as empty
 * @since 0.1.0
 */
public record IdentifyEvent(Map<String, Object> values) implements Event {
  public IdentifyEvent {
    values = Events.copyValues(values);
  }

  @Override
  public EventName eventName() {
    return EventName.IDENTIFY;
  }
}
