package ca.gc.cra.tracker.domain.events;

import java.util.Map;
import java.util.Objects;

/**
 * Freeform event identified by an application-chosen name.
 *
 * @param eventName event name token; never {@code null}
 * @param values payload; {@code null} is treated as empty
 * @since 0.1.0
 */
public record NamedEvent(EventName eventName, Map<String, Object> values) implements Event {
  public NamedEvent {
    eventName = Objects.requireNonNull(eventName, "eventName");
    values = Events.copyValues(values);
  }
}
