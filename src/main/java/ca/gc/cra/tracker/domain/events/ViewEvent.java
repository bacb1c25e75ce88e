package ca.gc.cra.tracker.domain.events;

import java.util.Map;
import java.util.Objects;

/**
 * Screen-view event. Besides being reported, firing one marks a screen transition in the host
 * application.
 *
 * @param viewName screen identifier; never {@code null}
 * @param title human-readable screen title; {@code null} falls back to {@code viewName}
 * @param values payload; {@code null} is treated as empty
 * @since 0.1.0
 */
public record ViewEvent(String viewName, String title, Map<String, Object> values) implements Event {
  public ViewEvent {
    viewName = Objects.requireNonNull(viewName, "viewName");
    title = title == null ? viewName : title;
    values = Events.copyValues(values);
  }

  @Override
  public EventName eventName() {
    return EventName.VIEW;
  }
}
