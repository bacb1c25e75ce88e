package ca.gc.cra.tracker.domain.events;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders collapsing the three tracking call shapes into {@link Event} values.
 *
 * <p>No validation beyond non-null names happens here; malformed payload values surface when the
 * transmission layer encodes the event. Payloads are copied at build time: nested maps, collections and
 * arrays become unmodifiable copies, so later changes through the caller's references do not reach the
 * event. Other value objects are kept as given and should be immutable.</p>
 *
 * @since 0.1.0
 */
public final class Events {
  static final int MAX_COPY_DEPTH = 32;

  private Events() {}

  /**
   * Builds a named event.
   *
   * @param name event name; never {@code null}
   * @param values payload; may be {@code null}
   * @return named event
   */
  public static NamedEvent buildNamed(String name, Map<String, ?> values) {
    return new NamedEvent(new EventName(name), copyValues(values));
  }

  /**
   * Builds an identify event.
   *
   * @param values visitor attributes; may be {@code null} or empty
   * @return identify event
   */
  public static IdentifyEvent buildIdentify(Map<String, ?> values) {
    return new IdentifyEvent(copyValues(values));
  }

  /**
   * Builds a view event, defaulting the title to the view name when absent.
   *
   * @param viewName screen identifier; never {@code null}
   * @param title screen title; may be {@code null}
   * @param values payload; may be {@code null}
   * @return view event
   */
  public static ViewEvent buildView(String viewName, String title, Map<String, ?> values) {
    return new ViewEvent(viewName, title, copyValues(values));
  }

  // Map.copyOf rejects null values, which are legal payload entries (encoded as JSON null).
  static Map<String, Object> copyValues(Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    values.forEach((key, value) -> copy.put(key, copyValue(value, 1)));
    return Collections.unmodifiableMap(copy);
  }

  // Past MAX_COPY_DEPTH values are kept as-is; the encoder rejects payloads nested that deep.
  private static Object copyValue(Object value, int depth) {
    if (depth > MAX_COPY_DEPTH) {
      return value;
    }
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      map.forEach((key, nested) -> copy.put(key, copyValue(nested, depth + 1)));
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof Iterable<?> items) {
      List<Object> copy = new ArrayList<>();
      for (Object item : items) {
        copy.add(copyValue(item, depth + 1));
      }
      return Collections.unmodifiableList(copy);
    }
    if (value instanceof Object[] items) {
      List<Object> copy = new ArrayList<>(items.length);
      for (Object item : items) {
        copy.add(copyValue(item, depth + 1));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
