package ca.gc.cra.tracker.domain.events;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Opaque event-name token.
 *
 * <p>Names are carried as supplied; {@link #isValid()} only reports whether the token follows the
 * collection naming rules so the transmission layer can warn about it. Construction never rejects a
 * non-null name.</p>
 *
 * @param value raw event name; never {@code null}
 * @since 0.1.0
 */
public record EventName(String value) {
  /** Name reserved for identify events. */
  public static final EventName IDENTIFY = new EventName("identify");
  /** Name reserved for view events. */
  public static final EventName VIEW = new EventName("view");

  static final int MAX_LENGTH = 255;
  private static final Pattern TOKEN = Pattern.compile("^[a-z0-9_]+$");

  public EventName {
    value = Objects.requireNonNull(value, "value");
  }

  /**
   * Indicates whether the name matches {@code [a-z0-9_]+}, fits in {@value #MAX_LENGTH} characters and
   * does not use the underscore prefix reserved for internal events.
   *
   * @return {@code true} when the name is a well-formed token
   */
  public boolean isValid() {
    return !value.isEmpty()
        && value.length() <= MAX_LENGTH
        && value.charAt(0) != '_'
        && TOKEN.matcher(value).matches();
  }

  @Override
  public String toString() {
    return value;
  }
}
