package ca.gc.cra.tracker.logging;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Log hygiene for tracking data.
 * <p>Visitor identifiers and event payloads may identify a person, so log statements go through these helpers
 * instead of printing raw values: identifiers are shortened, payloads are reduced to their key set, and encoded
 * bodies are cut to a byte budget.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final int VISITOR_PREFIX_CHARS = 8;

  private Logs() {
    // Utility
  }

  /**
   * Cuts a string to at most {@code maxBytes} UTF-8 bytes without splitting a code point.
   *
   * @param value string to cut; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the original value when it fits, otherwise the kept prefix followed by
   *     {@code "... (truncated, kept of total)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    int total = utf8Length(value);
    if (total <= maxBytes) {
      return value;
    }
    int kept = 0;
    int end = 0;
    while (end < value.length()) {
      int codePoint = value.codePointAt(end);
      int width = utf8Width(codePoint);
      if (kept + width > maxBytes) {
        break;
      }
      kept += width;
      end += Character.charCount(codePoint);
    }
    return value.substring(0, end) + "... (truncated, " + maxBytes + " of " + total + ")";
  }

  /**
   * Shortens a visitor identifier to a correlatable prefix.
   *
   * @param visitorId identifier; may be {@code null}
   * @return first characters of the identifier followed by an ellipsis, or the identifier itself when short
   */
  public static String visitor(String visitorId) {
    if (visitorId == null) {
      return NULL_PLACEHOLDER;
    }
    if (visitorId.length() <= VISITOR_PREFIX_CHARS) {
      return visitorId;
    }
    return visitorId.substring(0, VISITOR_PREFIX_CHARS) + "...";
  }

  /**
   * Describes a payload by its sorted key set; values are never rendered.
   *
   * @param values payload; may be {@code null}
   * @return e.g. {@code "[amount, currency]"}
   */
  public static String keys(Map<String, ?> values) {
    if (values == null || values.isEmpty()) {
      return "[]";
    }
    return new TreeSet<>(values.keySet()).toString();
  }

  /**
   * Returns the redaction placeholder.
   *
   * @param value ignored
   * @return {@code "[REDACTED]"}
   */
  public static String redact(Object value) {
    return REDACTED_PLACEHOLDER;
  }

  private static int utf8Length(String value) {
    return value.getBytes(StandardCharsets.UTF_8).length;
  }

  private static int utf8Width(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    }
    if (codePoint < 0x800) {
      return 2;
    }
    return codePoint < 0x10000 ? 3 : 4;
  }
}
