package ca.gc.cra.tracker.infrastructure.json;

import ca.gc.cra.tracker.application.port.TrackingTransport.EncodedEvent;
import ca.gc.cra.tracker.domain.events.Event;
import ca.gc.cra.tracker.domain.events.ViewEvent;
import ca.gc.cra.tracker.domain.tracking.TrackingTask;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.Objects;

/**
 * Encodes tracking tasks into the JSON body sent by the transmission layer.
 *
 * <p>Layout: {@code task_id}, {@code visitor_id}, {@code created_at} (epoch millis), optional
 * {@code scene_id}, {@code event_name} and {@code values}. View events carry {@code view_name} and
 * {@code title} inside {@code values}.</p>
 * <p>Supported payload values: {@code null}, strings and other {@link CharSequence}s, booleans, numbers,
 * enums (by name), {@link Instant} and {@link Date} (epoch seconds), maps with string keys, iterables and
 * object arrays. Anything else is rejected with {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class EventJsonEncoder {
  static final int MAX_DEPTH = 32;

  private final JsonFactory factory = new JsonFactory();

  /**
   * Encodes a task, substituting {@code event} for the task's own event (e.g. after delegate interception).
   *
   * @param task task being delivered; never {@code null}
   * @param event event to encode; never {@code null}
   * @return encoded event
   * @throws IllegalArgumentException when the payload holds an unsupported value
   */
  public EncodedEvent encode(TrackingTask task, Event event) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(event, "event");
    StringWriter out = new StringWriter(256);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("task_id", task.taskId());
      gen.writeStringField("visitor_id", task.visitorId());
      gen.writeNumberField("created_at", task.createdAtMillis());
      if (task.scene().isPresent()) {
        gen.writeStringField("scene_id", task.scene().get().sceneId());
      }
      gen.writeStringField("event_name", event.eventName().value());
      gen.writeFieldName("values");
      gen.writeStartObject();
      if (event instanceof ViewEvent view) {
        gen.writeStringField("view_name", view.viewName());
        gen.writeStringField("title", view.title());
      }
      for (Map.Entry<String, Object> entry : event.values().entrySet()) {
        gen.writeFieldName(entry.getKey());
        writeValue(gen, entry.getValue(), 1);
      }
      gen.writeEndObject();
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode task " + task.taskId(), ex);
    }
    return new EncodedEvent(task.taskId(), task.visitorId(), event.eventName().value(), out.toString());
  }

  private void writeValue(JsonGenerator gen, Object value, int depth) throws IOException {
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("payload nesting exceeds " + MAX_DEPTH + " levels");
    }
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof CharSequence text) {
      gen.writeString(text.toString());
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      gen.writeNumber(((Number) value).longValue());
    } else if (value instanceof BigInteger big) {
      gen.writeNumber(big);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof Enum<?> constant) {
      gen.writeString(constant.name());
    } else if (value instanceof Instant instant) {
      gen.writeNumber(instant.getEpochSecond());
    } else if (value instanceof Date date) {
      gen.writeNumber(date.getTime() / 1000L);
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("payload map keys must be strings: " + entry.getKey());
        }
        gen.writeFieldName(key);
        writeValue(gen, entry.getValue(), depth + 1);
      }
      gen.writeEndObject();
    } else if (value instanceof Iterable<?> items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item, depth + 1);
      }
      gen.writeEndArray();
    } else if (value instanceof Object[] items) {
      gen.writeStartArray();
      for (Object item : items) {
        writeValue(gen, item, depth + 1);
      }
      gen.writeEndArray();
    } else {
      throw new IllegalArgumentException("unsupported payload value type " + value.getClass().getName());
    }
  }
}
