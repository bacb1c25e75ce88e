package ca.gc.cra.tracker.application.port;

import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Port for the wire that carries encoded tracking events to the collection endpoint.
 * <p><strong>Why:</strong> Separates retry and lifecycle handling in the client from the concrete carrier
 * (logs, memory, Kafka).</p>
 * <p><strong>Thread-safety:</strong> Invoked from the dispatch worker; implementations need not be reentrant unless
 * documented.</p>
 *
 * @since 0.1.0
 */
public interface TrackingTransport extends AutoCloseable {
  /**
   * Sends one encoded event. Returning normally means the endpoint accepted it.
   *
   * @param event encoded event; never {@code null}
   * @throws IOException when delivery fails and may be retried
   */
  void send(EncodedEvent event) throws IOException;

  @Override
  default void close() throws IOException {}

  /**
   * Encoded event ready for transmission.
   *
   * @param taskId originating task identifier
   * @param visitorId visitor identity, used as the partitioning key
   * @param eventName wire event name
   * @param json JSON body
   */
  record EncodedEvent(String taskId, String visitorId, String eventName, String json) {
    public EncodedEvent {
      Objects.requireNonNull(taskId, "taskId");
      Objects.requireNonNull(visitorId, "visitorId");
      Objects.requireNonNull(eventName, "eventName");
      Objects.requireNonNull(json, "json");
    }
  }
}
