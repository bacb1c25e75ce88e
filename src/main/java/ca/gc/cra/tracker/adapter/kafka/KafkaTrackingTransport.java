package ca.gc.cra.tracker.adapter.kafka;

import ca.gc.cra.tracker.application.port.TrackingTransport;
import ca.gc.cra.tracker.validation.Strings;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;

/**
 * Kafka transport that publishes encoded tracking events to a topic, keyed by visitor id so one visitor's
 * events stay on one partition.
 *
 * <p>{@link #send(EncodedEvent)} waits for the broker acknowledgement (bounded by {@code sendTimeout}) so the
 * calling client can retry or fail the task; it runs on the dispatch worker, never on the tracking caller.</p>
 *
 * @since 0.1.0
 */
public final class KafkaTrackingTransport implements TrackingTransport {
  private final Producer<String, String> producer;
  private final String topic;
  private final Duration sendTimeout;

  /**
   * Creates a transport backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic topic receiving tracking events
   * @param sendTimeout maximum wait for a broker acknowledgement
   * @throws IllegalArgumentException if {@code bootstrapServers} or {@code topic} is blank or malformed
   */
  public KafkaTrackingTransport(String bootstrapServers, String topic, Duration sendTimeout) {
    this(createProducer(bootstrapServers), topic, sendTimeout);
  }

  KafkaTrackingTransport(Producer<String, String> producer, String topic, Duration sendTimeout) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("topic", topic);
    this.sendTimeout = Objects.requireNonNull(sendTimeout, "sendTimeout");
  }

  @Override
  public void send(EncodedEvent event) throws IOException {
    Objects.requireNonNull(event, "event");
    try {
      producer.send(new ProducerRecord<>(topic, event.visitorId(), event.json()))
          .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while publishing task " + event.taskId(), ex);
    } catch (ExecutionException ex) {
      throw new IOException("Kafka rejected task " + event.taskId(), ex.getCause());
    } catch (TimeoutException ex) {
      throw new IOException("Timed out publishing task " + event.taskId(), ex);
    }
  }

  /**
   * Flushes pending records and closes the producer.
   *
   * @implNote Waits up to five seconds for in-flight send operations to complete.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    String servers = Strings.requireNonBlank("bootstrapServers", bootstrapServers);
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, servers);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
