package ca.gc.cra.tracker.adapter.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tracker.application.port.TrackingTransport.EncodedEvent;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.Test;

class KafkaTrackingTransportTest {
  private static final EncodedEvent EVENT =
      new EncodedEvent("task-1", "visitor-1", "purchase", "{\"event_name\":\"purchase\"}");

  @Test
  void publishesKeyedByVisitor() throws Exception {
    MockProducer<String, String> producer = MockProducerFactory.autoCompleting();
    KafkaTrackingTransport transport = new KafkaTrackingTransport(producer, "tracker.events", Duration.ofSeconds(1));

    transport.send(EVENT);

    List<ProducerRecord<String, String>> history = producer.history();
    assertEquals(1, history.size());
    ProducerRecord<String, String> record = history.get(0);
    assertEquals("tracker.events", record.topic());
    assertEquals("visitor-1", record.key());
    assertEquals("{\"event_name\":\"purchase\"}", record.value());
  }

  @Test
  void unacknowledgedSendTimesOut() {
    MockProducer<String, String> producer = MockProducerFactory.neverCompleting();
    KafkaTrackingTransport transport = new KafkaTrackingTransport(producer, "tracker.events", Duration.ofMillis(20));

    IOException ex = assertThrows(IOException.class, () -> transport.send(EVENT));
    assertInstanceOf(TimeoutException.class, ex.getCause());
  }

  @Test
  void closeFlushesAndClosesProducer() {
    MockProducer<String, String> producer = MockProducerFactory.autoCompleting();
    KafkaTrackingTransport transport = new KafkaTrackingTransport(producer, "tracker.events", Duration.ofSeconds(1));

    transport.close();

    assertTrue(producer.closed());
  }

  @Test
  void rejectsInvalidTopic() {
    MockProducer<String, String> producer = MockProducerFactory.autoCompleting();

    assertThrows(IllegalArgumentException.class,
        () -> new KafkaTrackingTransport(producer, "tracker events", Duration.ofSeconds(1)));
  }
}
