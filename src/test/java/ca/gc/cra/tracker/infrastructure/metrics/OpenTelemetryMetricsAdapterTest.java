package ca.gc.cra.tracker.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("tracking.acknowledged");
    adapter.increment("tracking.acknowledged");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "tracking.acknowledged");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("tracking.acknowledged", point.getAttributes().get(AttributeKey.stringKey("tracker.metric.key")));
    assertEquals("tracker", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("tracking.send.latencyNanos", 1_000L);
    adapter.observe("tracking.send.latencyNanos", 3_000L);

    MetricData histogram = find(reader.collectAllMetrics(), "tracking.send.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000.0, point.getSum());
  }

  @Test
  void sanitizeNameNormalizesKeys() {
    assertEquals("tracker.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("tracking.queue_depth", OpenTelemetryMetricsAdapter.sanitizeName("Tracking.Queue Depth"));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    MetricData match = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElse(null);
    assertTrue(match != null, "Expected metric " + name + " to be exported");
    return match;
  }
}
