package ca.gc.cra.tracker.config;

import ca.gc.cra.tracker.adapter.kafka.KafkaTrackingTransport;
import ca.gc.cra.tracker.application.port.HostApplication;
import ca.gc.cra.tracker.application.port.MetricsPort;
import ca.gc.cra.tracker.application.port.OverlayPort;
import ca.gc.cra.tracker.application.port.TrackingTransport;
import ca.gc.cra.tracker.application.tracking.DefaultHostApplication;
import ca.gc.cra.tracker.application.tracking.TrackerApp;
import ca.gc.cra.tracker.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.tracker.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tracker.infrastructure.overlay.NoOpOverlayAdapter;
import ca.gc.cra.tracker.infrastructure.transmission.AsyncTrackingClient;
import ca.gc.cra.tracker.infrastructure.transmission.InMemoryTrackingTransport;
import ca.gc.cra.tracker.infrastructure.transmission.LoggingTrackingTransport;
import ca.gc.cra.tracker.logging.LoggingConfigurator;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link TrackerConfig} into a running tracker host.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the transport and metrics adapter.</li>
 *   <li>Build the {@link AsyncTrackingClient} and the {@link DefaultHostApplication} owning it.</li>
 *   <li>Install the host in {@link TrackerApp}, which hands it the process-wide delegate.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private CompositionRoot() {}

  /**
   * Starts tracking with a generated visitor id and no overlay subsystem.
   *
   * @param config configuration; never {@code null}
   * @return running tracker; close it to stop delivery
   */
  public static TrackerRuntime start(TrackerConfig config) {
    return start(config, UUID.randomUUID().toString(), new NoOpOverlayAdapter());
  }

  /**
   * Starts tracking.
   *
   * @param config configuration; never {@code null}
   * @param visitorId initial visitor id
   * @param overlay overlay subsystem notified of view transitions
   * @return running tracker; close it to stop delivery
   */
  public static TrackerRuntime start(TrackerConfig config, String visitorId, OverlayPort overlay) {
    Objects.requireNonNull(config, "config");
    if (config.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    TrackingTransport transport = transportFor(config);
    MetricsPort metrics = metricsFor(config);
    AsyncTrackingClient client = new AsyncTrackingClient(transport, metrics, config.dispatchSettings());
    DefaultHostApplication host = new DefaultHostApplication(visitorId, overlay, TrackerApp.delegateSlot());
    host.setTrackingClient(client);
    HostApplication previous = TrackerApp.install(host);
    if (previous != null) {
      previous.trackingClient().ifPresent(old -> {
        log.info("Closing tracking client of replaced host");
        old.close();
      });
    }
    log.info("Tracking started with {} transport (attempts={}, queue={})",
        config.transport(), config.maxAttempts(), config.queueCapacity());
    return new TrackerRuntime(host, client, transport, metrics);
  }

  static TrackingTransport transportFor(TrackerConfig config) {
    return switch (config.transport()) {
      case LOGGING -> new LoggingTrackingTransport(config.logBodies());
      case MEMORY -> new InMemoryTrackingTransport();
      case KAFKA -> new KafkaTrackingTransport(config.kafkaBootstrap(), config.kafkaTopic(), config.kafkaSendTimeout());
    };
  }

  static MetricsPort metricsFor(TrackerConfig config) {
    return config.metricsEnabled() ? new OpenTelemetryMetricsAdapter() : new NoOpMetricsAdapter();
  }
}
