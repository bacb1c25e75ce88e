package ca.gc.cra.tracker.config;

import ca.gc.cra.tracker.application.port.MetricsPort;
import ca.gc.cra.tracker.application.port.TrackingTransport;
import ca.gc.cra.tracker.application.tracking.DefaultHostApplication;
import ca.gc.cra.tracker.application.tracking.TrackerApp;
import ca.gc.cra.tracker.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tracker.infrastructure.transmission.AsyncTrackingClient;

/**
 * Handle on a tracker host started by {@link CompositionRoot}. Closing it uninstalls the host (when still
 * installed), drains and closes the client, and shuts down metrics export.
 *
 * @since 0.1.0
 */
public final class TrackerRuntime implements AutoCloseable {
  private final DefaultHostApplication host;
  private final AsyncTrackingClient client;
  private final TrackingTransport transport;
  private final MetricsPort metrics;

  TrackerRuntime(
      DefaultHostApplication host, AsyncTrackingClient client, TrackingTransport transport, MetricsPort metrics) {
    this.host = host;
    this.client = client;
    this.transport = transport;
    this.metrics = metrics;
  }

  public DefaultHostApplication host() {
    return host;
  }

  public AsyncTrackingClient client() {
    return client;
  }

  public TrackingTransport transport() {
    return transport;
  }

  @Override
  public void close() {
    if (TrackerApp.host() == host) {
      TrackerApp.reset();
    }
    host.setTrackingClient(null);
    client.close();
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }
}
