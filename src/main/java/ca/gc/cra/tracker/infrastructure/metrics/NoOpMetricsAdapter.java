package ca.gc.cra.tracker.infrastructure.metrics;

import ca.gc.cra.tracker.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations. Selected when {@code metrics.enabled=false}.
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
