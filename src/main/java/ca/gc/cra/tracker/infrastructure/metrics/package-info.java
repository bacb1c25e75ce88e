/**
 * Metrics adapters that bridge the tracker's {@link ca.gc.cra.tracker.application.port.MetricsPort} to
 * OpenTelemetry or a no-op implementation.
 * <p><strong>Metrics:</strong> Publishes under the {@code tracking.*} namespace.</p>
 * <p><strong>Security:</strong> Never exports payload contents or visitor ids.</p>
 */
package ca.gc.cra.tracker.infrastructure.metrics;
