/**
 * <strong>Purpose:</strong> Ports between the tracking core and its collaborators: host session, transmission,
 * overlay subsystem, metrics and time.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracker.application.port;
