/**
 * <strong>Purpose:</strong> Tracking orchestration: event construction, visitor/scene binding, task handoff and
 * view-transition signaling.
 * <p><strong>Concurrency:</strong> All entry points are synchronous and non-blocking; delivery happens on the
 * transmission client's threads.</p>
 * <p><strong>Shared state:</strong> {@link ca.gc.cra.tracker.application.tracking.TrackerApp} owns the only
 * process-wide references (host and delegate slot).</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracker.application.tracking;
