/**
 * Executor factories for tracking dispatch workers.
 * <p><strong>Concurrency:</strong> Provides factory methods that return managed executors.</p>
 * <p><strong>Performance:</strong> Bounded queues keep the caller side non-blocking; overflow is rejected.</p>
 */
package ca.gc.cra.tracker.infrastructure.exec;
