/**
 * <strong>Purpose:</strong> Input validation helpers for configuration and adapter construction.
 * <p><strong>Concurrency:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracker.validation;
