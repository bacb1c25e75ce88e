/**
 * Reference transmission collaborator: asynchronous client with retry and the transports it can drive.
 * <p><strong>Concurrency:</strong> One dispatch worker per client; transports are called from that worker only.</p>
 */
package ca.gc.cra.tracker.infrastructure.transmission;
