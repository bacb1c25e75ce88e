/**
 * Configuration records, loaders and the composition root that starts tracking.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Validates topics and hosts via {@code ca.gc.cra.tracker.validation} utilities.</p>
 */
package ca.gc.cra.tracker.config;
