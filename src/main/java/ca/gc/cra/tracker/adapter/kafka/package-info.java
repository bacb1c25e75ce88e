/**
 * Kafka adapters for publishing tracking events.
 * <p><strong>Concurrency:</strong> Producers are thread-safe; sends run on the tracking dispatch worker.</p>
 * <p><strong>Security:</strong> Payloads may contain visitor attributes; topics should be access-controlled.</p>
 */
package ca.gc.cra.tracker.adapter.kafka;
