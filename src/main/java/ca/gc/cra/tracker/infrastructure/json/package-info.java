/**
 * JSON encoding of tracking tasks using the Jackson streaming generator.
 */
package ca.gc.cra.tracker.infrastructure.json;
