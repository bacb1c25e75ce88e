/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize identifiers before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 * <p><strong>Security:</strong> Provides redaction helpers so visitor attributes do not leak into logs.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tracker.logging;
