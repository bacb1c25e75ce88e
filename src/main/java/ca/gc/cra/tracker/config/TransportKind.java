package ca.gc.cra.tracker.config;

import java.util.Locale;

/**
 * Transport selected for delivering tracking events.
 *
 * @since 0.1.0
 */
public enum TransportKind {
  /** Log each event; no network. */
  LOGGING,
  /** Keep events in memory; diagnostics and tests. */
  MEMORY,
  /** Publish to a Kafka topic. */
  KAFKA;

  /**
   * Parses a transport name case-insensitively.
   *
   * @param raw configured value; blank selects {@link #LOGGING}
   * @return transport kind
   * @throws IllegalArgumentException when the value names no transport
   */
  public static TransportKind from(String raw) {
    if (raw == null || raw.isBlank()) {
      return LOGGING;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "logging", "log" -> LOGGING;
      case "memory", "in-memory" -> MEMORY;
      case "kafka" -> KAFKA;
      default -> throw new IllegalArgumentException("Unknown transport '" + raw + "' (expected logging, memory or kafka)");
    };
  }
}
