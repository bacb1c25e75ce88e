package ca.gc.cra.tracker.config;

import ca.gc.cra.tracker.infrastructure.transmission.AsyncTrackingClient;
import ca.gc.cra.tracker.validation.Numbers;
import ca.gc.cra.tracker.validation.Strings;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable tracker runtime configuration.
 * <p><strong>Role:</strong> Consumed by {@link CompositionRoot} to build the transport, metrics and dispatch client.</p>
 * <p><strong>Thread-safety:</strong> Record is immutable; safe for concurrent reads.</p>
 *
 * @param transport transport used for delivery
 * @param kafkaBootstrap Kafka bootstrap servers; required when {@code transport} is {@link TransportKind#KAFKA}
 * @param kafkaTopic Kafka topic receiving events
 * @param kafkaSendTimeout maximum wait for a Kafka acknowledgement
 * @param queueCapacity dispatch queue capacity
 * @param maxAttempts delivery attempts per task
 * @param initialBackoff pause after the first failed attempt
 * @param maxBackoff upper bound on the pause between attempts
 * @param shutdownTimeout time allowed to drain the queue on close
 * @param metricsEnabled whether to export OpenTelemetry metrics
 * @param verbose whether to raise tracker logging to DEBUG
 * @param logBodies whether the logging transport includes event bodies
 * @since 0.1.0
 */
public record TrackerConfig(
    TransportKind transport,
    String kafkaBootstrap,
    String kafkaTopic,
    Duration kafkaSendTimeout,
    int queueCapacity,
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    Duration shutdownTimeout,
    boolean metricsEnabled,
    boolean verbose,
    boolean logBodies) {

  static final String DEFAULT_TOPIC = "tracker.events";

  public TrackerConfig {
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(kafkaSendTimeout, "kafkaSendTimeout");
    Objects.requireNonNull(initialBackoff, "initialBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    kafkaTopic = Strings.sanitizeTopic("kafka.topic", kafkaTopic == null ? DEFAULT_TOPIC : kafkaTopic);
    if (transport == TransportKind.KAFKA) {
      kafkaBootstrap = Strings.requireNonBlank("kafka.bootstrap", kafkaBootstrap);
    }
  }

  /**
   * Provides default configuration values used when no external config is supplied.
   *
   * @return logging transport, default dispatch settings, metrics disabled
   */
  public static TrackerConfig defaults() {
    AsyncTrackingClient.Settings dispatch = AsyncTrackingClient.Settings.defaults();
    return new TrackerConfig(
        TransportKind.LOGGING,
        null,
        DEFAULT_TOPIC,
        Duration.ofSeconds(10),
        dispatch.queueCapacity(),
        dispatch.maxAttempts(),
        dispatch.initialBackoff(),
        dispatch.maxBackoff(),
        dispatch.shutdownTimeout(),
        false,
        false,
        false);
  }

  /**
   * Builds a configuration from flat dotted keys, filling gaps from {@link #defaults()}.
   *
   * <p>Recognized keys: {@code transport}, {@code kafka.bootstrap}, {@code kafka.topic},
   * {@code kafka.sendTimeoutMillis}, {@code dispatch.queueCapacity}, {@code dispatch.maxAttempts},
   * {@code dispatch.initialBackoffMillis}, {@code dispatch.maxBackoffMillis},
   * {@code dispatch.shutdownTimeoutMillis}, {@code metrics.enabled}, {@code verbose}, {@code logBodies}.</p>
   *
   * @param values flat key/value map; never {@code null}
   * @return configuration
   * @throws IllegalArgumentException when a value fails to parse or validate
   */
  public static TrackerConfig fromMap(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    TrackerConfig d = defaults();
    return new TrackerConfig(
        TransportKind.from(values.get("transport")),
        values.get("kafka.bootstrap"),
        values.getOrDefault("kafka.topic", d.kafkaTopic()),
        millis(values, "kafka.sendTimeoutMillis", d.kafkaSendTimeout()),
        (int) number(values, "dispatch.queueCapacity", d.queueCapacity(), 1, 1_000_000),
        (int) number(values, "dispatch.maxAttempts", d.maxAttempts(), 1, 100),
        millis(values, "dispatch.initialBackoffMillis", d.initialBackoff()),
        millis(values, "dispatch.maxBackoffMillis", d.maxBackoff()),
        millis(values, "dispatch.shutdownTimeoutMillis", d.shutdownTimeout()),
        bool(values, "metrics.enabled", d.metricsEnabled()),
        bool(values, "verbose", d.verbose()),
        bool(values, "logBodies", d.logBodies()));
  }

  /**
   * Returns the dispatch settings slice of this configuration.
   *
   * @return settings for {@link AsyncTrackingClient}
   */
  public AsyncTrackingClient.Settings dispatchSettings() {
    return new AsyncTrackingClient.Settings(queueCapacity, maxAttempts, initialBackoff, maxBackoff, shutdownTimeout);
  }

  private static long number(Map<String, String> values, String key, long fallback, long min, long max) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Numbers.requireRange(key, Long.parseLong(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
  }

  private static Duration millis(Map<String, String> values, String key, Duration fallback) {
    return Duration.ofMillis(number(values, key, fallback.toMillis(), 0, Duration.ofHours(1).toMillis()));
  }

  private static boolean bool(Map<String, String> values, String key, boolean fallback) {
    String raw = values.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean (was '" + raw + "')");
    };
  }
}
