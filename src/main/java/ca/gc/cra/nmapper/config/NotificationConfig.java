package ca.gc.cra.nmapper.config;

import ca.gc.cra.nmapper.validation.Net;
import ca.gc.cra.nmapper.validation.Strings;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Where significant-change and scan-failure notifications go.
 *
 * @param sink notification sink
 * @param kafkaBootstrap validated {@code host:port} list; empty unless {@code sink} is {@link Sink#KAFKA}
 * @param kafkaTopic destination topic
 * @since 0.1.0
 */
public record NotificationConfig(Sink sink, String kafkaBootstrap, String kafkaTopic) {
  /** Default topic for notifications. */
  public static final String DEFAULT_TOPIC = "nmapper.notifications";

  public NotificationConfig {
    sink = Objects.requireNonNullElse(sink, Sink.LOG);
    kafkaTopic = Strings.sanitizeTopic("notify.kafkaTopic",
        kafkaTopic == null || kafkaTopic.isBlank() ? DEFAULT_TOPIC : kafkaTopic);
    if (sink == Sink.KAFKA) {
      kafkaBootstrap = Net.validateBootstrapServers(kafkaBootstrap);
    } else {
      kafkaBootstrap = kafkaBootstrap == null ? "" : kafkaBootstrap.trim();
    }
  }

  /**
   * Log sink.
   *
   * @return default notification settings
   */
  public static NotificationConfig defaults() {
    return new NotificationConfig(Sink.LOG, "", DEFAULT_TOPIC);
  }

  /**
   * Reads {@code notify.sink}, {@code notify.kafkaBootstrap} and {@code notify.kafkaTopic}.
   *
   * @param options flat configuration
   * @return parsed settings
   * @throws IllegalArgumentException if the sink is unknown or Kafka settings are invalid
   */
  public static NotificationConfig fromMap(Map<String, String> options) {
    return new NotificationConfig(
        Sink.from(options.get("notify.sink")),
        options.get("notify.kafkaBootstrap"),
        options.get("notify.kafkaTopic"));
  }

  /** Notification sinks. */
  public enum Sink {
    /** Discard notifications. */
    NONE,
    /** Log a WARN line per notification. */
    LOG,
    /** Publish JSON to Kafka. */
    KAFKA;

    static Sink from(String raw) {
      if (raw == null || raw.isBlank()) {
        return LOG;
      }
      try {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException("notify.sink must be none, log or kafka (was " + raw + ")", ex);
      }
    }
  }
}
