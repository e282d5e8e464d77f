package ca.gc.cra.nmapper.adapter.kafka;

import ca.gc.cra.nmapper.application.port.ClockPort;
import ca.gc.cra.nmapper.application.port.MetricsPort;
import ca.gc.cra.nmapper.application.port.NotificationPort;
import ca.gc.cra.nmapper.domain.snapshot.DiffSummary;
import ca.gc.cra.nmapper.domain.snapshot.NetworkSnapshot;
import ca.gc.cra.nmapper.domain.snapshot.SnapshotDiff;
import ca.gc.cra.nmapper.infrastructure.json.JsonCodec;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes monitor notifications to a Kafka topic as JSON.
 * <p>Significant changes are keyed by the new snapshot id; scan failures by the scheduler job id. Every payload
 * carries a {@code type} field ({@code significantChange} or {@code scanFailed}).</p>
 * <p>Sends are asynchronous. Broker errors reported through the send callback are logged and counted under
 * {@code notify.kafka.failed}; they never reach the orchestrator.</p>
 *
 * @implNote Thread-safe when the supplied producer is (the default {@link KafkaProducer} is). Call
 *     {@link #close()} to flush buffered records.
 * @since 0.1.0
 */
public final class KafkaNotificationAdapter implements NotificationPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaNotificationAdapter.class);

  private final Producer<String, String> producer;
  private final String topic;
  private final JsonCodec json;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * Creates an adapter backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic destination topic
   * @param json payload codec
   * @param clock time source for failure timestamps
   * @param metrics metrics sink
   * @throws IllegalArgumentException if {@code bootstrapServers} or {@code topic} is blank
   */
  public KafkaNotificationAdapter(
      String bootstrapServers, String topic, JsonCodec json, ClockPort clock, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, json, clock, metrics);
  }

  KafkaNotificationAdapter(
      Producer<String, String> producer, String topic, JsonCodec json, ClockPort clock, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = sanitizeTopic(topic);
    this.json = Objects.requireNonNull(json, "json");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void significantChange(NetworkSnapshot snapshot, SnapshotDiff diff, int threshold) {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(diff, "diff");
    DiffSummary summary = diff.summary();
    Map<String, Object> counts = new LinkedHashMap<>();
    counts.put("devicesAdded", summary.devicesAdded());
    counts.put("devicesRemoved", summary.devicesRemoved());
    counts.put("devicesChanged", summary.devicesChanged());
    counts.put("portsChanged", summary.portsChanged());
    counts.put("servicesChanged", summary.servicesChanged());
    counts.put("totalChanges", summary.totalChanges());

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "significantChange");
    payload.put("snapshotId", snapshot.id());
    payload.put("previousSnapshotId", diff.fromSnapshot());
    payload.put("timestamp", diff.timestamp());
    payload.put("scanTarget", snapshot.metadata().scanTarget());
    payload.put("deviceCount", snapshot.deviceCount());
    payload.put("threshold", threshold);
    payload.put("summary", counts);
    send(snapshot.id(), payload);
  }

  @Override
  public void scanFailed(String jobId, String target, int attempts, String message) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "scanFailed");
    payload.put("jobId", jobId);
    payload.put("target", target);
    payload.put("attempts", attempts);
    payload.put("message", message);
    payload.put("timestamp", clock.now());
    send(jobId, payload);
  }

  /**
   * Flushes pending records and closes the producer, waiting up to five seconds.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private void send(String key, Map<String, Object> payload) {
    String value = json.write(payload);
    producer.send(new ProducerRecord<>(topic, key, value), (meta, error) -> {
      if (error != null) {
        metrics.increment("notify.kafka.failed");
        log.warn("Kafka notification {} for key {} failed: {}", payload.get("type"), key, error.getMessage());
      }
    });
    metrics.increment("notify.kafka.sent");
  }

  private static Producer<String, String> createProducer(String bootstrapServers) {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    String trimmed = bootstrapServers.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, trimmed);
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.CLIENT_ID_CONFIG, "nmapper-notifications");
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    return new KafkaProducer<>(props);
  }

  private static String sanitizeTopic(String topic) {
    if (topic == null || topic.isBlank()) {
      throw new IllegalArgumentException("topic must not be blank");
    }
    return topic.trim();
  }
}
