package ca.gc.cra.rollup.adapter.kafka;

import ca.gc.cra.rollup.application.port.CompressedOutputPort;
import ca.gc.cra.rollup.application.port.CompressedPayload;
import ca.gc.cra.rollup.application.port.MetricsPort;
import ca.gc.cra.rollup.validation.Strings;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes compressed payloads to a Kafka topic, keyed by the inbound record key.
 * <p>Sends are asynchronous. Broker-side failures surface in the send callback, where they are
 * logged and counted as {@code relay.publish.failures}; successes count as {@code relay.published}.
 * Thread-safe when the supplied producer is (the default {@link KafkaProducer} is).</p>
 *
 * @implNote Invoke {@link #close()} to flush buffered records before shutdown.
 * @since 0.1.0
 */
public final class KafkaCompressedOutputAdapter implements CompressedOutputPort {
  private static final Logger log = LoggerFactory.getLogger(KafkaCompressedOutputAdapter.class);

  private final Producer<String, byte[]> producer;
  private final String topic;
  private final MetricsPort metrics;

  /**
   * Creates an adapter backed by a new {@link KafkaProducer}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic topic that receives compressed payloads
   * @param metrics metrics sink for publish outcomes
   * @throws IllegalArgumentException if {@code bootstrapServers} or {@code topic} is blank
   */
  public KafkaCompressedOutputAdapter(String bootstrapServers, String topic, MetricsPort metrics) {
    this(createProducer(bootstrapServers), topic, metrics);
  }

  KafkaCompressedOutputAdapter(Producer<String, byte[]> producer, String topic, MetricsPort metrics) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.topic = Strings.sanitizeTopic("outputTopic", topic);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Enqueues a payload for asynchronous publication.
   *
   * @param payload compressed payload; must not be {@code null}
   */
  @Override
  public void write(CompressedPayload payload) {
    Objects.requireNonNull(payload, "payload");
    String key = payload.key().isEmpty() ? null : payload.key();
    producer.send(new ProducerRecord<>(topic, key, payload.content()), (metadata, ex) -> {
      if (ex != null) {
        metrics.increment("relay.publish.failures");
        log.error("Failed to publish compressed payload {} to {}", payload.key(), topic, ex);
      } else {
        metrics.increment("relay.published");
        log.debug("Published {} bytes to {}-{}@{}",
            payload.content().length, metadata.topic(), metadata.partition(), metadata.offset());
      }
    });
  }

  @Override
  public void flush() {
    producer.flush();
  }

  /**
   * Flushes pending records and closes the producer, waiting up to five seconds.
   */
  @Override
  public void close() {
    producer.flush();
    producer.close(Duration.ofSeconds(5));
  }

  private static Producer<String, byte[]> createProducer(String bootstrapServers) {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, Strings.requireNonBlank("bootstrapServers", bootstrapServers));
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
    return new KafkaProducer<>(props);
  }
}
