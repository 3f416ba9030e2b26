package ca.gc.cra.rollup.adapter.kafka;

import ca.gc.cra.rollup.application.port.InboundPayload;
import ca.gc.cra.rollup.application.port.PayloadSource;
import ca.gc.cra.rollup.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Kafka consumer that feeds raw JSON arrays to the relay.
 * <p><strong>Why:</strong> Relay instances share a consumer group, so each inbound message is
 * compressed by exactly one instance.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe except for {@link #wakeup()}; one consumer per reader.</p>
 * <p><strong>Observability:</strong> Logs tombstones it skips at DEBUG; Kafka client metrics cover lag.</p>
 *
 * @since 0.1.0
 */
public final class KafkaPayloadReader implements PayloadSource {
  private static final Logger log = LoggerFactory.getLogger(KafkaPayloadReader.class);

  private final Consumer<String, byte[]> consumer;

  /**
   * Creates a reader subscribed to {@code topic} as a member of {@code groupId}.
   *
   * @param bootstrapServers comma-separated Kafka bootstrap servers
   * @param topic inbound topic
   * @param groupId consumer group shared by relay instances
   * @throws IllegalArgumentException if any parameter is blank
   */
  public KafkaPayloadReader(String bootstrapServers, String topic, String groupId) {
    this(createConsumer(bootstrapServers, groupId), topic);
  }

  KafkaPayloadReader(Consumer<String, byte[]> consumer, String topic) {
    this.consumer = Objects.requireNonNull(consumer, "consumer");
    this.consumer.subscribe(List.of(Strings.sanitizeTopic("inputTopic", topic)));
  }

  /**
   * Polls for the next batch of records.
   *
   * @param timeout maximum time to wait
   * @return payloads in partition order; empty on timeout or after {@link #wakeup()}
   */
  @Override
  public List<InboundPayload> poll(Duration timeout) {
    ConsumerRecords<String, byte[]> records;
    try {
      records = consumer.poll(timeout);
    } catch (WakeupException ex) {
      log.debug("Kafka poll woken up");
      return List.of();
    }
    List<InboundPayload> payloads = new ArrayList<>(records.count());
    for (ConsumerRecord<String, byte[]> record : records) {
      String origin = record.topic() + "-" + record.partition() + "@" + record.offset();
      if (record.value() == null) {
        log.debug("Skipping tombstone at {}", origin);
        continue;
      }
      payloads.add(new InboundPayload(record.key(), record.value(), origin));
    }
    return payloads;
  }

  @Override
  public void wakeup() {
    consumer.wakeup();
  }

  /**
   * Closes the consumer, waiting up to five seconds for the group to rebalance.
   */
  @Override
  public void close() {
    consumer.close(Duration.ofSeconds(5));
  }

  private static Consumer<String, byte[]> createConsumer(String bootstrapServers, String groupId) {
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, Strings.requireNonBlank("bootstrapServers", bootstrapServers));
    props.put(ConsumerConfig.GROUP_ID_CONFIG, Strings.requireNonBlank("groupId", groupId));
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
    return new KafkaConsumer<>(props);
  }
}
