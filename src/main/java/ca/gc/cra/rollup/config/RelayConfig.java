package ca.gc.cra.rollup.config;

import ca.gc.cra.rollup.validation.Net;
import ca.gc.cra.rollup.validation.Numbers;
import ca.gc.cra.rollup.validation.Strings;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Kafka wiring for the relay: where raw batches arrive and where compressed
 * batches are published.
 * <p><strong>Why:</strong> Every relay instance in a consumer group shares the inbound partitions,
 * so scaling out is a matter of starting more processes with the same {@code groupId}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param bootstrapServers validated {@code host:port[,host:port]} list
 * @param inputTopic topic carrying raw JSON arrays
 * @param outputTopic topic receiving compressed JSON arrays
 * @param groupId consumer group shared by relay instances
 * @param pollTimeout maximum time a single poll blocks
 * @since 0.1.0
 */
public record RelayConfig(
    String bootstrapServers,
    String inputTopic,
    String outputTopic,
    String groupId,
    Duration pollTimeout) {

  /** Default inbound topic. */
  public static final String DEFAULT_INPUT_TOPIC = "timeseries.raw";
  /** Default outbound topic. */
  public static final String DEFAULT_OUTPUT_TOPIC = "timeseries.compressed";
  /** Default consumer group. */
  public static final String DEFAULT_GROUP_ID = "compressor";
  /** Default poll timeout in milliseconds. */
  public static final int DEFAULT_POLL_MILLIS = 500;

  public RelayConfig {
    Objects.requireNonNull(bootstrapServers, "bootstrapServers");
    Objects.requireNonNull(inputTopic, "inputTopic");
    Objects.requireNonNull(outputTopic, "outputTopic");
    Objects.requireNonNull(groupId, "groupId");
    Objects.requireNonNull(pollTimeout, "pollTimeout");
    if (inputTopic.equals(outputTopic)) {
      throw new IllegalArgumentException("inputTopic and outputTopic must differ (both " + inputTopic + ")");
    }
  }

  /**
   * Parses relay keys from a merged configuration map.
   *
   * @param args flat configuration map; must not be {@code null}
   * @return validated relay configuration
   * @throws IllegalArgumentException if {@code kafkaBootstrap} is missing or any value is malformed
   */
  public static RelayConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String bootstrap = args.get("kafkaBootstrap");
    if (bootstrap == null || bootstrap.isBlank()) {
      throw new IllegalArgumentException("kafkaBootstrap is required for relay");
    }
    String pollMillis = args.get("pollMillis");
    int poll = pollMillis == null || pollMillis.isBlank()
        ? DEFAULT_POLL_MILLIS
        : Numbers.parseInt("pollMillis", pollMillis, 1, 60_000);
    return new RelayConfig(
        Net.validateBootstrapServers(bootstrap),
        Strings.sanitizeTopic("inputTopic", valueOr(args, "inputTopic", DEFAULT_INPUT_TOPIC)),
        Strings.sanitizeTopic("outputTopic", valueOr(args, "outputTopic", DEFAULT_OUTPUT_TOPIC)),
        Strings.sanitizeTopic("groupId", valueOr(args, "groupId", DEFAULT_GROUP_ID)),
        Duration.ofMillis(poll));
  }

  private static String valueOr(Map<String, String> args, String key, String fallback) {
    String value = args.get(key);
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
