package ca.gc.cra.rollup.application.port;

import java.util.Objects;

/**
 * Compressed JSON array ready for delivery.
 *
 * @param key routing key: the source file name for file output, the inbound record key for Kafka
 * @param content UTF-8 JSON bytes
 * @since 0.1.0
 */
public record CompressedPayload(String key, byte[] content) {
  public CompressedPayload {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(content, "content");
  }
}
