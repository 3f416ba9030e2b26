package ca.gc.cra.rollup.application.port;

/**
 * <strong>What:</strong> Destination for compressed payloads (files or a Kafka topic).
 * <p><strong>Thread-safety:</strong> Implementations document their own guarantees; use cases call
 * {@link #write(CompressedPayload)} from a single thread.</p>
 *
 * @since 0.1.0
 */
public interface CompressedOutputPort extends AutoCloseable {
  /**
   * Delivers one compressed payload.
   *
   * @param payload payload to deliver; never {@code null}
   * @throws Exception when the payload cannot be handed to the destination
   */
  void write(CompressedPayload payload) throws Exception;

  /**
   * Flushes buffered payloads. The default does nothing.
   *
   * @throws Exception when buffered payloads cannot be delivered
   */
  default void flush() throws Exception {}

  @Override
  default void close() throws Exception {}
}
