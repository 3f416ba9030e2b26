package ca.gc.cra.rollup.application.compress;

/**
 * Turns one raw JSON array into its compressed form.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PayloadCompressor {
  /**
   * Compresses a payload.
   *
   * @param payload UTF-8 JSON array
   * @return UTF-8 JSON array of aggregated records
   * @throws InputFormatException if the payload is not a JSON array
   * @throws SerializationException if the output cannot be written
   */
  byte[] compress(byte[] payload);
}
