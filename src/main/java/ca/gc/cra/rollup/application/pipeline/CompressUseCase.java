package ca.gc.cra.rollup.application.pipeline;

import ca.gc.cra.rollup.application.compress.TimeSeriesCompressor;
import ca.gc.cra.rollup.application.port.CompressedOutputPort;
import ca.gc.cra.rollup.application.port.CompressedPayload;
import ca.gc.cra.rollup.domain.aggregate.CompressionRatio;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compresses a single JSON file and hands the result to an output port.
 *
 * @since 0.1.0
 */
public final class CompressUseCase {
  private static final Logger log = LoggerFactory.getLogger(CompressUseCase.class);

  private final TimeSeriesCompressor compressor;
  private final CompressedOutputPort output;

  public CompressUseCase(TimeSeriesCompressor compressor, CompressedOutputPort output) {
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    this.output = Objects.requireNonNull(output, "output");
  }

  /**
   * Reads {@code input}, compresses it, and writes the result under {@code outputKey}.
   *
   * @param input JSON array file
   * @param outputKey key handed to the output port
   * @return sizes and ratio of the compression
   * @throws java.io.IOException if the input cannot be read
   * @throws ca.gc.cra.rollup.application.compress.InputFormatException if the input is not a JSON array
   * @throws Exception if the output port fails
   */
  public Summary run(Path input, String outputKey) throws Exception {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(outputKey, "outputKey");
    byte[] raw = Files.readAllBytes(input);
    byte[] compressed = compressor.compress(raw);
    output.write(new CompressedPayload(outputKey, compressed));
    output.flush();
    Summary summary = new Summary(raw.length, compressed.length, compressor.compressionRatio(raw, compressed));
    log.info("Compressed {} bytes to {} bytes ({} reduction)",
        summary.rawBytes(), summary.compressedBytes(), CompressionRatio.percent(summary.ratio()));
    return summary;
  }

  /**
   * Outcome of one compression.
   *
   * @param rawBytes input size
   * @param compressedBytes output size
   * @param ratio {@code 1 - compressed/raw}
   */
  public record Summary(long rawBytes, long compressedBytes, double ratio) {}
}
