package ca.gc.cra.rollup.application.pipeline;

import ca.gc.cra.rollup.application.compress.TimeSeriesCompressor;
import ca.gc.cra.rollup.application.port.CompressedOutputPort;
import ca.gc.cra.rollup.application.port.CompressedPayload;
import ca.gc.cra.rollup.domain.aggregate.CompressionRatio;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Compresses every {@code *.json} file of a directory through the batch runner.
 * <p><strong>Why:</strong> One bad file is reported and skipped; the others are still written.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one per CLI invocation.</p>
 * <p><strong>Observability:</strong> Logs each failed file at WARN and a summary at INFO.</p>
 *
 * @since 0.1.0
 */
public final class BatchUseCase {
  private static final Logger log = LoggerFactory.getLogger(BatchUseCase.class);
  private static final String GLOB = "*.json";

  private final TimeSeriesCompressor compressor;
  private final CompressedOutputPort output;

  public BatchUseCase(TimeSeriesCompressor compressor, CompressedOutputPort output) {
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    this.output = Objects.requireNonNull(output, "output");
  }

  /**
   * Compresses the JSON files of {@code inputDirectory}, in file-name order.
   *
   * @param inputDirectory directory holding JSON array files
   * @return counts of processed, written, and failed files
   * @throws IOException if the directory or a file cannot be read
   * @throws InterruptedException if interrupted while the batch runs
   * @throws Exception if the output port fails
   */
  public Summary run(Path inputDirectory) throws Exception {
    Objects.requireNonNull(inputDirectory, "inputDirectory");
    List<Path> files = listInputs(inputDirectory);
    if (files.isEmpty()) {
      log.warn("No {} files found in {}", GLOB, inputDirectory);
      return new Summary(0, 0, 0, 0, 0);
    }
    List<byte[]> payloads = new ArrayList<>(files.size());
    for (Path file : files) {
      payloads.add(Files.readAllBytes(file));
    }

    List<Optional<byte[]>> results = compressor.compressBatch(payloads);

    int succeeded = 0;
    long rawBytes = 0;
    long compressedBytes = 0;
    for (int i = 0; i < files.size(); i++) {
      Path file = files.get(i);
      Optional<byte[]> result = results.get(i);
      if (result.isEmpty()) {
        log.warn("Failed to compress {}", file.getFileName());
        continue;
      }
      byte[] compressed = result.get();
      output.write(new CompressedPayload(file.getFileName().toString(), compressed));
      succeeded++;
      rawBytes += payloads.get(i).length;
      compressedBytes += compressed.length;
      log.debug("Compressed {} ({} -> {} bytes)", file.getFileName(), payloads.get(i).length, compressed.length);
    }
    output.flush();

    Summary summary = new Summary(files.size(), succeeded, files.size() - succeeded, rawBytes, compressedBytes);
    log.info("Batch complete: {} of {} files compressed, {} bytes to {} bytes ({} reduction)",
        summary.succeeded(), summary.total(), rawBytes, compressedBytes,
        CompressionRatio.percent(CompressionRatio.of(rawBytes, compressedBytes)));
    return summary;
  }

  private static List<Path> listInputs(Path directory) throws IOException {
    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, GLOB)) {
      for (Path path : stream) {
        if (Files.isRegularFile(path)) {
          files.add(path);
        }
      }
    }
    files.sort(null);
    return files;
  }

  /**
   * Outcome of a directory batch.
   *
   * @param total files found
   * @param succeeded files compressed and written
   * @param failed files that could not be compressed
   * @param rawBytes input size of the successful files
   * @param compressedBytes output size of the successful files
   */
  public record Summary(int total, int succeeded, int failed, long rawBytes, long compressedBytes) {}
}
