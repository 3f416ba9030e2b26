package ca.gc.cra.rollup.application.compress;

import ca.gc.cra.rollup.application.port.MetricsPort;
import ca.gc.cra.rollup.config.CompressorConfig;
import ca.gc.cra.rollup.domain.aggregate.CompressionRatio;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point to compression: resolves the configuration once, then offers single-payload,
 * batch, and ratio operations over a shared {@link WindowedGroupingEngine}.
 *
 * <p>Each compression records {@code compress.payloads}, {@code compress.bytes.in},
 * {@code compress.bytes.out}, and {@code compress.latencyNanos}; failures record
 * {@code compress.failures}.</p>
 *
 * <p>Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class TimeSeriesCompressor implements PayloadCompressor {
  private final WindowedGroupingEngine engine;
  private final BatchCompressor batch;
  private final MetricsPort metrics;

  /**
   * Creates a compressor without metrics.
   *
   * @param config configuration; unset settings take their defaults
   */
  public TimeSeriesCompressor(CompressorConfig config) {
    this(config, MetricsPort.NO_OP);
  }

  /**
   * Creates a compressor reporting to {@code metrics}.
   *
   * @param config configuration; unset settings take their defaults
   * @param metrics metrics sink
   */
  public TimeSeriesCompressor(CompressorConfig config, MetricsPort metrics) {
    this.engine = new WindowedGroupingEngine(config);
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.batch = new BatchCompressor(this, engine.config().workers());
  }

  @Override
  public byte[] compress(byte[] payload) {
    long started = System.nanoTime();
    metrics.increment("compress.payloads");
    try {
      byte[] compressed = engine.compress(payload);
      metrics.observe("compress.bytes.in", payload.length);
      metrics.observe("compress.bytes.out", compressed.length);
      return compressed;
    } catch (RuntimeException ex) {
      metrics.increment("compress.failures");
      throw ex;
    } finally {
      metrics.observe("compress.latencyNanos", System.nanoTime() - started);
    }
  }

  /**
   * Compresses payloads concurrently; see {@link BatchCompressor#compressBatch(List)}.
   *
   * @param payloads raw payloads
   * @return index-aligned results, empty where compression failed
   * @throws InterruptedException if interrupted while waiting
   */
  public List<Optional<byte[]>> compressBatch(List<byte[]> payloads) throws InterruptedException {
    return batch.compressBatch(payloads);
  }

  /**
   * Size reduction of {@code compressed} relative to {@code raw}.
   *
   * @param raw original payload
   * @param compressed compressed payload
   * @return {@code 1 - compressed/raw}, {@code 0} for an empty original
   */
  public double compressionRatio(byte[] raw, byte[] compressed) {
    return CompressionRatio.of(raw.length, compressed.length);
  }

  /**
   * Returns the resolved configuration.
   *
   * @return resolved configuration
   */
  public CompressorConfig config() {
    return engine.config();
  }
}
