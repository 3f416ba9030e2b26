package ca.gc.cra.rollup.application.compress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rollup.config.CompressorConfig;
import ca.gc.cra.rollup.testutil.RecordingMetricsPort;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TimeSeriesCompressorTest {

  private static byte[] bytes(String json) {
    return json.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void compressRecordsSizesAndLatency() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    TimeSeriesCompressor compressor = new TimeSeriesCompressor(CompressorConfig.defaults(), metrics);
    byte[] raw = bytes("[{\"timestamp\":1000,\"value\":10},{\"timestamp\":1010,\"value\":20}]");

    byte[] compressed = compressor.compress(raw);

    assertEquals(1, metrics.count("compress.payloads"));
    assertEquals(List.of((long) raw.length), metrics.observed("compress.bytes.in"));
    assertEquals(List.of((long) compressed.length), metrics.observed("compress.bytes.out"));
    assertEquals(1, metrics.observed("compress.latencyNanos").size());
    assertEquals(0, metrics.count("compress.failures"));
  }

  @Test
  void failedCompressionIsCountedAndRethrown() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    TimeSeriesCompressor compressor = new TimeSeriesCompressor(CompressorConfig.defaults(), metrics);

    assertThrows(InputFormatException.class, () -> compressor.compress(bytes("{}")));
    assertEquals(1, metrics.count("compress.failures"));
  }

  @Test
  void batchUsesConfiguredWorkers() throws Exception {
    CompressorConfig config = new CompressorConfig(null, null, null, null, null, null, 2);
    TimeSeriesCompressor compressor = new TimeSeriesCompressor(config);

    List<Optional<byte[]>> results = compressor.compressBatch(List.of(
        bytes("[{\"timestamp\":1000,\"value\":1}]"), bytes("nope")));

    assertEquals(2, compressor.config().workers());
    assertTrue(results.get(0).isPresent());
    assertTrue(results.get(1).isEmpty());
  }

  @Test
  void ratioComparesByteLengths() {
    TimeSeriesCompressor compressor = new TimeSeriesCompressor(CompressorConfig.defaults());

    assertEquals(0.5, compressor.compressionRatio(new byte[10], new byte[5]), 1e-9);
    assertEquals(0.0, compressor.compressionRatio(new byte[0], new byte[2]));
  }
}
