package ca.gc.cra.rollup.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.rollup.application.compress.TimeSeriesCompressor;
import ca.gc.cra.rollup.config.CompressorConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BatchUseCaseTest {
  @TempDir Path tempDir;

  @Test
  void writesEachCompressibleFileUnderItsName() throws Exception {
    Files.writeString(tempDir.resolve("b.json"), "[{\"timestamp\":2000,\"value\":2}]");
    Files.writeString(tempDir.resolve("a.json"), "[{\"timestamp\":1000,\"value\":1}]");
    Files.writeString(tempDir.resolve("broken.json"), "{\"not\":\"an array\"}");
    Files.writeString(tempDir.resolve("notes.txt"), "ignored");
    RecordingOutputPort output = new RecordingOutputPort();
    BatchUseCase useCase =
        new BatchUseCase(new TimeSeriesCompressor(CompressorConfig.defaults()), output);

    BatchUseCase.Summary summary = useCase.run(tempDir);

    assertEquals(3, summary.total());
    assertEquals(2, summary.succeeded());
    assertEquals(1, summary.failed());
    assertEquals(2, output.written.size());
    assertEquals("a.json", output.written.get(0).key());
    assertEquals("b.json", output.written.get(1).key());
    assertEquals("[{\"timestamp\":1000,\"value\":1}]", output.text(0));
    assertEquals(1, output.flushes);
  }

  @Test
  void emptyDirectoryProducesEmptySummary() throws Exception {
    RecordingOutputPort output = new RecordingOutputPort();
    BatchUseCase useCase =
        new BatchUseCase(new TimeSeriesCompressor(CompressorConfig.defaults()), output);

    BatchUseCase.Summary summary = useCase.run(tempDir);

    assertEquals(0, summary.total());
    assertTrue(output.written.isEmpty());
  }
}
