package ca.gc.cra.rollup.application.pipeline;

import ca.gc.cra.rollup.application.port.CompressedOutputPort;
import ca.gc.cra.rollup.application.port.CompressedPayload;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Output port double that keeps written payloads and can fail on demand.
 */
final class RecordingOutputPort implements CompressedOutputPort {
  final List<CompressedPayload> written = new ArrayList<>();
  int flushes;
  String failOnKey;

  @Override
  public void write(CompressedPayload payload) throws Exception {
    if (payload.key().equals(failOnKey)) {
      throw new IllegalStateException("broker unavailable");
    }
    written.add(payload);
  }

  @Override
  public void flush() {
    flushes++;
  }

  String text(int index) {
    return new String(written.get(index).content(), StandardCharsets.UTF_8);
  }
}
