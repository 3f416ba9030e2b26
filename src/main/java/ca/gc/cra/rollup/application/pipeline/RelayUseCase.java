package ca.gc.cra.rollup.application.pipeline;

import ca.gc.cra.rollup.application.compress.TimeSeriesCompressor;
import ca.gc.cra.rollup.application.port.CompressedOutputPort;
import ca.gc.cra.rollup.application.port.CompressedPayload;
import ca.gc.cra.rollup.application.port.InboundPayload;
import ca.gc.cra.rollup.application.port.MetricsPort;
import ca.gc.cra.rollup.application.port.PayloadSource;
import ca.gc.cra.rollup.domain.aggregate.CompressionRatio;
import ca.gc.cra.rollup.logging.Logs;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Long-running relay: poll raw payloads, compress each polled batch
 * concurrently, publish the results.
 * <p><strong>Why:</strong> A payload that fails to compress or publish is logged and dropped; the
 * loop keeps serving the rest of the stream.</p>
 * <p><strong>Thread-safety:</strong> {@link #run(Duration)} runs on one thread; {@link #stop()} may be
 * called from any thread, typically a shutdown hook.</p>
 * <p><strong>Observability:</strong> INFO per published payload with its ratio; the {@code origin}
 * MDC key carries the inbound position. Counts {@code relay.publish.failures} for publish errors
 * raised synchronously by the output port.</p>
 *
 * @since 0.1.0
 */
public final class RelayUseCase {
  private static final Logger log = LoggerFactory.getLogger(RelayUseCase.class);
  private static final int PREVIEW_BYTES = 256;

  private final PayloadSource source;
  private final TimeSeriesCompressor compressor;
  private final CompressedOutputPort output;
  private final MetricsPort metrics;
  private final AtomicBoolean running = new AtomicBoolean(true);

  public RelayUseCase(
      PayloadSource source,
      TimeSeriesCompressor compressor,
      CompressedOutputPort output,
      MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    this.output = Objects.requireNonNull(output, "output");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Polls and relays until {@link #stop()} is called or the thread is interrupted.
   *
   * @param pollTimeout maximum wait per poll
   * @return total payloads published
   * @throws InterruptedException if the relay thread is interrupted
   */
  public long run(Duration pollTimeout) throws InterruptedException {
    log.info("Relay started");
    long published = 0;
    while (running.get()) {
      if (Thread.currentThread().isInterrupted()) {
        throw new InterruptedException("relay interrupted");
      }
      published += runOnce(pollTimeout);
    }
    log.info("Relay stopped after publishing {} payloads", published);
    return published;
  }

  /**
   * Performs a single poll-compress-publish cycle.
   *
   * @param pollTimeout maximum wait for the poll
   * @return payloads published in this cycle
   * @throws InterruptedException if interrupted while the batch runs
   */
  public int runOnce(Duration pollTimeout) throws InterruptedException {
    List<InboundPayload> inbound = source.poll(pollTimeout);
    if (inbound.isEmpty()) {
      return 0;
    }
    List<byte[]> raw = new ArrayList<>(inbound.size());
    for (InboundPayload payload : inbound) {
      raw.add(payload.content());
    }
    List<Optional<byte[]>> results = compressor.compressBatch(raw);

    int published = 0;
    for (int i = 0; i < inbound.size(); i++) {
      InboundPayload payload = inbound.get(i);
      MDC.put("origin", payload.origin());
      try {
        Optional<byte[]> result = results.get(i);
        if (result.isEmpty()) {
          log.warn("Failed to compress payload from {}: {}",
              payload.origin(), Logs.truncate(payload.content(), PREVIEW_BYTES));
          continue;
        }
        if (publish(payload, result.get())) {
          published++;
        }
      } finally {
        MDC.remove("origin");
      }
    }
    return published;
  }

  /** Requests the loop to exit and aborts a poll in progress. */
  public void stop() {
    if (running.compareAndSet(true, false)) {
      source.wakeup();
    }
  }

  /**
   * Indicates whether the loop has not been asked to stop.
   *
   * @return {@code true} until {@link #stop()} is called
   */
  public boolean isRunning() {
    return running.get();
  }

  private boolean publish(InboundPayload payload, byte[] compressed) {
    String key = payload.key() == null ? "" : payload.key();
    try {
      output.write(new CompressedPayload(key, compressed));
    } catch (Exception ex) {
      metrics.increment("relay.publish.failures");
      log.error("Failed to publish compressed payload from {}", payload.origin(), ex);
      return false;
    }
    double ratio = compressor.compressionRatio(payload.content(), compressed);
    log.info("Compressed {} bytes to {} bytes ({} reduction)",
        payload.content().length, compressed.length, CompressionRatio.percent(ratio));
    return true;
  }
}
