package ca.gc.cra.rollup.application.compress;

import ca.gc.cra.rollup.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReferenceArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Compresses many payloads concurrently with a hard cap on in-flight work.
 * <p><strong>Why:</strong> A failing payload must not sink its batch; each slot of the result lines
 * up with its input and is empty when that payload could not be compressed.</p>
 * <p><strong>Thread-safety:</strong> Safe to share; every call builds and tears down its own pool.</p>
 * <p><strong>Performance:</strong> At most {@code workers} compressions run at once; a permit is
 * taken before each submit and returned when the unit finishes.</p>
 * <p><strong>Observability:</strong> Per-payload failures are logged at DEBUG with their index.</p>
 *
 * @since 0.1.0
 */
public final class BatchCompressor {
  private static final Logger log = LoggerFactory.getLogger(BatchCompressor.class);

  private final PayloadCompressor compressor;
  private final int workers;

  /**
   * Creates a batch runner.
   *
   * @param compressor single-payload compressor invoked per slot
   * @param workers maximum concurrent invocations; must be positive
   */
  public BatchCompressor(PayloadCompressor compressor, int workers) {
    this.compressor = Objects.requireNonNull(compressor, "compressor");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
  }

  /**
   * Compresses every payload and waits for all of them.
   *
   * @param payloads raw payloads; must not be {@code null}
   * @return results index-aligned with {@code payloads}; empty where compression failed
   * @throws InterruptedException if the caller is interrupted while waiting; outstanding work is cancelled
   */
  public List<Optional<byte[]>> compressBatch(List<byte[]> payloads) throws InterruptedException {
    Objects.requireNonNull(payloads, "payloads");
    if (payloads.isEmpty()) {
      return List.of();
    }
    int size = payloads.size();
    AtomicReferenceArray<byte[]> results = new AtomicReferenceArray<>(size);
    Semaphore permits = new Semaphore(workers);
    ExecutorService pool = ExecutorFactories.newBatchPool(workers, size);
    List<Future<?>> futures = new ArrayList<>(size);
    try {
      for (int i = 0; i < size; i++) {
        permits.acquire();
        int index = i;
        try {
          futures.add(pool.submit(() -> compressSlot(index, payloads.get(index), results, permits)));
        } catch (RejectedExecutionException ex) {
          permits.release();
          throw ex;
        }
      }
      for (Future<?> future : futures) {
        try {
          future.get();
        } catch (ExecutionException ex) {
          log.warn("Batch unit failed with an unrecoverable error", ex.getCause());
        }
      }
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      throw ex;
    } finally {
      pool.shutdown();
    }

    List<Optional<byte[]>> output = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      output.add(Optional.ofNullable(results.get(i)));
    }
    return output;
  }

  /**
   * Returns the concurrency cap.
   *
   * @return maximum concurrent compressions
   */
  public int workers() {
    return workers;
  }

  private void compressSlot(
      int index, byte[] payload, AtomicReferenceArray<byte[]> results, Semaphore permits) {
    try {
      results.set(index, compressor.compress(payload));
    } catch (RuntimeException ex) {
      log.debug("Payload {} of batch failed: {}", index, ex.getMessage());
    } finally {
      permits.release();
    }
  }
}
