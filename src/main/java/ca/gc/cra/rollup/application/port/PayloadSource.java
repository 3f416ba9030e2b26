package ca.gc.cra.rollup.application.port;

import java.time.Duration;
import java.util.List;

/**
 * <strong>What:</strong> Pull-based source of raw payloads for the relay.
 * <p><strong>Thread-safety:</strong> {@link #poll(Duration)} is called from one thread;
 * {@link #wakeup()} may be called from any thread to abort a blocked poll.</p>
 *
 * @since 0.1.0
 */
public interface PayloadSource extends AutoCloseable {
  /**
   * Waits up to {@code timeout} for the next payloads.
   *
   * @param timeout maximum wait
   * @return received payloads in arrival order; empty on timeout or wakeup
   */
  List<InboundPayload> poll(Duration timeout);

  /** Aborts a poll in progress; the aborted poll returns an empty list. */
  void wakeup();

  @Override
  void close();
}
