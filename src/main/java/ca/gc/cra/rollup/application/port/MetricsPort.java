package ca.gc.cra.rollup.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for compression and relay.
 * <p><strong>Why:</strong> Use cases count payloads, failures, and bytes without binding to a vendor SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from batch workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract: {@code compress.payloads},
 * {@code compress.failures}, {@code compress.bytes.in}, {@code compress.bytes.out},
 * {@code compress.latencyNanos}, {@code relay.published}, {@code relay.publish.failures}.</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort extends AutoCloseable {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Flushes and releases exporter resources. The default does nothing. */
  @Override
  default void close() {}

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
