package ca.gc.cra.rollup.application.port;

import java.util.Objects;

/**
 * Raw JSON array received from a {@link PayloadSource}.
 *
 * @param key routing key carried through to the compressed output; may be {@code null}
 * @param content raw payload bytes
 * @param origin human-readable origin for logs, e.g. {@code timeseries.raw-0@42}
 * @since 0.1.0
 */
public record InboundPayload(String key, byte[] content, String origin) {
  public InboundPayload {
    Objects.requireNonNull(content, "content");
    origin = origin == null ? "<unknown>" : origin;
  }
}
