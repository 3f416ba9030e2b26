/**
 * Use cases behind the {@code compress}, {@code batch}, and {@code relay} commands.
 * <p>Each accepts a {@link ca.gc.cra.rollup.application.compress.TimeSeriesCompressor} and a
 * {@link ca.gc.cra.rollup.application.port.CompressedOutputPort}; create a fresh instance per CLI
 * invocation.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rollup.application.pipeline;
