/**
 * Windowed grouping engine, bounded-concurrency batch runner, and the compressor facade.
 *
 * <p>The engine performs no I/O beyond logging; callers hand it bytes and receive bytes.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rollup.application.compress;
