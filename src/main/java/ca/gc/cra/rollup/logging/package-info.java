/**
 * Logging helpers: runtime verbosity control and bounded payload previews.
 *
 * <p>Backed by SLF4J with Logback as the runtime binding.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rollup.logging;
