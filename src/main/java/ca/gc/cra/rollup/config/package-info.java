/**
 * Configuration records and the YAML/CLI/defaults merge used by the rollup commands.
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Values are checked with {@code ca.gc.cra.rollup.validation} utilities
 * before any file or broker is touched.</p>
 */
package ca.gc.cra.rollup.config;
