/**
 * Application layer: the compression engine, its ports, and the use cases that drive it.
 * <p><strong>Concurrency:</strong> Only the batch runner starts threads; use cases document their own
 * threading.</p>
 */
package ca.gc.cra.rollup.application;
