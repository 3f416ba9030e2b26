/**
 * Infrastructure bindings for rollup ports: worker pools, file output, and OpenTelemetry metrics.
 * <p><strong>Metrics:</strong> Counters live under the {@code compress.*} and {@code relay.*} namespaces.</p>
 */
package ca.gc.cra.rollup.infrastructure;
