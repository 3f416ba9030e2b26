/**
 * OpenTelemetry binding for {@link ca.gc.cra.rollup.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; safe for batch workers.</p>
 * <p><strong>Security:</strong> Only metric names and counts are exported, never payload contents.</p>
 */
package ca.gc.cra.rollup.infrastructure.metrics;
