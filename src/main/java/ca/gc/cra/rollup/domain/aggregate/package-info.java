/**
 * Grouping keys, per-group accumulators, and the aggregation rules applied to each group.
 *
 * <p>Pure domain code: no I/O, no logging, no JSON.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.rollup.domain.aggregate;
