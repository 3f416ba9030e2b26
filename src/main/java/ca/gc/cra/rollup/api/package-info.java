/**
 * Command-line entry points: {@code compress}, {@code batch}, and {@code relay}.
 * <p><strong>Role:</strong> Driving adapters; parse {@code key=value} arguments, merge YAML and
 * defaults, configure logging and telemetry, then invoke a use case.</p>
 * <p><strong>Exit codes:</strong> see {@link ca.gc.cra.rollup.api.ExitCode}.</p>
 */
package ca.gc.cra.rollup.api;
