package ca.gc.cra.rollup.api;

/**
 * <strong>What:</strong> Process exit codes shared by the rollup commands.
 * <p><strong>Why:</strong> Schedulers and wrapper scripts branch on these values, so each failure
 * class keeps a stable number.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were rejected before running. */
  INVALID_ARGS(2),
  /** Reading input or writing output failed. */
  IO_ERROR(3),
  /** Configuration proved invalid while the command was running. */
  CONFIG_ERROR(4),
  /** The command ran but did not complete, including inputs that could not be compressed. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
