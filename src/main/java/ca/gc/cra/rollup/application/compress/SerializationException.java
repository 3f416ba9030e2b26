package ca.gc.cra.rollup.application.compress;

/**
 * Raised when aggregated output cannot be written as JSON, e.g. a sum that overflowed to infinity.
 *
 * @since 0.1.0
 */
public class SerializationException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public SerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
