package ca.gc.cra.rollup.application.compress;

/**
 * Raised when a payload is not a JSON array.
 *
 * @since 0.1.0
 */
public class InputFormatException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InputFormatException(String message) {
    super(message);
  }

  public InputFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
