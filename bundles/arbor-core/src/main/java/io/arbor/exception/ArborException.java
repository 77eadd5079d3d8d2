package io.arbor.exception;

/**
 * Base of all failures raised by the node store and the services built on top of it.
 */
public class ArborException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public ArborException(final String message) {
    super(message);
  }

  public ArborException(final String message, final Throwable cause) {
    super(message, cause);
  }

  public ArborException(final Throwable cause) {
    super(cause);
  }

  /**
   * Constructor with a {@link String#format(String, Object...)} pattern.
   *
   * @param message the message pattern
   * @param args the pattern arguments
   */
  public ArborException(final String message, final Object... args) {
    super(String.format(message, args));
  }
}
