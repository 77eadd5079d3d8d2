package io.arbor.exception;

import java.io.IOException;

/**
 * Unchecked wrapper for {@link IOException}s thrown by a storage backend.
 */
public final class ArborIOException extends ArborException {

  private static final long serialVersionUID = 1L;

  public ArborIOException(final IOException cause) {
    super(cause);
  }

  public ArborIOException(final String message, final IOException cause) {
    super(message, cause);
  }

  public ArborIOException(final String message) {
    super(message);
  }
}
