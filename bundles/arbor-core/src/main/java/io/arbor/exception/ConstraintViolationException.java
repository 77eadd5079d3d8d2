package io.arbor.exception;

/**
 * An insert or an index build found rows that break a structural invariant of the node store,
 * for instance two siblings sharing a rank. Always a defect of the caller.
 */
public final class ConstraintViolationException extends ArborException {

  private static final long serialVersionUID = 1L;

  public ConstraintViolationException(final String message, final Object... args) {
    super(message, args);
  }
}
