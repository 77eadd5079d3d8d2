package io.arbor.exception;

import static java.util.Objects.requireNonNull;

/**
 * A path expression could not be resolved. Carries the longest prefix of the expression which did
 * resolve, so the caller can report how far the jump got.
 */
public final class PathException extends ArborException {

  private static final long serialVersionUID = 1L;

  /** Why resolution stopped. */
  public enum Reason {
    /** No child with the requested key, or the segment does not apply to the node kind. */
    SEGMENT_NOT_FOUND,

    /** The expression does not follow the dot/bracket grammar. */
    MALFORMED_SYNTAX,

    /** Array index outside {@code [-childCount, childCount)}. */
    INDEX_OUT_OF_RANGE,

    /** Syntactically valid segment which is not supported, such as a slice. */
    UNSUPPORTED_SEGMENT
  }

  private final Reason reason;

  private final String resolvedPrefix;

  public PathException(final Reason reason, final String resolvedPrefix, final String message) {
    super(reason + ": " + message);
    this.reason = requireNonNull(reason);
    this.resolvedPrefix = requireNonNull(resolvedPrefix);
  }

  public Reason getReason() {
    return reason;
  }

  /**
   * Materialized path of the deepest node reached before the failure ({@code "."} if resolution
   * failed on the first segment or the expression could not be parsed).
   *
   * @return the resolved prefix
   */
  public String getResolvedPrefix() {
    return resolvedPrefix;
  }
}
