package io.arbor.exception;

/**
 * The source token stream is malformed. Fatal to the running ingestion, which discards
 * everything it has written so far.
 */
public final class DocumentParseException extends ArborException {

  private static final long serialVersionUID = 1L;

  /** Byte (or character, for character sources) offset, {@code -1} if unknown. */
  private final long offset;

  /** One-based line, {@code -1} if unknown. */
  private final int line;

  /** One-based column, {@code -1} if unknown. */
  private final int column;

  public DocumentParseException(final String message, final long offset, final int line, final int column) {
    this(message, offset, line, column, null);
  }

  public DocumentParseException(final String message, final long offset, final int line, final int column,
      final Throwable cause) {
    super(format(message, offset, line, column), cause);
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  private static String format(final String message, final long offset, final int line, final int column) {
    if (line < 0) {
      return message + " (offset " + offset + ")";
    }
    return message + " (line " + line + ", column " + column + ", offset " + offset + ")";
  }

  public long getOffset() {
    return offset;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }
}
