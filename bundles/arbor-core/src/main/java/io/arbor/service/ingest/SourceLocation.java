package io.arbor.service.ingest;

/**
 * Position in a source document.
 */
public final class SourceLocation {

  public static final SourceLocation UNKNOWN = new SourceLocation(-1, -1, -1);

  private final long offset;

  private final int line;

  private final int column;

  public SourceLocation(final long offset, final int line, final int column) {
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  /**
   * Byte offset, or character offset for character sources; {@code -1} if unknown.
   *
   * @return the offset
   */
  public long getOffset() {
    return offset;
  }

  public int getLine() {
    return line;
  }

  public int getColumn() {
    return column;
  }

  @Override
  public String toString() {
    return "line " + line + ", column " + column + ", offset " + offset;
  }
}
