package io.arbor.service.ingest;

import io.arbor.exception.DocumentParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.Closeable;

/**
 * Pull-based adapter turning a concrete format into {@link Token}s.
 */
public interface TokenSource extends Closeable {

  /**
   * Read the next token.
   *
   * @return the token, {@code null} at the end of the input
   * @throws DocumentParseException if the input is not well formed
   */
  @Nullable Token next();

  /**
   * Location of the last token read.
   *
   * @return the location
   */
  SourceLocation location();

  /**
   * Closes the underlying input.
   */
  @Override
  void close();
}
