package io.arbor.io;

import io.arbor.exception.ArborIOException;

import java.nio.ByteBuffer;

/**
 * A growable, randomly addressable byte file of an {@link IOStorage}. Positional reads may run
 * concurrently; writes come from a single writer.
 */
public interface StorageFile {

  /**
   * Current size in bytes.
   *
   * @return the size
   */
  long size();

  /**
   * Append the remaining bytes of {@code source}.
   *
   * @param source the bytes to append
   * @return the position the bytes were written to
   * @throws ArborIOException if writing fails
   */
  long append(ByteBuffer source);

  /**
   * Overwrite bytes at a position, growing the file if needed.
   *
   * @param position the position
   * @param source the bytes to write
   * @throws ArborIOException if writing fails
   */
  void write(long position, ByteBuffer source);

  /**
   * Read into {@code target} until it is full or the end of the file is reached.
   *
   * @param position the position to read from
   * @param target the buffer to fill
   * @return the number of bytes read
   * @throws ArborIOException if reading fails
   */
  int read(long position, ByteBuffer target);

  /**
   * Cut the file to {@code newSize} bytes.
   *
   * @param newSize the new size
   */
  void truncate(long newSize);

  /**
   * Flush written bytes to the backing medium.
   */
  void force();
}
