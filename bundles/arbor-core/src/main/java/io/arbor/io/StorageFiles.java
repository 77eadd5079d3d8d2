package io.arbor.io;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Stream views of {@link StorageFile}s, for structures which are written and read sequentially.
 */
public final class StorageFiles {

  private static final int BUFFER_SIZE = 1 << 16;

  private StorageFiles() {
    throw new AssertionError();
  }

  /**
   * Buffered stream reading a file from {@code position} to its end.
   *
   * @param file the file
   * @param position the start position
   * @return the stream
   */
  public static InputStream newInputStream(final StorageFile file, final long position) {
    requireNonNull(file);
    checkArgument(position >= 0, "position must be >= 0");
    return new InputStream() {
      private final ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE).flip();

      private long next = position;

      @Override
      public int read() {
        if (!fill()) {
          return -1;
        }
        return buffer.get() & 0xFF;
      }

      @Override
      public int read(final byte[] bytes, final int offset, final int length) {
        if (length == 0) {
          return 0;
        }
        if (!fill()) {
          return -1;
        }
        final int count = Math.min(length, buffer.remaining());
        buffer.get(bytes, offset, count);
        return count;
      }

      private boolean fill() {
        if (buffer.hasRemaining()) {
          return true;
        }
        buffer.clear();
        final int read = file.read(next, buffer);
        buffer.flip();
        next += read;
        return read > 0;
      }
    };
  }

  /**
   * Buffered stream appending to a file.
   *
   * @param file the file
   * @return the stream, which must be flushed or closed to write the last bytes
   */
  public static OutputStream newAppendingStream(final StorageFile file) {
    requireNonNull(file);
    return new OutputStream() {
      private final ByteBuffer buffer = ByteBuffer.allocate(BUFFER_SIZE);

      @Override
      public void write(final int value) {
        if (!buffer.hasRemaining()) {
          flush();
        }
        buffer.put((byte) value);
      }

      @Override
      public void write(final byte[] bytes, final int offset, final int length) {
        int position = offset;
        int remaining = length;
        while (remaining > 0) {
          if (!buffer.hasRemaining()) {
            flush();
          }
          final int count = Math.min(remaining, buffer.remaining());
          buffer.put(bytes, position, count);
          position += count;
          remaining -= count;
        }
      }

      @Override
      public void flush() {
        buffer.flip();
        if (buffer.hasRemaining()) {
          file.append(buffer);
        }
        buffer.clear();
      }

      @Override
      public void close() {
        flush();
      }
    };
  }
}
