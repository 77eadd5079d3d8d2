package io.arbor.io.filechannel;

import io.arbor.exception.ArborIOException;
import io.arbor.io.StorageFile;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;

import static java.util.Objects.requireNonNull;

/**
 * {@link StorageFile} on top of a {@link FileChannel}. Reads use positional access, so readers do
 * not contend on the channel position.
 */
final class FileChannelFile implements StorageFile {

  private final FileChannel channel;

  private volatile long size;

  FileChannelFile(final FileChannel channel) throws IOException {
    this.channel = requireNonNull(channel);
    this.size = channel.size();
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public synchronized long append(final ByteBuffer source) {
    final long position = size;
    write(position, source);
    return position;
  }

  @Override
  public synchronized void write(final long position, final ByteBuffer source) {
    try {
      long current = position;
      while (source.hasRemaining()) {
        current += channel.write(source, current);
      }
      if (current > size) {
        size = current;
      }
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  @Override
  public int read(final long position, final ByteBuffer target) {
    try {
      int total = 0;
      long current = position;
      while (target.hasRemaining()) {
        final int read = channel.read(target, current);
        if (read < 0) {
          break;
        }
        total += read;
        current += read;
      }
      return total;
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  @Override
  public synchronized void truncate(final long newSize) {
    try {
      channel.truncate(newSize);
      size = Math.min(size, newSize);
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  @Override
  public void force() {
    try {
      channel.force(false);
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  void close() throws IOException {
    channel.close();
  }
}
