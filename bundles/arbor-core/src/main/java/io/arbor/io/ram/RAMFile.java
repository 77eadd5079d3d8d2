package io.arbor.io.ram;

import io.arbor.exception.ArborIOException;
import io.arbor.io.StorageFile;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Heap backed {@link StorageFile}, limited to {@link Integer#MAX_VALUE} bytes.
 */
final class RAMFile implements StorageFile {

  private static final int MAX_SIZE = Integer.MAX_VALUE - 8;

  private byte[] data = new byte[1024];

  private int size;

  @Override
  public synchronized long size() {
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
    final long end = position + source.remaining();
    if (end > MAX_SIZE) {
      throw new ArborIOException("In memory file exceeds " + MAX_SIZE + " bytes.");
    }
    ensureCapacity((int) end);
    final int length = source.remaining();
    source.get(data, (int) position, length);
    if (end > size) {
      size = (int) end;
    }
  }

  @Override
  public synchronized int read(final long position, final ByteBuffer target) {
    if (position >= size) {
      return 0;
    }
    final int length = (int) Math.min(target.remaining(), size - position);
    target.put(data, (int) position, length);
    return length;
  }

  @Override
  public synchronized void truncate(final long newSize) {
    if (newSize < size) {
      size = (int) newSize;
      if (data.length > 1024 && newSize == 0) {
        data = new byte[1024];
      }
    }
  }

  @Override
  public void force() {
    // Nothing to flush.
  }

  private void ensureCapacity(final int capacity) {
    if (capacity > data.length) {
      final long grown = Math.max(capacity, (long) data.length << 1);
      data = Arrays.copyOf(data, (int) Math.min(grown, MAX_SIZE));
    }
  }
}
