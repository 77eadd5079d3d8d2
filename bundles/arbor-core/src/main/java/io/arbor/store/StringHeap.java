package io.arbor.store;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import io.arbor.exception.ArborIOException;
import io.arbor.io.StorageFile;
import io.arbor.io.StorageFiles;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.DataInput;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import static java.util.Objects.requireNonNull;

/**
 * Append-only heap of length-prefixed UTF-8 strings ({@code [int length][bytes]}). The strings of
 * one row (key, value, path) are written back to back, so a row is usually served by one read.
 */
final class StringHeap {

  /** Bytes fetched by the first read of a row. */
  private static final int PREFETCH = 256;

  private final StorageFile file;

  StringHeap(final StorageFile file) {
    this.file = requireNonNull(file);
  }

  StorageFile file() {
    return file;
  }

  long size() {
    return file.size();
  }

  /**
   * Encode a string into a buffer.
   *
   * @return number of bytes written
   */
  static int encode(final ByteArrayDataOutput output, final String value) {
    final byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    output.writeInt(bytes.length);
    output.write(bytes);
    return Integer.BYTES + bytes.length;
  }

  static String decode(final DataInput input) throws IOException {
    final byte[] bytes = new byte[input.readInt()];
    input.readFully(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }

  String read(final long ref) {
    final ByteBuffer length = ByteBuffer.allocate(Integer.BYTES);
    if (file.read(ref, length) < Integer.BYTES) {
      throw new ArborIOException("Truncated string at " + ref);
    }
    length.flip();
    final ByteBuffer bytes = ByteBuffer.allocate(length.getInt());
    if (file.read(ref + Integer.BYTES, bytes) < bytes.capacity()) {
      throw new ArborIOException("Truncated string at " + ref);
    }
    return new String(bytes.array(), StandardCharsets.UTF_8);
  }

  /**
   * Read the strings of a row.
   *
   * @return key, value ({@code null} for containers) and path
   */
  String[] readRow(final NodeRow row) {
    final ByteBuffer block = ByteBuffer.allocate(PREFETCH);
    final int read = file.read(row.keyRef, block);
    final String key = readFromBlock(block, read, row.keyRef, row.keyRef);
    final String value = row.hasValue() ? readFromBlock(block, read, row.keyRef, row.valueRef) : null;
    final String path = readFromBlock(block, read, row.keyRef, row.pathRef);
    return new String[] { key, value, path };
  }

  private String readFromBlock(final ByteBuffer block, final int blockLength, final long blockStart, final long ref) {
    final long offset = ref - blockStart;
    if (offset >= 0 && offset + Integer.BYTES <= blockLength) {
      final int length = block.getInt((int) offset);
      final long start = offset + Integer.BYTES;
      if (start + length <= blockLength) {
        return new String(block.array(), (int) start, length, StandardCharsets.UTF_8);
      }
    }
    return read(ref);
  }

  /**
   * Append the strings of a row.
   *
   * @param value the value, {@code null} for none
   * @return key, value ({@link NodeRow#NO_REF} if absent) and path references
   */
  long[] appendRow(final String key, final @Nullable String value, final String path) {
    final ByteArrayDataOutput output = ByteStreams.newDataOutput();
    final long start = file.size();
    final long keyRef = start;
    long next = start + encode(output, key);
    long valueRef = NodeRow.NO_REF;
    if (value != null) {
      valueRef = next;
      next += encode(output, value);
    }
    final long pathRef = next;
    encode(output, path);
    final long position = file.append(ByteBuffer.wrap(output.toByteArray()));
    if (position != start) {
      throw new ArborIOException("Concurrent append to the string heap");
    }
    return new long[] { keyRef, valueRef, pathRef };
  }

  /**
   * Sequential reader over the heap starting at {@code position}.
   *
   * @param position the start position
   * @return the stream
   */
  DataInputStream scan(final long position) {
    return new DataInputStream(StorageFiles.newInputStream(file, position));
  }
}
