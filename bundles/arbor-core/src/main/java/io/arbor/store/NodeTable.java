package io.arbor.store;

import com.google.common.io.ByteArrayDataOutput;
import io.arbor.exception.ArborIOException;
import io.arbor.io.StorageFile;
import io.arbor.io.StorageFiles;
import io.arbor.node.NodeKind;

import java.io.DataInput;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

import static java.util.Objects.requireNonNull;

/**
 * The node table: one fixed-width row per node, addressed by id.
 *
 * <pre>
 * | parentId (8) | rank (4) | kind (1) | padding (3) | keyRef (8) | valueRef (8) | pathRef (8) |
 * </pre>
 */
final class NodeTable {

  /** Bytes per row. */
  static final int ROW_SIZE = 40;

  private static final int PADDING = 3;

  private final StorageFile file;

  NodeTable(final StorageFile file) {
    this.file = requireNonNull(file);
  }

  StorageFile file() {
    return file;
  }

  /**
   * Number of complete rows in the file.
   *
   * @return the row count
   */
  long rowCount() {
    return file.size() / ROW_SIZE;
  }

  NodeRow read(final long id) {
    final ByteBuffer buffer = ByteBuffer.allocate(ROW_SIZE);
    final int read = file.read(id * ROW_SIZE, buffer);
    if (read < ROW_SIZE) {
      throw new ArborIOException("Truncated node row " + id);
    }
    buffer.flip();
    final long parentId = buffer.getLong();
    final int rank = buffer.getInt();
    final NodeKind kind = NodeKind.getKind(buffer.get());
    buffer.position(buffer.position() + PADDING);
    return new NodeRow(parentId, rank, kind, buffer.getLong(), buffer.getLong(), buffer.getLong());
  }

  /**
   * Append a single row.
   *
   * @return the id of the row
   */
  long append(final long parentId, final int rank, final NodeKind kind, final long keyRef, final long valueRef,
      final long pathRef) {
    final ByteBuffer buffer = ByteBuffer.allocate(ROW_SIZE);
    buffer.putLong(parentId).putInt(rank).put(kind.getId());
    buffer.position(buffer.position() + PADDING);
    buffer.putLong(keyRef).putLong(valueRef).putLong(pathRef);
    buffer.flip();
    return file.append(buffer) / ROW_SIZE;
  }

  static void encode(final ByteArrayDataOutput output, final long parentId, final int rank, final NodeKind kind,
      final long keyRef, final long valueRef, final long pathRef) {
    output.writeLong(parentId);
    output.writeInt(rank);
    output.writeByte(kind.getId());
    for (int i = 0; i < PADDING; i++) {
      output.writeByte(0);
    }
    output.writeLong(keyRef);
    output.writeLong(valueRef);
    output.writeLong(pathRef);
  }

  static NodeRow decode(final DataInput input) throws IOException {
    final long parentId = input.readLong();
    final int rank = input.readInt();
    final NodeKind kind = NodeKind.getKind(input.readByte());
    input.skipBytes(PADDING);
    return new NodeRow(parentId, rank, kind, input.readLong(), input.readLong(), input.readLong());
  }

  /**
   * Sequential reader over the rows starting at {@code firstId}.
   *
   * @param firstId first row to read
   * @return the stream, positioned at the row
   */
  DataInputStream scan(final long firstId) {
    return new DataInputStream(StorageFiles.newInputStream(file, firstId * ROW_SIZE));
  }
}
