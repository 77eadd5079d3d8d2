package io.arbor.store;

import io.arbor.exception.ArborIOException;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageFile;
import io.arbor.io.StorageFiles;

import java.io.DataInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

import static java.util.Objects.requireNonNull;

/**
 * Parent/rank index of the bulk loaded rows: the ids of all children ordered by parent and rank
 * ({@link IOStorage#CHILDREN_FILE}) plus the start offset of every parent's run
 * ({@link IOStorage#CHILD_OFFSETS_FILE}), which is held in memory.
 */
final class ChildIndex {

  private static final ChildIndex EMPTY = new ChildIndex(new int[] { 0 }, null);

  /** {@code offsets[p] ... offsets[p + 1] - 1} are the slots of the children of {@code p}. */
  private final int[] offsets;

  private final StorageFile children;

  ChildIndex(final int[] offsets, final StorageFile children) {
    this.offsets = requireNonNull(offsets);
    this.children = children;
  }

  static ChildIndex empty() {
    return EMPTY;
  }

  /**
   * Load the index of {@code rowCount} bulk loaded rows.
   */
  static ChildIndex load(final IOStorage storage, final int rowCount) {
    final StorageFile offsetsFile = storage.file(IOStorage.CHILD_OFFSETS_FILE);
    if (offsetsFile.size() != (long) (rowCount + 1) * Integer.BYTES) {
      throw new ArborIOException("Child offsets do not match " + rowCount + " rows.");
    }
    final int[] offsets = new int[rowCount + 1];
    try (final DataInputStream input = new DataInputStream(StorageFiles.newInputStream(offsetsFile, 0))) {
      for (int i = 0; i <= rowCount; i++) {
        offsets[i] = input.readInt();
      }
    } catch (final IOException e) {
      throw new ArborIOException("Cannot read the child offsets", e);
    }
    return new ChildIndex(offsets, storage.file(IOStorage.CHILDREN_FILE));
  }

  int rowCount() {
    return offsets.length - 1;
  }

  int childCount(final long parentId) {
    if (parentId < 0 || parentId >= rowCount()) {
      return 0;
    }
    final int parent = (int) parentId;
    return offsets[parent + 1] - offsets[parent];
  }

  /**
   * Children of a parent at the positions {@code from ... from + count - 1}, which have to exist.
   */
  long[] window(final long parentId, final int from, final int count) {
    final long[] ids = new long[count];
    if (count == 0) {
      return ids;
    }
    final ByteBuffer buffer = ByteBuffer.allocate(count * Integer.BYTES);
    final long position = (long) (offsets[(int) parentId] + from) * Integer.BYTES;
    if (children.read(position, buffer) < buffer.capacity()) {
      throw new ArborIOException("Truncated child index");
    }
    buffer.flip();
    for (int i = 0; i < count; i++) {
      ids[i] = buffer.getInt();
    }
    return ids;
  }

  long childAt(final long parentId, final int rank) {
    return window(parentId, rank, 1)[0];
  }
}
