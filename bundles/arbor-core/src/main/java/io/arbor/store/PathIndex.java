package io.arbor.store;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import io.arbor.exception.ArborIOException;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageFile;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.function.LongFunction;

/**
 * Path index of the bulk loaded rows: {@code [hash (8)][id (4)]} entries sorted by path hash and
 * then id, searched with positional reads. Candidates are confirmed against the stored path, so
 * hash collisions only cost an extra read.
 */
final class PathIndex {

  static final int ENTRY_SIZE = Long.BYTES + Integer.BYTES;

  private static final HashFunction HASH = Hashing.farmHashFingerprint64();

  private static final PathIndex EMPTY = new PathIndex(null, 0);

  private final StorageFile file;

  private final long entries;

  private PathIndex(final StorageFile file, final long entries) {
    this.file = file;
    this.entries = entries;
  }

  static PathIndex empty() {
    return EMPTY;
  }

  static PathIndex open(final IOStorage storage, final long rowCount) {
    final StorageFile file = storage.file(IOStorage.PATHS_FILE);
    if (file.size() != rowCount * ENTRY_SIZE) {
      throw new ArborIOException("Path index does not match " + rowCount + " rows.");
    }
    return new PathIndex(file, rowCount);
  }

  static long hash(final String path) {
    return HASH.hashString(path, StandardCharsets.UTF_8).asLong();
  }

  /**
   * Find the first node, in id order, with a path.
   *
   * @param path the path
   * @param pathOf reads the stored path of an id
   * @return the id, {@code -1} if no bulk loaded node has the path
   */
  long find(final String path, final LongFunction<String> pathOf) {
    if (entries == 0) {
      return -1;
    }
    final long hash = hash(path);
    long low = 0;
    long high = entries;
    while (low < high) {
      final long middle = (low + high) >>> 1;
      if (Long.compare(read(middle).getLong(0), hash) < 0) {
        low = middle + 1;
      } else {
        high = middle;
      }
    }
    for (long entry = low; entry < entries; entry++) {
      final ByteBuffer buffer = read(entry);
      if (buffer.getLong(0) != hash) {
        break;
      }
      final int id = buffer.getInt(Long.BYTES);
      if (path.equals(pathOf.apply(id))) {
        return id;
      }
    }
    return -1;
  }

  private ByteBuffer read(final long entry) {
    final ByteBuffer buffer = ByteBuffer.allocate(ENTRY_SIZE);
    if (file.read(entry * ENTRY_SIZE, buffer) < ENTRY_SIZE) {
      throw new ArborIOException("Truncated path index");
    }
    return buffer;
  }
}
