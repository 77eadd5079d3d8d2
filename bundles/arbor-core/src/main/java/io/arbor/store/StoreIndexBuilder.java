package io.arbor.store;

import io.arbor.exception.ArborIOException;
import io.arbor.exception.ConstraintViolationException;
import io.arbor.index.search.SearchIndexBuilder;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageFiles;
import io.arbor.node.NodeKind;
import io.arbor.settings.Fixed;
import io.arbor.utils.LogWrapper;
import it.unimi.dsi.fastutil.Arrays;
import org.slf4j.LoggerFactory;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;

/**
 * Builds every index of a bulk load from the flushed rows:
 *
 * <ol>
 *   <li>one sequential scan of the node table and the string heap, which validates the rows,
 *   counts the children per parent, hashes the paths and feeds the search index builder,</li>
 *   <li>prefix sums of the counts into per-parent offsets and one placement pass putting every
 *   child at {@code offsets[parent] + rank},</li>
 *   <li>one sort of the path hashes,</li>
 *   <li>a reverse pass computing the preorder subtree extents for the path postings.</li>
 * </ol>
 */
final class StoreIndexBuilder {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(StoreIndexBuilder.class));

  private static final int NONE = -1;

  /** Outcome of a build. */
  static final class Result {
    final ChildIndex children;

    final boolean preorder;

    Result(final ChildIndex children, final boolean preorder) {
      this.children = children;
      this.preorder = preorder;
    }
  }

  private final IOStorage storage;

  private final NodeTable table;

  private final StringHeap heap;

  private final int rowCount;

  private final int[] parents;

  private final int[] ranks;

  private final byte[] kinds;

  private final int[] pathLengths;

  private final long[] pathHashes;

  private final int[] pathIds;

  private final int[] childCounts;

  private final SearchIndexBuilder searchIndexBuilder = new SearchIndexBuilder();

  StoreIndexBuilder(final IOStorage storage, final NodeTable table, final StringHeap heap, final long rowCount) {
    if (rowCount > Integer.MAX_VALUE - 8) {
      throw new ConstraintViolationException("A store holds at most %d nodes, got %d.", Integer.MAX_VALUE - 8,
          rowCount);
    }
    this.storage = storage;
    this.table = table;
    this.heap = heap;
    this.rowCount = (int) rowCount;
    parents = new int[this.rowCount];
    ranks = new int[this.rowCount];
    kinds = new byte[this.rowCount];
    pathLengths = new int[this.rowCount];
    pathHashes = new long[this.rowCount];
    pathIds = new int[this.rowCount];
    childCounts = new int[this.rowCount];
  }

  Result build() {
    final long start = System.currentTimeMillis();
    LOGWRAPPER.info("Building indexes over {} rows.", rowCount);

    scan();
    final int[] offsets = new int[rowCount + 1];
    for (int parent = 0; parent < rowCount; parent++) {
      offsets[parent + 1] = offsets[parent] + childCounts[parent];
    }
    final int[] children = placeChildren(offsets);
    writeInts(IOStorage.CHILD_OFFSETS_FILE, offsets, offsets.length);
    writeInts(IOStorage.CHILDREN_FILE, children, children.length);
    LOGWRAPPER.debug("Parent/rank index built [{} ms]", System.currentTimeMillis() - start);

    writePathIndex();
    LOGWRAPPER.debug("Path index built [{} ms]", System.currentTimeMillis() - start);

    final int[] extents = extents();
    final boolean preorder = isPreorder(offsets, children, extents);
    if (!preorder) {
      LOGWRAPPER.warn("Rows are not numbered in document order, path search falls back to verification.");
    }
    searchIndexBuilder.build(preorder ? extents : null, storage);

    LOGWRAPPER.info("Building indexes over {} rows done [{} ms]", rowCount, System.currentTimeMillis() - start);
    return new Result(new ChildIndex(offsets, storage.file(IOStorage.CHILDREN_FILE)), preorder);
  }

  private void scan() {
    try (final DataInputStream rows = table.scan(0); final DataInputStream strings = heap.scan(0)) {
      for (int id = 0; id < rowCount; id++) {
        final NodeRow row = NodeTable.decode(rows);
        final String key = StringHeap.decode(strings);
        final String value = row.hasValue() ? StringHeap.decode(strings) : null;
        final String path = StringHeap.decode(strings);
        validate(id, row, path);

        kinds[id] = row.kind.getId();
        ranks[id] = row.rank;
        pathLengths[id] = path.length();
        pathHashes[id] = PathIndex.hash(path);
        pathIds[id] = id;

        final String segment;
        if (id == 0) {
          parents[id] = NONE;
          segment = path;
        } else {
          final int parent = (int) row.parentId;
          parents[id] = parent;
          childCounts[parent]++;
          segment = path.substring(pathLengths[parent]);
        }
        searchIndexBuilder.add(id, key, value, segment);
      }
    } catch (final IOException e) {
      throw new ArborIOException("Cannot scan the node table", e);
    }
  }

  private void validate(final int id, final NodeRow row, final String path) {
    if (row.kind == NodeKind.BUCKET) {
      throw new ConstraintViolationException("Node %d: bucket nodes are never stored.", id);
    }
    if (row.rank < 0) {
      throw new ConstraintViolationException("Node %d has the negative rank %d.", id, row.rank);
    }
    if (id == 0) {
      if (row.parentId != Fixed.NULL_NODE_ID.getStandardProperty()) {
        throw new ConstraintViolationException("The first row must be the root, but has the parent %d.",
            row.parentId);
      }
      return;
    }
    if (row.parentId == Fixed.NULL_NODE_ID.getStandardProperty()) {
      throw new ConstraintViolationException("Node %d is a second root.", id);
    }
    if (row.parentId < 0 || row.parentId >= id) {
      throw new ConstraintViolationException("Node %d references the parent %d, which was not inserted before it.",
          id, row.parentId);
    }
    final int parent = (int) row.parentId;
    if (!NodeKind.getKind(kinds[parent]).isContainer()) {
      throw new ConstraintViolationException("Node %d references the parent %d, which is no container.", id, parent);
    }
    if (path.length() <= pathLengths[parent]) {
      throw new ConstraintViolationException("The path of node %d does not extend the path of its parent %d.", id,
          parent);
    }
  }

  private int[] placeChildren(final int[] offsets) {
    final int[] children = new int[Math.max(rowCount - 1, 0)];
    java.util.Arrays.fill(children, NONE);
    for (int id = 1; id < rowCount; id++) {
      final int parent = parents[id];
      final int rank = ranks[id];
      if (rank >= childCounts[parent]) {
        throw new ConstraintViolationException("Rank %d of node %d is outside 0..%d of its parent %d.", rank, id,
            childCounts[parent] - 1, parent);
      }
      final int slot = offsets[parent] + rank;
      if (children[slot] != NONE) {
        throw new ConstraintViolationException("Nodes %d and %d share the rank %d under the parent %d.",
            children[slot], id, rank, parent);
      }
      children[slot] = id;
    }
    return children;
  }

  private void writePathIndex() {
    Arrays.quickSort(0, rowCount, (first, second) -> {
      final int compare = Long.compare(pathHashes[first], pathHashes[second]);
      return compare != 0 ? compare : Integer.compare(pathIds[first], pathIds[second]);
    }, (first, second) -> {
      final long hash = pathHashes[first];
      pathHashes[first] = pathHashes[second];
      pathHashes[second] = hash;
      final int id = pathIds[first];
      pathIds[first] = pathIds[second];
      pathIds[second] = id;
    });
    try (final DataOutputStream output = new DataOutputStream(
        StorageFiles.newAppendingStream(storage.file(IOStorage.PATHS_FILE)))) {
      for (int i = 0; i < rowCount; i++) {
        output.writeLong(pathHashes[i]);
        output.writeInt(pathIds[i]);
      }
    } catch (final IOException e) {
      throw new ArborIOException("Cannot write the path index", e);
    }
  }

  /**
   * Last id of every subtree, assuming preorder numbering.
   */
  private int[] extents() {
    final int[] subtreeSizes = new int[rowCount];
    java.util.Arrays.fill(subtreeSizes, 1);
    for (int id = rowCount - 1; id > 0; id--) {
      subtreeSizes[parents[id]] += subtreeSizes[id];
    }
    final int[] extents = new int[rowCount];
    for (int id = 0; id < rowCount; id++) {
      extents[id] = id + subtreeSizes[id] - 1;
    }
    return extents;
  }

  /**
   * Whether the ids are the preorder numbering of the tree, that is, every child follows the
   * subtree of its previous sibling.
   */
  private boolean isPreorder(final int[] offsets, final int[] children, final int[] extents) {
    for (int parent = 0; parent < rowCount; parent++) {
      int expected = parent + 1;
      for (int slot = offsets[parent]; slot < offsets[parent + 1]; slot++) {
        final int child = children[slot];
        if (child != expected) {
          return false;
        }
        expected = extents[child] + 1;
      }
    }
    return true;
  }

  private void writeInts(final String fileName, final int[] values, final int length) {
    try (final DataOutputStream output = new DataOutputStream(
        StorageFiles.newAppendingStream(storage.file(fileName)))) {
      for (int i = 0; i < length; i++) {
        output.writeInt(values[i]);
      }
    } catch (final IOException e) {
      throw new ArborIOException("Cannot write " + fileName, e);
    }
  }
}
