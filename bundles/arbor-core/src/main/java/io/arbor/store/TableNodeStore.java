package io.arbor.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.arbor.access.ArborConfiguration;
import io.arbor.exception.ArborIOException;
import io.arbor.exception.ConstraintViolationException;
import io.arbor.exception.NodeNotFoundException;
import io.arbor.index.search.SearchIndex;
import io.arbor.io.IOStorage;
import io.arbor.node.Node;
import io.arbor.node.NodeKind;
import io.arbor.node.NodePaths;
import io.arbor.settings.Fixed;
import io.arbor.utils.LogWrapper;
import it.unimi.dsi.fastutil.ints.Int2LongAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2LongSortedMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.objects.Object2LongOpenHashMap;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * {@link NodeStore} on top of an {@link IOStorage}: a fixed-width node table, a string heap and
 * the derived index files written by a bulk load.
 *
 * <p>Rows inserted one by one are appended to the same table and heap and indexed in an in-memory
 * overlay (children per parent by rank, paths), which is rebuilt from the rows above the bulk
 * loaded base when the store is opened again.
 */
public final class TableNodeStore implements NodeStore {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(TableNodeStore.class));

  private final IOStorage storage;

  private final int batchSize;

  private final NodeTable table;

  private final StringHeap heap;

  private final Cache<Long, Node> nodeCache;

  private final SearchIndex searchIndex;

  /** Guards the overlay; the write lock is held by single-row inserts. */
  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  private final Long2ObjectOpenHashMap<Int2LongSortedMap> overlayChildren = new Long2ObjectOpenHashMap<>();

  private final Object2LongOpenHashMap<String> overlayPaths = new Object2LongOpenHashMap<>();

  private volatile ChildIndex baseChildren = ChildIndex.empty();

  private volatile PathIndex basePaths = PathIndex.empty();

  private volatile long rowCount;

  private volatile boolean bulkLoading;

  private volatile boolean closed;

  private volatile StoreDescriptor descriptor;

  private TableNodeStore(final IOStorage storage, final ArborConfiguration configuration) {
    this.storage = requireNonNull(storage);
    this.batchSize = configuration.batchSize;
    this.table = new NodeTable(storage.file(IOStorage.NODES_FILE));
    this.heap = new StringHeap(storage.file(IOStorage.STRINGS_FILE));
    this.nodeCache = Caffeine.newBuilder().maximumSize(configuration.nodeCacheSize).build();
    this.searchIndex = new SearchIndex(this);
    this.overlayPaths.defaultReturnValue(Fixed.NULL_NODE_ID.getStandardProperty());
    this.descriptor = StoreDescriptor.empty();
  }

  /**
   * Open a store, loading the indexes of a previous bulk load and replaying later single-row
   * inserts into the overlay.
   *
   * @param storage the backend, owned by the store from now on
   * @param configuration the configuration
   * @return the store
   */
  public static TableNodeStore open(final IOStorage storage, final ArborConfiguration configuration) {
    final TableNodeStore store = new TableNodeStore(storage, configuration);
    try {
      store.load();
    } catch (final RuntimeException e) {
      store.close();
      throw e;
    }
    return store;
  }

  private void load() {
    final Optional<StoreDescriptor> stored = StoreDescriptor.read(storage);
    if (stored.isPresent() && stored.get().getFormatVersion() != StoreDescriptor.FORMAT_VERSION) {
      LOGWRAPPER.warn("Dropping store of format version {}.", stored.get().getFormatVersion());
      storage.clear();
    } else if (stored.isPresent()) {
      descriptor = stored.get();
    }

    final long rows = table.rowCount();
    final long baseRows = descriptor.getBaseRowCount();
    if (baseRows > rows) {
      throw new ArborIOException("Store descriptor covers " + baseRows + " rows, but the table holds " + rows);
    }
    if (baseRows > 0) {
      baseChildren = ChildIndex.load(storage, (int) baseRows);
      basePaths = PathIndex.open(storage, baseRows);
      searchIndex.load(storage);
    }
    rowCount = baseRows;
    for (long id = baseRows; id < rows; id++) {
      final NodeRow row = table.read(id);
      addToOverlay(id, row.parentId, row.rank, heap.read(row.pathRef));
      rowCount = id + 1;
    }
    if (rows > baseRows) {
      LOGWRAPPER.debug("Replayed {} single-row inserts.", rows - baseRows);
    }
  }

  @Override
  public long insertNode(final long parentId, final String key, final NodeKind kind, final @Nullable String value,
      final int rank) {
    requireNonNull(key);
    requireNonNull(kind);
    checkArgument(kind != NodeKind.BUCKET, "Bucket nodes are never stored.");
    checkArgument(kind.isContainer() == (value == null), "Containers carry no value and scalars need one.");
    checkReadable();

    if (rank < 0) {
      throw new ConstraintViolationException("Negative rank %d.", rank);
    }
    final boolean root = parentId == Fixed.NULL_NODE_ID.getStandardProperty();
    final Node parent = root ? null : findNode(parentId).orElseThrow(
        () -> new ConstraintViolationException("Unknown parent %d.", parentId));
    if (parent != null && !parent.getKind().isContainer()) {
      throw new ConstraintViolationException("The parent %d is a %s and cannot have children.", parentId,
          parent.getKind().getName());
    }

    final Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      final String path;
      if (parent == null) {
        if (rowCount != 0) {
          throw new ConstraintViolationException("The store already has a root.");
        }
        if (rank != 0) {
          throw new ConstraintViolationException("The root has rank 0, not %d.", rank);
        }
        path = Fixed.ROOT_PATH;
      } else {
        final long nextRank = baseChildren.childCount(parentId) + overlaySize(parentId);
        if (rank != nextRank) {
          throw new ConstraintViolationException("The next rank under the parent %d is %d, not %d.", parentId,
              nextRank, rank);
        }
        path = NodePaths.childPath(parent.getPath(), parent.getKind(), key);
      }

      final long[] refs = heap.appendRow(key, value, path);
      final long id = table.append(parentId, rank, kind, refs[0], refs[1], refs[2]);
      if (id != rowCount) {
        throw new ArborIOException("Node table out of sync: expected row " + rowCount + " but wrote " + id);
      }
      addToOverlay(id, parentId, rank, path);
      rowCount = id + 1;
      return id;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Overlay children of a parent. The caller holds a lock.
   */
  private int overlaySize(final long parentId) {
    final Int2LongSortedMap children = overlayChildren.get(parentId);
    return children == null ? 0 : children.size();
  }

  private void addToOverlay(final long id, final long parentId, final int rank, final String path) {
    if (parentId != Fixed.NULL_NODE_ID.getStandardProperty()) {
      overlayChildren.computeIfAbsent(parentId, unused -> new Int2LongAVLTreeMap()).put(rank, id);
    }
    overlayPaths.putIfAbsent(path, id);
    searchIndex.addPending(id);
  }

  @Override
  public Node getNode(final long id) {
    return findNode(id).orElseThrow(() -> NodeNotFoundException.forId(id));
  }

  @Override
  public Optional<Node> findNode(final long id) {
    checkReadable();
    if (id < 0 || id >= rowCount) {
      return Optional.empty();
    }
    final Node stored = nodeCache.get(id, this::loadNode);
    final int overlayCount = overlayChildCount(id);
    return Optional.of(overlayCount == 0 ? stored : stored.withChildCount(stored.getChildCount() + overlayCount));
  }

  /**
   * Load a node with the child count of the bulk loaded base, which never changes.
   */
  private Node loadNode(final long id) {
    final NodeRow row = table.read(id);
    final String[] strings = heap.readRow(row);
    return new Node(id, row.parentId, strings[0], row.kind, strings[1], row.rank, strings[2],
        baseChildren.childCount(id));
  }

  private String storedPath(final long id) {
    final Node cached = nodeCache.getIfPresent(id);
    if (cached != null) {
      return cached.getPath();
    }
    return heap.read(table.read(id).pathRef);
  }

  @Override
  public Node getByPath(final String path) {
    return findByPath(path).orElseThrow(() -> NodeNotFoundException.forPath(path));
  }

  @Override
  public Optional<Node> findByPath(final String path) {
    requireNonNull(path);
    checkReadable();
    long id = basePaths.find(path, this::storedPath);
    if (id < 0) {
      final Lock readLock = lock.readLock();
      readLock.lock();
      try {
        id = overlayPaths.getLong(path);
      } finally {
        readLock.unlock();
      }
    }
    return id < 0 ? Optional.empty() : findNode(id);
  }

  @Override
  public List<Node> getChildren(final long parentId, final long offset, final int limit) {
    checkArgument(offset >= 0, "offset must be >= 0");
    checkArgument(limit >= 0, "limit must be >= 0");
    checkReadable();
    requireExists(parentId);

    final long[] ids;
    final Lock readLock = lock.readLock();
    readLock.lock();
    try {
      ids = childIds(parentId, offset, limit);
    } finally {
      readLock.unlock();
    }
    final List<Node> children = new ArrayList<>(ids.length);
    for (final long id : ids) {
      children.add(getNode(id));
    }
    return children;
  }

  /**
   * Ids of a window of children: the bulk loaded children first, then the overlay by rank.
   */
  private long[] childIds(final long parentId, final long offset, final int limit) {
    final int baseCount = baseChildren.childCount(parentId);
    final Int2LongSortedMap overlay = overlayChildren.get(parentId);
    final long total = baseCount + (overlay == null ? 0 : overlay.size());
    final long end = Math.min(total, offset + limit);
    if (offset >= end) {
      return new long[0];
    }
    final long[] ids = new long[(int) (end - offset)];
    int next = 0;
    if (offset < baseCount) {
      final int count = (int) (Math.min(end, baseCount) - offset);
      System.arraycopy(baseChildren.window(parentId, (int) offset, count), 0, ids, 0, count);
      next = count;
    }
    if (next < ids.length) {
      final LongIterator overlayIds = overlay.values().iterator();
      overlayIds.skip((int) Math.max(0, offset - baseCount));
      while (next < ids.length) {
        ids[next++] = overlayIds.nextLong();
      }
    }
    return ids;
  }

  @Override
  public Optional<Node> getChildByRank(final long parentId, final long rank) {
    checkReadable();
    requireExists(parentId);
    if (rank < 0 || rank > Integer.MAX_VALUE) {
      return Optional.empty();
    }
    final long id;
    final Lock readLock = lock.readLock();
    readLock.lock();
    try {
      if (rank < baseChildren.childCount(parentId)) {
        id = baseChildren.childAt(parentId, (int) rank);
      } else {
        final Int2LongSortedMap overlay = overlayChildren.get(parentId);
        id = overlay == null || !overlay.containsKey((int) rank) ? -1 : overlay.get((int) rank);
      }
    } finally {
      readLock.unlock();
    }
    return id < 0 ? Optional.empty() : findNode(id);
  }

  @Override
  public long getChildCount(final long id) {
    checkReadable();
    requireExists(id);
    return childCount(id);
  }

  private long childCount(final long id) {
    return baseChildren.childCount(id) + overlayChildCount(id);
  }

  private int overlayChildCount(final long id) {
    final Lock readLock = lock.readLock();
    readLock.lock();
    try {
      final Int2LongSortedMap overlay = overlayChildren.get(id);
      return overlay == null ? 0 : overlay.size();
    } finally {
      readLock.unlock();
    }
  }

  private void requireExists(final long id) {
    if (id < 0 || id >= rowCount) {
      throw NodeNotFoundException.forId(id);
    }
  }

  @Override
  public long size() {
    return rowCount;
  }

  @Override
  public NodeStoreWriter beginBulkLoad() {
    return beginBulkLoad(batchSize);
  }

  @Override
  public NodeStoreWriter beginBulkLoad(final int batchSize) {
    checkArgument(batchSize > 0, "batchSize must be > 0");
    checkOpen();
    final Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      checkState(!bulkLoading, "A bulk load is already open.");
      checkState(rowCount == 0 && table.rowCount() == 0, "Bulk loads need an empty store.");
      bulkLoading = true;
      LOGWRAPPER.debug("Bulk load started with batch size {}.", batchSize);
      return new BulkLoadWriter(this, table, heap, batchSize);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Build the indexes over the rows of the open bulk load and open the store for readers.
   */
  void completeBulkLoad(final long rows) {
    final Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      checkState(bulkLoading, "No bulk load is open.");
      final StoreIndexBuilder.Result result = new StoreIndexBuilder(storage, table, heap, rows).build();
      table.file().force();
      heap.file().force();
      baseChildren = result.children;
      basePaths = PathIndex.open(storage, rows);
      searchIndex.load(storage);
      rowCount = rows;
      descriptor = new StoreDescriptor(StoreDescriptor.FORMAT_VERSION, rows, rows, result.preorder, -1, -1, false);
      descriptor.write(storage);
      nodeCache.invalidateAll();
      bulkLoading = false;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Drop everything written by the open bulk load.
   */
  void abortBulkLoad() {
    LOGWRAPPER.warn("Bulk load aborted, discarding {} rows.", table.rowCount());
    discard();
  }

  @Override
  public SearchIndex searchIndex() {
    return searchIndex;
  }

  @Override
  public StoreDescriptor getDescriptor() {
    return descriptor;
  }

  @Override
  public void updateDescriptor(final StoreDescriptor newDescriptor) {
    requireNonNull(newDescriptor);
    checkOpen();
    descriptor = newDescriptor;
    newDescriptor.write(storage);
  }

  @Override
  public void sync() {
    checkOpen();
    table.file().force();
    heap.file().force();
    descriptor = descriptor.withNodeCount(rowCount);
    descriptor.write(storage);
  }

  @Override
  public void discard() {
    checkOpen();
    final Lock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      storage.clear();
      overlayChildren.clear();
      overlayPaths.clear();
      baseChildren = ChildIndex.empty();
      basePaths = PathIndex.empty();
      searchIndex.reset();
      nodeCache.invalidateAll();
      descriptor = StoreDescriptor.empty();
      rowCount = 0;
      bulkLoading = false;
    } finally {
      writeLock.unlock();
    }
  }

  private void checkOpen() {
    checkState(!closed, "The node store is closed.");
  }

  private void checkReadable() {
    checkOpen();
    checkState(!bulkLoading, "The node store is being bulk loaded.");
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    nodeCache.invalidateAll();
    storage.close();
  }
}
