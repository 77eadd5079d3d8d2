package io.arbor.store;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import io.arbor.exception.ConstraintViolationException;
import io.arbor.node.NodeKind;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * {@link NodeStoreWriter} of a {@link TableNodeStore}. Rows and their strings are encoded into two
 * buffers which are appended to the node table and the string heap every {@code batchSize} rows.
 */
final class BulkLoadWriter implements NodeStoreWriter {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(BulkLoadWriter.class));

  private final TableNodeStore store;

  private final NodeTable table;

  private final StringHeap heap;

  private final int batchSize;

  private ByteArrayDataOutput rows;

  private ByteArrayDataOutput strings;

  private int bufferedRows;

  private long rowCount;

  /** Heap position of the next string. */
  private long heapPosition;

  private boolean finished;

  BulkLoadWriter(final TableNodeStore store, final NodeTable table, final StringHeap heap, final int batchSize) {
    checkArgument(batchSize > 0, "batchSize must be > 0");
    this.store = requireNonNull(store);
    this.table = requireNonNull(table);
    this.heap = requireNonNull(heap);
    this.batchSize = batchSize;
    this.heapPosition = heap.size();
    this.rowCount = table.rowCount();
    newBuffers();
  }

  private void newBuffers() {
    rows = ByteStreams.newDataOutput(batchSize * NodeTable.ROW_SIZE);
    strings = ByteStreams.newDataOutput();
    bufferedRows = 0;
  }

  @Override
  public long append(final long parentId, final String key, final NodeKind kind, final @Nullable String value,
      final int rank, final String path) {
    checkState(!finished, "The bulk load is already finished.");
    requireNonNull(key);
    requireNonNull(kind);
    requireNonNull(path);
    if (kind.isContainer() == (value != null)) {
      throw new ConstraintViolationException("Containers carry no value and scalars need one: %s %s", kind, key);
    }

    final long keyRef = heapPosition;
    heapPosition += StringHeap.encode(strings, key);
    long valueRef = NodeRow.NO_REF;
    if (value != null) {
      valueRef = heapPosition;
      heapPosition += StringHeap.encode(strings, value);
    }
    final long pathRef = heapPosition;
    heapPosition += StringHeap.encode(strings, path);
    NodeTable.encode(rows, parentId, rank, kind, keyRef, valueRef, pathRef);

    final long id = rowCount++;
    if (++bufferedRows == batchSize) {
      flush();
    }
    return id;
  }

  @Override
  public long rowCount() {
    return rowCount;
  }

  private void flush() {
    if (bufferedRows == 0) {
      return;
    }
    heap.file().append(ByteBuffer.wrap(strings.toByteArray()));
    table.file().append(ByteBuffer.wrap(rows.toByteArray()));
    LOGWRAPPER.debug("Flushed {} rows, {} rows written.", bufferedRows, rowCount);
    newBuffers();
  }

  @Override
  public void commit() {
    checkState(!finished, "The bulk load is already finished.");
    try {
      flush();
      store.completeBulkLoad(rowCount);
      finished = true;
    } catch (final RuntimeException e) {
      abort();
      throw e;
    }
  }

  @Override
  public void abort() {
    if (finished) {
      return;
    }
    finished = true;
    newBuffers();
    store.abortBulkLoad();
  }

  @Override
  public void close() {
    abort();
  }
}
