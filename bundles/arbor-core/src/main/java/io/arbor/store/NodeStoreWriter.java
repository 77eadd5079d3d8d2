package io.arbor.store;

import io.arbor.exception.ConstraintViolationException;
import io.arbor.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Single writer of a bulk load. Rows are buffered and written in batches; no index is maintained
 * until {@link #commit()} builds all of them in one pass.
 *
 * <p>Ids are assigned in append order, starting with {@code 0} for the root. Parents must be
 * appended before their children and the ranks of the children of one parent must be exactly
 * {@code 0 ... childCount - 1}.
 */
public interface NodeStoreWriter extends AutoCloseable {

  /**
   * Append a row.
   *
   * @param parentId id of the parent, {@code -1} for the root
   * @param key the key
   * @param kind the kind
   * @param value serialized scalar, {@code null} for containers
   * @param rank position among the siblings
   * @param path materialized path of the node
   * @return the id of the row
   */
  long append(long parentId, String key, NodeKind kind, @Nullable String value, int rank, String path);

  /**
   * Number of rows appended so far.
   *
   * @return the row count
   */
  long rowCount();

  /**
   * Write the remaining rows, build the parent/rank index, the child counts, the path index and
   * the search index, and open the store for readers.
   *
   * @throws ConstraintViolationException if the rows break the tree invariants; the load is
   *         aborted in this case
   */
  void commit();

  /**
   * Drop everything written by this writer.
   */
  void abort();

  /**
   * Aborts the load unless it was committed.
   */
  @Override
  void close();
}
