package io.arbor.store;

import io.arbor.exception.ConstraintViolationException;
import io.arbor.exception.NodeNotFoundException;
import io.arbor.index.search.SearchIndex;
import io.arbor.node.Node;
import io.arbor.node.NodeKind;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Persistent, ordered store of the nodes of one document.
 *
 * <p>A store is written once, either through a bulk load ({@link #beginBulkLoad()}) or row by row
 * ({@link #insertNode}), and read by any number of threads afterwards. While a bulk load is open
 * every read fails with an {@link IllegalStateException}, so no reader observes a partial tree.
 */
public interface NodeStore extends AutoCloseable {

  /**
   * Insert a single node and update all indexes, including the search index, before returning.
   * The materialized path is derived from the parent.
   *
   * @param parentId id of the parent, {@code -1} for the root
   * @param key the key ({@code "root"} for the root, the decimal index for array elements)
   * @param kind the kind, never {@link NodeKind#BUCKET}
   * @param value the serialized scalar, {@code null} for containers
   * @param rank position among the siblings, which has to be the current child count of the
   *        parent ({@code 0} for the root), so siblings are appended in order without gaps
   * @return the id of the new node
   * @throws ConstraintViolationException if the parent does not exist or is no container, if the
   *         rank is not the next one under the parent, or if a second root is inserted
   */
  long insertNode(long parentId, String key, NodeKind kind, @Nullable String value, int rank);

  /**
   * Get a node.
   *
   * @param id the id
   * @return the node
   * @throws NodeNotFoundException if no node has this id
   */
  Node getNode(long id);

  Optional<Node> findNode(long id);

  /**
   * Get the node with a materialized path. If several nodes share a path (duplicate object keys),
   * the first one in document order is returned.
   *
   * @param path the exact materialized path
   * @return the node
   * @throws NodeNotFoundException if no node has this path
   */
  Node getByPath(String path);

  Optional<Node> findByPath(String path);

  /**
   * Window of the children of a node, ordered by rank. Only the rows of the window are read.
   *
   * @param parentId the parent
   * @param offset position of the first child
   * @param limit maximum number of children
   * @return the children, empty for leaves or windows past the end
   * @throws NodeNotFoundException if the parent does not exist
   */
  List<Node> getChildren(long parentId, long offset, int limit);

  Optional<Node> getChildByRank(long parentId, long rank);

  /**
   * Number of children of a node.
   *
   * @param id the node
   * @return the child count
   * @throws NodeNotFoundException if the node does not exist
   */
  long getChildCount(long id);

  /**
   * Number of nodes.
   *
   * @return the node count
   */
  long size();

  /**
   * Start a bulk load into this store, which must be empty. Until the writer is committed or
   * aborted, all reads and single-row inserts are rejected.
   *
   * @return the writer
   * @throws IllegalStateException if the store is not empty or a bulk load is already open
   */
  NodeStoreWriter beginBulkLoad();

  /**
   * Start a bulk load whose writer flushes every {@code batchSize} rows.
   *
   * @param batchSize rows buffered between two writes to the storage
   * @return the writer
   * @throws IllegalStateException if the store is not empty or a bulk load is already open
   */
  NodeStoreWriter beginBulkLoad(int batchSize);

  /**
   * The search index over all rows of this store.
   *
   * @return the search index
   */
  SearchIndex searchIndex();

  /**
   * Current descriptor.
   *
   * @return the descriptor
   */
  StoreDescriptor getDescriptor();

  /**
   * Replace the source fields and completeness flag of the descriptor.
   *
   * @param descriptor the new descriptor
   */
  void updateDescriptor(StoreDescriptor descriptor);

  /**
   * Flush all written rows to the backend and persist the descriptor.
   */
  void sync();

  /**
   * Drop all rows and indexes. The store is empty afterwards.
   */
  void discard();

  @Override
  void close();
}
