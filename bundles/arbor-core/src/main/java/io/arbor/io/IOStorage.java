package io.arbor.io;

import io.arbor.exception.ArborIOException;

/**
 * Backend holding the named files of one node store.
 */
public interface IOStorage extends AutoCloseable {

  /** Fixed-width node rows. */
  String NODES_FILE = "nodes.tbl";

  /** Length-prefixed UTF-8 strings referenced by node rows. */
  String STRINGS_FILE = "strings.heap";

  /** Child ids ordered by parent and rank. */
  String CHILDREN_FILE = "children.idx";

  /** Per-parent start offsets into {@link #CHILDREN_FILE}. */
  String CHILD_OFFSETS_FILE = "offsets.idx";

  /** Path hashes and ids, sorted by hash. */
  String PATHS_FILE = "paths.idx";

  /** Serialized posting lists of the search index. */
  String POSTINGS_FILE = "search.postings";

  /** Token dictionary of the search index. */
  String DICTIONARY_FILE = "search.dict";

  /** JSON descriptor of the store. */
  String DESCRIPTOR_FILE = "store.json";

  /**
   * Open a file, creating it if it does not exist.
   *
   * @param name the file name
   * @return the file
   * @throws ArborIOException if the file cannot be opened
   */
  StorageFile file(String name);

  /**
   * Whether a file exists and holds data.
   *
   * @param name the file name
   * @return {@code true} if the file exists and is not empty
   */
  boolean exists(String name);

  /**
   * Drop the content of every file.
   */
  void clear();

  /**
   * The kind of this backend.
   *
   * @return the storage type
   */
  StorageType getType();

  /**
   * Closing this storage.
   *
   * @throws ArborIOException if an I/O error occurs
   */
  @Override
  void close();
}
