package io.arbor.settings;

/**
 * Fixed values shared by the store and its readers.
 */
public enum Fixed {

  /** Parent id of the root, and "no node" in general. */
  NULL_NODE_ID(-1L),

  /** Id of the root of every ingested document. */
  ROOT_NODE_ID(0L),

  /** Largest id handed out to bucket nodes; bucket ids count downwards from here. */
  FIRST_BUCKET_ID(-2L);

  private final long standardProperty;

  Fixed(final long standardProperty) {
    this.standardProperty = standardProperty;
  }

  public long getStandardProperty() {
    return standardProperty;
  }

  /** Key of the root node. */
  public static final String ROOT_KEY = "root";

  /** Materialized path of the root node. */
  public static final String ROOT_PATH = ".";
}
