package io.arbor.service.ingest;

/**
 * Kinds of tokens of the ingestion stream.
 */
public enum TokenType {
  /** Start of an object or array. */
  CONTAINER_START,

  /** End of the innermost open container. */
  CONTAINER_END,

  /** Key of the next object member. */
  KEY,

  /** A scalar value. */
  SCALAR
}
