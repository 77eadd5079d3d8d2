package io.arbor.service.ingest;

/**
 * How the ingestion pipeline maintains the secondary indexes while it writes rows.
 */
public enum IndexingStrategy {

  /**
   * Bulk load: rows are buffered and flushed in batches with all indexes suspended; the indexes
   * and the search index are built in one pass once the stream is consumed.
   */
  DEFERRED,

  /**
   * Every row goes through the single-row insert path, updating all indexes immediately. Slow,
   * kept as the reference the deferred build is checked against.
   */
  PER_ROW
}
