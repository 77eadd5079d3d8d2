package io.arbor.service.ingest;

/**
 * Observer of a running ingestion. All callbacks run on the ingesting thread.
 */
public interface IngestionListener {

  /** Listener ignoring everything. */
  IngestionListener NONE = new IngestionListener() {
  };

  /**
   * Bytes of the source consumed so far.
   *
   * @param bytesRead bytes read
   * @param totalBytes size of the source, {@code -1} if unknown
   */
  default void onProgress(final long bytesRead, final long totalBytes) {
  }

  /**
   * Another batch of rows has been written.
   *
   * @param rowsWritten rows written so far
   */
  default void onFlush(final long rowsWritten) {
  }

  /**
   * The ingestion finished successfully.
   *
   * @param result the result
   */
  default void onComplete(final IngestionResult result) {
  }
}
