package io.arbor.service.ingest;

import com.google.common.base.MoreObjects;

import java.time.Duration;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a successful ingestion.
 */
public final class IngestionResult {

  private final long nodeCount;

  private final long sanitizedCount;

  private final Duration elapsed;

  private final IndexingStrategy strategy;

  public IngestionResult(final long nodeCount, final long sanitizedCount, final Duration elapsed,
      final IndexingStrategy strategy) {
    this.nodeCount = nodeCount;
    this.sanitizedCount = sanitizedCount;
    this.elapsed = requireNonNull(elapsed);
    this.strategy = requireNonNull(strategy);
  }

  public long getNodeCount() {
    return nodeCount;
  }

  /**
   * Number of numeric values replaced because the store cannot represent them.
   *
   * @return the count
   */
  public long getSanitizedCount() {
    return sanitizedCount;
  }

  public Duration getElapsed() {
    return elapsed;
  }

  public IndexingStrategy getStrategy() {
    return strategy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("nodeCount", nodeCount)
                      .add("sanitizedCount", sanitizedCount)
                      .add("elapsed", elapsed)
                      .add("strategy", strategy)
                      .toString();
  }
}
