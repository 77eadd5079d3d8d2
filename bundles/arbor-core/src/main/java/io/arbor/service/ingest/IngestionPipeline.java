package io.arbor.service.ingest;

import io.arbor.access.ArborConfiguration;
import io.arbor.exception.DocumentParseException;
import io.arbor.node.NodeKind;
import io.arbor.node.NodePaths;
import io.arbor.node.NodeValues;
import io.arbor.settings.Fixed;
import io.arbor.store.NodeStore;
import io.arbor.store.NodeStoreWriter;
import io.arbor.utils.LogWrapper;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Turns a {@link TokenSource} into the rows of an empty {@link NodeStore}.
 *
 * <p>A stack of open containers assigns ids, ranks and paths in one pass, so rows come out in
 * document order with every parent before its children. With {@link IndexingStrategy#DEFERRED}
 * the rows go through a bulk load and all indexes are built once at the end; with
 * {@link IndexingStrategy#PER_ROW} every row is a single-row insert.
 *
 * <p>Ingestion is all or nothing: on any failure everything written so far is discarded and the
 * store is left empty.
 */
public final class IngestionPipeline implements Callable<IngestionResult> {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(IngestionPipeline.class));

  private final NodeStore store;

  private final TokenSource source;

  private final IndexingStrategy strategy;

  private final int batchSize;

  private final IngestionListener listener;

  private IngestionPipeline(final Builder builder) {
    store = builder.store;
    source = builder.source;
    strategy = builder.strategy;
    batchSize = builder.batchSize;
    listener = builder.listener;
  }

  /**
   * Create a builder.
   *
   * @param store the empty target store
   * @param source the token source, closed by the pipeline
   * @return the builder
   */
  public static Builder newBuilder(final NodeStore store, final TokenSource source) {
    return new Builder(store, source);
  }

  /**
   * An open container.
   */
  private static final class Frame {
    final long id;

    final NodeKind kind;

    final String path;

    int nextRank;

    @Nullable String pendingKey;

    Frame(final long id, final NodeKind kind, final String path) {
      this.id = id;
      this.kind = kind;
      this.path = path;
    }
  }

  /**
   * Where rows go.
   */
  @FunctionalInterface
  private interface RowSink {
    long write(long parentId, String key, NodeKind kind, @Nullable String value, int rank, String path);
  }

  /**
   * Consume the source.
   *
   * @return the result
   * @throws DocumentParseException if the token stream is malformed; the store is empty afterwards
   */
  @Override
  public IngestionResult call() {
    checkState(store.size() == 0, "Ingestion needs an empty store.");
    final long start = System.nanoTime();
    LOGWRAPPER.info("Ingesting with the {} strategy.", strategy);

    final IngestionResult result;
    try (source) {
      result = strategy == IndexingStrategy.DEFERRED ? ingestDeferred(start) : ingestPerRow(start);
    }

    if (result.getSanitizedCount() > 0) {
      LOGWRAPPER.warn("Replaced {} unsupported numeric values with '{}'.", result.getSanitizedCount(),
          NodeValues.UNSUPPORTED_NUMERIC);
    }
    LOGWRAPPER.info("Ingested {} nodes done [{} ms]", result.getNodeCount(), result.getElapsed().toMillis());
    listener.onComplete(result);
    return result;
  }

  private IngestionResult ingestDeferred(final long start) {
    final NodeStoreWriter writer = store.beginBulkLoad(batchSize);
    try {
      final long[] counts = consume(writer::append);
      writer.commit();
      reportLastFlush(counts[0]);
      return new IngestionResult(counts[0], counts[1], Duration.ofNanos(System.nanoTime() - start), strategy);
    } catch (final RuntimeException e) {
      writer.abort();
      throw e;
    }
  }

  private IngestionResult ingestPerRow(final long start) {
    try {
      final long[] counts = consume((parentId, key, kind, value, rank, path) ->
          store.insertNode(parentId, key, kind, value, rank));
      store.sync();
      reportLastFlush(counts[0]);
      return new IngestionResult(counts[0], counts[1], Duration.ofNanos(System.nanoTime() - start), strategy);
    } catch (final RuntimeException e) {
      LOGWRAPPER.warn("Ingestion failed, discarding {} rows.", store.size());
      store.discard();
      throw e;
    }
  }

  /**
   * Read all tokens and write the rows.
   *
   * @return the number of rows and the number of sanitized values
   */
  private long[] consume(final RowSink sink) {
    final ObjectArrayList<Frame> stack = new ObjectArrayList<>();
    boolean rootSeen = false;
    long rows = 0;
    long sanitized = 0;

    Token token;
    while ((token = source.next()) != null) {
      switch (token.getType()) {
        case KEY -> {
          if (stack.isEmpty() || stack.top().kind != NodeKind.OBJECT) {
            throw parseError("Key '" + token.getText() + "' outside of an object");
          }
          final Frame top = stack.top();
          if (top.pendingKey != null) {
            throw parseError("Key '" + token.getText() + "' follows the key '" + top.pendingKey + "'");
          }
          top.pendingKey = token.getText();
        }
        case CONTAINER_END -> {
          if (stack.isEmpty()) {
            throw parseError("Unbalanced end of " + token.getKind().getName());
          }
          final Frame top = stack.pop();
          if (top.kind != token.getKind()) {
            throw parseError("End of " + token.getKind().getName() + " closes " + top.kind.getName() + " " + top.path);
          }
          if (top.pendingKey != null) {
            throw parseError("Key '" + top.pendingKey + "' has no value");
          }
        }
        case CONTAINER_START, SCALAR -> {
          final NodeKind kind = requireNonNull(token.getKind());
          final long parentId;
          final String key;
          final int rank;
          final String path;
          if (stack.isEmpty()) {
            if (rootSeen) {
              throw parseError("More than one root value");
            }
            parentId = Fixed.NULL_NODE_ID.getStandardProperty();
            key = Fixed.ROOT_KEY;
            rank = 0;
            path = Fixed.ROOT_PATH;
          } else {
            final Frame top = stack.top();
            if (top.kind == NodeKind.OBJECT) {
              if (top.pendingKey == null) {
                throw parseError("Value without a key in " + top.path);
              }
              key = top.pendingKey;
              top.pendingKey = null;
            } else {
              key = Integer.toString(top.nextRank);
            }
            parentId = top.id;
            rank = top.nextRank++;
            path = NodePaths.childPath(top.path, top.kind, key);
          }

          String value = null;
          if (token.getType() == TokenType.SCALAR) {
            value = NodeValues.sanitize(kind, requireNonNull(token.getText()));
            if (NodeValues.isSanitized(value)) {
              sanitized++;
              LOGWRAPPER.debug("Unsupported numeric value {} at {}", token.getText(), path);
            }
          }
          final long id = sink.write(parentId, key, kind, value, rank, path);
          rootSeen = true;
          if (kind.isContainer()) {
            stack.push(new Frame(id, kind, path));
          }
          if (++rows % batchSize == 0) {
            listener.onFlush(rows);
          }
        }
        default -> throw new AssertionError(token.getType());
      }
    }

    if (!stack.isEmpty()) {
      throw parseError("Unexpected end of input, " + stack.size() + " containers are still open");
    }
    if (!rootSeen) {
      throw parseError("The document is empty");
    }
    return new long[] { rows, sanitized };
  }

  /**
   * Report the rows of the last, partial batch once they are written.
   */
  private void reportLastFlush(final long rows) {
    if (rows % batchSize != 0) {
      listener.onFlush(rows);
    }
  }

  private DocumentParseException parseError(final String message) {
    final SourceLocation location = source.location();
    return new DocumentParseException(message, location.getOffset(), location.getLine(), location.getColumn());
  }

  /**
   * Builder of an {@link IngestionPipeline}.
   */
  public static final class Builder {

    private final NodeStore store;

    private final TokenSource source;

    private IndexingStrategy strategy = IndexingStrategy.DEFERRED;

    private int batchSize = ArborConfiguration.DEFAULT_BATCH_SIZE;

    private IngestionListener listener = IngestionListener.NONE;

    private Builder(final NodeStore store, final TokenSource source) {
      this.store = requireNonNull(store);
      this.source = requireNonNull(source);
    }

    public Builder strategy(final IndexingStrategy strategy) {
      this.strategy = requireNonNull(strategy);
      return this;
    }

    /**
     * Rows the bulk load writer buffers between two writes to the storage. Every write is
     * reported through {@link IngestionListener#onFlush(long)}; the per-row strategy reports at
     * the same row counts.
     *
     * @param batchSize the number of rows
     * @return this builder
     */
    public Builder batchSize(final int batchSize) {
      checkArgument(batchSize > 0, "batchSize must be > 0");
      this.batchSize = batchSize;
      return this;
    }

    public Builder listener(final IngestionListener listener) {
      this.listener = requireNonNull(listener);
      return this;
    }

    /**
     * Take strategy and batch size from a configuration.
     *
     * @param configuration the configuration
     * @return this builder
     */
    public Builder configuration(final ArborConfiguration configuration) {
      return strategy(configuration.indexingStrategy).batchSize(configuration.batchSize);
    }

    public IngestionPipeline build() {
      return new IngestionPipeline(this);
    }
  }
}
