package io.arbor.access;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.arbor.index.bucket.BucketingEngine;
import io.arbor.service.ingest.IngestionResult;
import io.arbor.service.navigate.Navigator;
import io.arbor.service.path.PathResolver;
import io.arbor.service.search.SearchEngine;
import io.arbor.store.NodeStore;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * One opened document: the store and the services on top of it. Closing the session cancels the
 * running search, stops the search thread and closes the store.
 */
public final class DocumentSession implements AutoCloseable {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(DocumentSession.class));

  private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

  private final NodeStore store;

  private final ArborConfiguration configuration;

  private final BucketingEngine bucketingEngine;

  private final Navigator navigator;

  private final PathResolver pathResolver;

  private final ExecutorService searchExecutor;

  private final SearchEngine searchEngine;

  private final @Nullable IngestionResult ingestionResult;

  private boolean closed;

  /**
   * Constructor.
   *
   * @param store the loaded store, owned by the session from now on
   * @param configuration the configuration
   * @param ingestionResult result of the ingestion that built the store, {@code null} if an
   *        existing store was reused
   */
  public DocumentSession(final NodeStore store, final ArborConfiguration configuration,
      final @Nullable IngestionResult ingestionResult) {
    this.store = requireNonNull(store);
    this.configuration = requireNonNull(configuration);
    this.ingestionResult = ingestionResult;
    bucketingEngine = new BucketingEngine(configuration.bucketThreshold);
    navigator = new Navigator(store, bucketingEngine, configuration.previewLength);
    pathResolver = new PathResolver(store, navigator);
    searchExecutor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setDaemon(true)
                                                                                 .setNameFormat("arbor-search-%d")
                                                                                 .build());
    searchEngine = new SearchEngine(store, pathResolver, navigator, searchExecutor, configuration.searchChunkSize);
  }

  public NodeStore getStore() {
    return store;
  }

  public ArborConfiguration getConfiguration() {
    return configuration;
  }

  public BucketingEngine getBucketingEngine() {
    return bucketingEngine;
  }

  public Navigator getNavigator() {
    return navigator;
  }

  public PathResolver getPathResolver() {
    return pathResolver;
  }

  public SearchEngine getSearchEngine() {
    return searchEngine;
  }

  /**
   * Result of the ingestion that built the store.
   *
   * @return the result, empty if the store was reused from the cache
   */
  public Optional<IngestionResult> getIngestionResult() {
    return Optional.ofNullable(ingestionResult);
  }

  public boolean isReused() {
    return ingestionResult == null;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    searchEngine.close();
    searchExecutor.shutdownNow();
    try {
      if (!searchExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOGWRAPPER.warn("Search thread did not stop within {} s.", SHUTDOWN_TIMEOUT_SECONDS);
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    store.close();
  }
}
