package io.arbor.access;

import io.arbor.exception.ArborException;
import io.arbor.exception.ArborIOException;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageType;
import io.arbor.service.ingest.IngestionListener;
import io.arbor.service.ingest.IngestionPipeline;
import io.arbor.service.ingest.IngestionResult;
import io.arbor.service.ingest.JacksonTokenSource;
import io.arbor.service.ingest.ProgressInputStream;
import io.arbor.service.ingest.TokenSource;
import io.arbor.service.ingest.YamlTokenSource;
import io.arbor.store.StoreDescriptor;
import io.arbor.store.TableNodeStore;
import io.arbor.utils.ArborFiles;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Opens documents, reusing the cached store of a source that has not changed since it was
 * ingested and rebuilding it otherwise.
 *
 * <p>A cached store is reused only if its descriptor is marked complete and records the current
 * size and modification time of the source. A failed ingestion removes the store directory, so a
 * half-built store is never picked up later.
 */
public final class DocumentLoader {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(DocumentLoader.class));

  /** Supported source formats, chosen by file extension. */
  public enum SourceFormat {
    JSON,

    YAML;

    /**
     * Format of a source file: YAML for {@code .yaml} and {@code .yml}, JSON otherwise.
     *
     * @param source the source
     * @return the format
     */
    public static SourceFormat of(final Path source) {
      final Path fileName = source.getFileName();
      final String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
      return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
    }
  }

  private final StoreLocator locator;

  private final ArborConfiguration configuration;

  public DocumentLoader(final StoreLocator locator, final ArborConfiguration configuration) {
    this.locator = requireNonNull(locator);
    this.configuration = requireNonNull(configuration);
  }

  /**
   * Loader using the user configuration and the platform cache directory.
   *
   * @return the loader
   */
  public static DocumentLoader platform() {
    return new DocumentLoader(StoreLocator.platform(), ArborConfiguration.load());
  }

  public StoreLocator getLocator() {
    return locator;
  }

  public DocumentSession open(final Path source, final boolean forceRebuild) {
    return open(source, forceRebuild, IngestionListener.NONE);
  }

  /**
   * Open a document.
   *
   * @param source the JSON or YAML source
   * @param forceRebuild rebuild the store even if the cached one is up to date
   * @param listener observer of the ingestion, if one runs
   * @return the session
   * @throws ArborIOException if the source cannot be read
   * @throws io.arbor.exception.DocumentParseException if the source is malformed
   */
  public DocumentSession open(final Path source, final boolean forceRebuild, final IngestionListener listener) {
    requireNonNull(source);
    requireNonNull(listener);
    final long size;
    final long modified;
    try {
      size = Files.size(source);
      modified = Files.getLastModifiedTime(source).toMillis();
    } catch (final IOException e) {
      throw new ArborIOException("Cannot read " + source, e);
    }

    if (configuration.storageType == StorageType.MEMORY) {
      return build(source, null, size, modified, listener);
    }

    final Path directory = locator.storeDirectory(source);
    if (!forceRebuild && Files.isDirectory(directory)) {
      final TableNodeStore cached = reusable(directory, size, modified);
      if (cached != null) {
        LOGWRAPPER.info("Reusing store {} with {} nodes.", directory, cached.size());
        return new DocumentSession(cached, configuration, null);
      }
    }
    ArborFiles.recursiveRemove(directory);
    return build(source, directory, size, modified, listener);
  }

  private @Nullable TableNodeStore reusable(final Path directory, final long size, final long modified) {
    final TableNodeStore store;
    try {
      store = TableNodeStore.open(configuration.storageType.getInstance(directory), configuration);
    } catch (final ArborException e) {
      LOGWRAPPER.warn("Cached store {} is unreadable, rebuilding: {}", directory, e.getMessage());
      return null;
    }
    final StoreDescriptor descriptor = store.getDescriptor();
    if (descriptor.isComplete() && descriptor.getSourceSize() == size && descriptor.getSourceModified() == modified
        && descriptor.getNodeCount() == store.size()) {
      return store;
    }
    LOGWRAPPER.info("Cached store {} is stale ({}), rebuilding.", directory, descriptor);
    store.close();
    return null;
  }

  private DocumentSession build(final Path source, final @Nullable Path directory, final long size,
      final long modified, final IngestionListener listener) {
    LOGWRAPPER.info("Building store for {} ({} bytes).", source, size);
    final IOStorage storage = configuration.storageType.getInstance(directory);
    final TableNodeStore store = TableNodeStore.open(storage, configuration);
    try {
      final IngestionResult result;
      try (final InputStream input = ProgressInputStream.wrap(Files.newInputStream(source), size, listener)) {
        final TokenSource tokens = SourceFormat.of(source) == SourceFormat.YAML
            ? YamlTokenSource.yaml(input)
            : JacksonTokenSource.json(input);
        result = IngestionPipeline.newBuilder(store, tokens)
                                  .configuration(configuration)
                                  .listener(listener)
                                  .build()
                                  .call();
      }
      store.updateDescriptor(store.getDescriptor().completedFor(size, modified));
      return new DocumentSession(store, configuration, result);
    } catch (final IOException e) {
      discard(store, directory);
      throw new ArborIOException("Cannot read " + source, e);
    } catch (final RuntimeException e) {
      discard(store, directory);
      throw e;
    }
  }

  private static void discard(final TableNodeStore store, final @Nullable Path directory) {
    store.close();
    if (directory != null) {
      ArborFiles.recursiveRemove(directory);
    }
  }

  /**
   * Remove all cached stores.
   *
   * @return the number of removed stores
   */
  public int clearCache() {
    return locator.clearCache();
  }
}
