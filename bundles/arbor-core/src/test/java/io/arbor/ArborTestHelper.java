package io.arbor;

import com.google.common.io.Resources;
import io.arbor.access.ArborConfiguration;
import io.arbor.io.StorageType;
import io.arbor.service.ingest.IndexingStrategy;
import io.arbor.service.ingest.IngestionPipeline;
import io.arbor.service.ingest.JacksonTokenSource;
import io.arbor.store.TableNodeStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Helper to create stores for tests.
 */
public final class ArborTestHelper {

  /** Fixture with nested objects and arrays. */
  public static final String SERVICES_JSON = "json/services.json";

  /** Multi-document YAML fixture. */
  public static final String SERVICES_YAML = "json/services.yaml";

  private ArborTestHelper() {
    throw new AssertionError();
  }

  public static ArborConfiguration memoryConfiguration() {
    return ArborConfiguration.newBuilder().storageType(StorageType.MEMORY).build();
  }

  /**
   * Empty in-memory store.
   *
   * @return the store
   */
  public static TableNodeStore memoryStore() {
    return TableNodeStore.open(StorageType.MEMORY.getInstance(null), memoryConfiguration());
  }

  /**
   * In-memory store holding a JSON document.
   *
   * @param json the document
   * @param strategy the indexing strategy
   * @return the store
   */
  public static TableNodeStore load(final String json, final IndexingStrategy strategy) {
    final TableNodeStore store = memoryStore();
    IngestionPipeline.newBuilder(store, JacksonTokenSource.json(json)).strategy(strategy).build().call();
    return store;
  }

  public static TableNodeStore load(final String json) {
    return load(json, IndexingStrategy.DEFERRED);
  }

  /**
   * Read a test resource.
   *
   * @param name the resource name
   * @return the content
   */
  public static String resource(final String name) {
    try {
      return Resources.toString(Resources.getResource(name), StandardCharsets.UTF_8);
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
