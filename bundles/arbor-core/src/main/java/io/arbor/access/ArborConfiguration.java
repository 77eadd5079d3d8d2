package io.arbor.access;

import com.google.common.base.MoreObjects;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.arbor.exception.ArborIOException;
import io.arbor.io.StorageType;
import io.arbor.service.ingest.IndexingStrategy;
import io.arbor.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Tunables of the store and the services on top of it. Instances are immutable and created through
 * {@link #newBuilder()}.
 *
 * <p>The defaults are starting points, not derived values: bucket threshold and batch size should
 * be benchmarked against the documents at hand.
 */
public final class ArborConfiguration {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(ArborConfiguration.class));

  /** Name of the configuration file in the configuration directory. */
  public static final String CONFIG_FILE = "config.json";

  /** Name of the application directory below the platform configuration and cache roots. */
  public static final String APPLICATION_DIRECTORY = "arbor";

  public static final int DEFAULT_BUCKET_THRESHOLD = 1000;

  public static final int DEFAULT_BATCH_SIZE = 10_000;

  public static final int DEFAULT_SEARCH_CHUNK_SIZE = 512;

  public static final int DEFAULT_PREVIEW_LENGTH = 20;

  public static final int DEFAULT_NODE_CACHE_SIZE = 10_000;

  /** Children above this count are presented through bucket nodes. */
  public final int bucketThreshold;

  /** Rows per bulk flush. */
  public final int batchSize;

  /** Candidates examined by one slice of a search scan. */
  public final int searchChunkSize;

  /** Maximum length of value previews in navigator windows. */
  public final int previewLength;

  /** Maximum number of cached node snapshots. */
  public final int nodeCacheSize;

  /** Storage backend. */
  public final StorageType storageType;

  /** Index maintenance during ingestion. */
  public final IndexingStrategy indexingStrategy;

  private ArborConfiguration(final Builder builder) {
    bucketThreshold = builder.bucketThreshold;
    batchSize = builder.batchSize;
    searchChunkSize = builder.searchChunkSize;
    previewLength = builder.previewLength;
    nodeCacheSize = builder.nodeCacheSize;
    storageType = builder.storageType;
    indexingStrategy = builder.indexingStrategy;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Builder initialized with the values of this configuration.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    return new Builder().bucketThreshold(bucketThreshold)
                        .batchSize(batchSize)
                        .searchChunkSize(searchChunkSize)
                        .previewLength(previewLength)
                        .nodeCacheSize(nodeCacheSize)
                        .storageType(storageType)
                        .indexingStrategy(indexingStrategy);
  }

  /**
   * Configuration with all defaults.
   *
   * @return the default configuration
   */
  public static ArborConfiguration defaults() {
    return newBuilder().build();
  }

  /**
   * Load the user configuration from the platform configuration directory, falling back to the
   * defaults for everything the file does not set.
   *
   * @return the configuration
   */
  public static ArborConfiguration load() {
    return load(configDirectory().resolve(CONFIG_FILE));
  }

  /**
   * Load a configuration file, falling back to the defaults if it is missing or unreadable.
   *
   * @param file the configuration file
   * @return the configuration
   */
  public static ArborConfiguration load(final Path file) {
    requireNonNull(file);
    if (!Files.exists(file)) {
      return defaults();
    }
    try {
      return deserialize(file);
    } catch (final ArborIOException | IllegalStateException | IllegalArgumentException e) {
      LOGWRAPPER.warn("Failed to load configuration file {}, using defaults: {}", file, e.getMessage());
      return defaults();
    }
  }

  /**
   * Serialize a configuration.
   *
   * @param config the configuration
   * @param file the target file, parent directories are created
   * @throws ArborIOException if writing fails
   */
  public static void serialize(final ArborConfiguration config, final Path file) {
    requireNonNull(config);
    try {
      final Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (final Writer fileWriter = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
          final JsonWriter jsonWriter = new JsonWriter(fileWriter)) {
        jsonWriter.setIndent("  ");
        jsonWriter.beginObject();
        jsonWriter.name("bucketThreshold").value(config.bucketThreshold);
        jsonWriter.name("batchSize").value(config.batchSize);
        jsonWriter.name("searchChunkSize").value(config.searchChunkSize);
        jsonWriter.name("previewLength").value(config.previewLength);
        jsonWriter.name("nodeCacheSize").value(config.nodeCacheSize);
        jsonWriter.name("storageType").value(config.storageType.name().toLowerCase(Locale.ROOT));
        jsonWriter.name("indexingStrategy").value(config.indexingStrategy.name().toLowerCase(Locale.ROOT));
        jsonWriter.endObject();
      }
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  /**
   * Deserialize a configuration. Names the reader does not know are skipped, missing names keep
   * their defaults.
   *
   * @param file the configuration file
   * @return the configuration
   * @throws ArborIOException if reading fails or the file is not valid JSON
   */
  public static ArborConfiguration deserialize(final Path file) {
    final Builder builder = newBuilder();
    try (final Reader fileReader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        final JsonReader jsonReader = new JsonReader(fileReader)) {
      jsonReader.beginObject();
      while (jsonReader.hasNext()) {
        final String name = jsonReader.nextName();
        if (jsonReader.peek() == JsonToken.NULL) {
          jsonReader.nextNull();
          continue;
        }
        switch (name) {
          case "bucketThreshold" -> builder.bucketThreshold(jsonReader.nextInt());
          case "batchSize" -> builder.batchSize(jsonReader.nextInt());
          case "searchChunkSize" -> builder.searchChunkSize(jsonReader.nextInt());
          case "previewLength" -> builder.previewLength(jsonReader.nextInt());
          case "nodeCacheSize" -> builder.nodeCacheSize(jsonReader.nextInt());
          case "storageType" -> builder.storageType(StorageType.valueOf(jsonReader.nextString().toUpperCase(Locale.ROOT)));
          case "indexingStrategy" ->
              builder.indexingStrategy(IndexingStrategy.valueOf(jsonReader.nextString().toUpperCase(Locale.ROOT)));
          default -> jsonReader.skipValue();
        }
      }
      jsonReader.endObject();
    } catch (final IOException e) {
      throw new ArborIOException("Cannot read configuration " + file, e);
    }
    return builder.build();
  }

  /**
   * Platform configuration directory: {@code %APPDATA%\arbor} on Windows,
   * {@code $XDG_CONFIG_HOME/arbor} or {@code ~/.config/arbor} elsewhere.
   *
   * @return the directory
   */
  public static Path configDirectory() {
    final String home = System.getProperty("user.home");
    if (isWindows()) {
      final String appData = System.getenv("APPDATA");
      if (appData != null) {
        return Paths.get(appData, APPLICATION_DIRECTORY);
      }
      return Paths.get(home, "AppData", "Roaming", APPLICATION_DIRECTORY);
    }
    final String xdgConfig = System.getenv("XDG_CONFIG_HOME");
    if (xdgConfig != null && !xdgConfig.isEmpty()) {
      return Paths.get(xdgConfig, APPLICATION_DIRECTORY);
    }
    return Paths.get(home, ".config", APPLICATION_DIRECTORY);
  }

  static boolean isWindows() {
    return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
  }

  static boolean isMac() {
    return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("mac");
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("bucketThreshold", bucketThreshold)
                      .add("batchSize", batchSize)
                      .add("searchChunkSize", searchChunkSize)
                      .add("previewLength", previewLength)
                      .add("nodeCacheSize", nodeCacheSize)
                      .add("storageType", storageType)
                      .add("indexingStrategy", indexingStrategy)
                      .toString();
  }

  /**
   * Builder for {@link ArborConfiguration}.
   */
  public static final class Builder {

    private int bucketThreshold = DEFAULT_BUCKET_THRESHOLD;

    private int batchSize = DEFAULT_BATCH_SIZE;

    private int searchChunkSize = DEFAULT_SEARCH_CHUNK_SIZE;

    private int previewLength = DEFAULT_PREVIEW_LENGTH;

    private int nodeCacheSize = DEFAULT_NODE_CACHE_SIZE;

    private StorageType storageType = StorageType.FILE_CHANNEL;

    private IndexingStrategy indexingStrategy = IndexingStrategy.DEFERRED;

    private Builder() {
    }

    public Builder bucketThreshold(final int bucketThreshold) {
      checkArgument(bucketThreshold >= 2, "bucketThreshold must be >= 2");
      this.bucketThreshold = bucketThreshold;
      return this;
    }

    public Builder batchSize(final int batchSize) {
      checkArgument(batchSize > 0, "batchSize must be > 0");
      this.batchSize = batchSize;
      return this;
    }

    public Builder searchChunkSize(final int searchChunkSize) {
      checkArgument(searchChunkSize > 0, "searchChunkSize must be > 0");
      this.searchChunkSize = searchChunkSize;
      return this;
    }

    public Builder previewLength(final int previewLength) {
      checkArgument(previewLength >= 4, "previewLength must be >= 4");
      this.previewLength = previewLength;
      return this;
    }

    public Builder nodeCacheSize(final int nodeCacheSize) {
      checkArgument(nodeCacheSize >= 0, "nodeCacheSize must be >= 0");
      this.nodeCacheSize = nodeCacheSize;
      return this;
    }

    public Builder storageType(final StorageType storageType) {
      this.storageType = requireNonNull(storageType);
      return this;
    }

    public Builder indexingStrategy(final IndexingStrategy indexingStrategy) {
      this.indexingStrategy = requireNonNull(indexingStrategy);
      return this;
    }

    public ArborConfiguration build() {
      return new ArborConfiguration(this);
    }
  }
}
