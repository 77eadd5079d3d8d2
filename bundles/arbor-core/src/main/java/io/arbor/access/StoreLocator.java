package io.arbor.access;

import com.google.common.hash.Hashing;
import io.arbor.exception.ArborIOException;
import io.arbor.utils.ArborFiles;
import io.arbor.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Maps source documents to their store directories below a cache root. The directory of a source
 * is {@code <file name>_<sha-256 of the absolute path>}, so equally named files in different
 * directories never share a store.
 */
public final class StoreLocator {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(StoreLocator.class));

  private final Path cacheRoot;

  public StoreLocator(final Path cacheRoot) {
    this.cacheRoot = requireNonNull(cacheRoot);
  }

  /**
   * Locator below the platform cache directory.
   *
   * @return the locator
   */
  public static StoreLocator platform() {
    return new StoreLocator(cacheDirectory());
  }

  /**
   * Platform cache directory: {@code %LOCALAPPDATA%\arbor} on Windows,
   * {@code ~/Library/Caches/arbor} on macOS, {@code $XDG_CACHE_HOME/arbor} or
   * {@code ~/.cache/arbor} elsewhere.
   *
   * @return the directory
   */
  public static Path cacheDirectory() {
    final String home = System.getProperty("user.home");
    if (ArborConfiguration.isWindows()) {
      final String localAppData = System.getenv("LOCALAPPDATA");
      if (localAppData != null) {
        return Paths.get(localAppData, ArborConfiguration.APPLICATION_DIRECTORY);
      }
      return Paths.get(home, "AppData", "Local", ArborConfiguration.APPLICATION_DIRECTORY);
    }
    if (ArborConfiguration.isMac()) {
      return Paths.get(home, "Library", "Caches", ArborConfiguration.APPLICATION_DIRECTORY);
    }
    final String xdgCache = System.getenv("XDG_CACHE_HOME");
    if (xdgCache != null && !xdgCache.isEmpty()) {
      return Paths.get(xdgCache, ArborConfiguration.APPLICATION_DIRECTORY);
    }
    return Paths.get(home, ".cache", ArborConfiguration.APPLICATION_DIRECTORY);
  }

  public Path getCacheRoot() {
    return cacheRoot;
  }

  /**
   * Store directory of a source document. Nothing is created.
   *
   * @param source the source document
   * @return the directory
   */
  public Path storeDirectory(final Path source) {
    final Path absolute = source.toAbsolutePath().normalize();
    final Path fileName = absolute.getFileName();
    final String name = fileName == null ? "document" : fileName.toString();
    final String hash = Hashing.sha256().hashString(absolute.toString(), StandardCharsets.UTF_8).toString();
    return cacheRoot.resolve(name + "_" + hash);
  }

  /**
   * Remove the store directories below the cache root.
   *
   * @return the number of removed stores
   */
  public int clearCache() {
    if (!Files.isDirectory(cacheRoot)) {
      return 0;
    }
    int removed = 0;
    try (final Stream<Path> entries = Files.list(cacheRoot)) {
      for (final Path entry : (Iterable<Path>) entries::iterator) {
        if (Files.isDirectory(entry)) {
          ArborFiles.recursiveRemove(entry);
          removed++;
        }
      }
    } catch (final IOException e) {
      throw new ArborIOException("Cannot list " + cacheRoot, e);
    }
    LOGWRAPPER.info("Removed {} cached stores from {}.", removed, cacheRoot);
    return removed;
  }
}
