package io.arbor.utils;

import io.arbor.exception.ArborIOException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Static methods for file operations.
 */
public final class ArborFiles {

  private ArborFiles() {
    throw new AssertionError("May not be instantiated!");
  }

  /**
   * Recursively remove a directory. A missing directory is ignored.
   *
   * @param path the directory
   * @throws ArborIOException if walking or deleting fails
   */
  public static void recursiveRemove(final Path path) {
    if (!Files.exists(path)) {
      return;
    }
    try (final Stream<Path> stream = Files.walk(path)) {
      for (final Path entry : (Iterable<Path>) stream.sorted(Comparator.reverseOrder())::iterator) {
        Files.deleteIfExists(entry);
      }
    } catch (final IOException e) {
      throw new ArborIOException("Cannot remove " + path, e);
    }
  }
}
