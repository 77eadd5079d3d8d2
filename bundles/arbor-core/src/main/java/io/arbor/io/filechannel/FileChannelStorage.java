package io.arbor.io.filechannel;

import io.arbor.exception.ArborIOException;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageFile;
import io.arbor.io.StorageType;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * Factory to provide file channel access as a backend. Every named file maps to one file in the
 * store directory.
 */
public final class FileChannelStorage implements IOStorage {

  /** The store directory. */
  private final Path directory;

  /** Files opened so far. */
  private final Map<String, FileChannelFile> files = new HashMap<>();

  private boolean closed;

  /**
   * Constructor.
   *
   * @param directory the store directory, created on first use
   */
  public FileChannelStorage(final Path directory) {
    this.directory = requireNonNull(directory);
  }

  @Override
  public synchronized StorageFile file(final String name) {
    if (closed) {
      throw new IllegalStateException("Storage is closed: " + directory);
    }
    final FileChannelFile existing = files.get(name);
    if (existing != null) {
      return existing;
    }
    try {
      Files.createDirectories(directory);
      final FileChannel channel = FileChannel.open(directory.resolve(name),
                                                   StandardOpenOption.CREATE,
                                                   StandardOpenOption.READ,
                                                   StandardOpenOption.WRITE);
      final FileChannelFile file = new FileChannelFile(channel);
      files.put(name, file);
      return file;
    } catch (final IOException e) {
      throw new ArborIOException("Cannot open " + directory.resolve(name), e);
    }
  }

  @Override
  public synchronized boolean exists(final String name) {
    final FileChannelFile open = files.get(name);
    if (open != null) {
      return open.size() > 0;
    }
    final Path file = directory.resolve(name);
    try {
      return Files.exists(file) && Files.size(file) > 0;
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
  }

  /**
   * Truncate every file of the store directory, including the ones not opened yet.
   */
  @Override
  public synchronized void clear() {
    if (Files.isDirectory(directory)) {
      try (final Stream<Path> entries = Files.list(directory)) {
        for (final Path entry : (Iterable<Path>) entries::iterator) {
          if (Files.isRegularFile(entry)) {
            file(entry.getFileName().toString());
          }
        }
      } catch (final IOException e) {
        throw new ArborIOException("Cannot list " + directory, e);
      }
    }
    for (final FileChannelFile file : files.values()) {
      file.truncate(0);
    }
  }

  @Override
  public StorageType getType() {
    return StorageType.FILE_CHANNEL;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    IOException failure = null;
    for (final FileChannelFile file : files.values()) {
      try {
        file.close();
      } catch (final IOException e) {
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    files.clear();
    if (failure != null) {
      throw new ArborIOException(failure);
    }
  }
}
