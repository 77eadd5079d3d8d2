package io.arbor.io;

import io.arbor.io.filechannel.FileChannelStorage;
import io.arbor.io.ram.RAMStorage;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;

/**
 * Available storage backends.
 */
public enum StorageType {
  /** In memory backend, nothing survives {@link IOStorage#close()}. */
  MEMORY {
    @Override
    public IOStorage getInstance(final @Nullable Path directory) {
      return new RAMStorage();
    }
  },

  /** FileChannel backend writing one file per structure into a store directory. */
  FILE_CHANNEL {
    @Override
    public IOStorage getInstance(final @Nullable Path directory) {
      if (directory == null) {
        throw new IllegalArgumentException("The file channel backend needs a store directory.");
      }
      return new FileChannelStorage(directory);
    }
  };

  /**
   * Get an instance of the storage backend.
   *
   * @param directory the store directory, ignored by {@link #MEMORY}
   * @return a new storage instance
   */
  public abstract IOStorage getInstance(@Nullable Path directory);
}
