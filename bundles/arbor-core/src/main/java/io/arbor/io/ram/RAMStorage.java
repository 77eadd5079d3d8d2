package io.arbor.io.ram;

import io.arbor.io.IOStorage;
import io.arbor.io.StorageFile;
import io.arbor.io.StorageType;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In memory storage.
 */
public final class RAMStorage implements IOStorage {

  /** Mapping file names to their content. */
  private final ConcurrentMap<String, RAMFile> files = new ConcurrentHashMap<>();

  @Override
  public StorageFile file(final String name) {
    return files.computeIfAbsent(name, unused -> new RAMFile());
  }

  @Override
  public boolean exists(final String name) {
    final RAMFile file = files.get(name);
    return file != null && file.size() > 0;
  }

  @Override
  public void clear() {
    files.values().forEach(file -> file.truncate(0));
  }

  @Override
  public StorageType getType() {
    return StorageType.MEMORY;
  }

  @Override
  public void close() {
    files.clear();
  }
}
