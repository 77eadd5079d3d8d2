package io.arbor.store;

import com.google.common.base.MoreObjects;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.arbor.exception.ArborIOException;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageFile;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Metadata of a node store, persisted as {@link IOStorage#DESCRIPTOR_FILE}.
 *
 * <p>{@code baseRowCount} is the number of rows covered by the bulk built indexes; rows above it
 * were inserted one by one and are replayed into the in-memory overlay when the store is opened.
 * The source fields and the completeness flag belong to the document loader, which only reuses a
 * store that it has marked complete for an unchanged source.
 */
public final class StoreDescriptor {

  /** Version of the on-disk layout. Stores of another version are rebuilt. */
  public static final int FORMAT_VERSION = 1;

  private final int formatVersion;

  private final long nodeCount;

  private final long baseRowCount;

  private final boolean preorder;

  private final long sourceSize;

  private final long sourceModified;

  private final boolean complete;

  public StoreDescriptor(final int formatVersion, final long nodeCount, final long baseRowCount,
      final boolean preorder, final long sourceSize, final long sourceModified, final boolean complete) {
    this.formatVersion = formatVersion;
    this.nodeCount = nodeCount;
    this.baseRowCount = baseRowCount;
    this.preorder = preorder;
    this.sourceSize = sourceSize;
    this.sourceModified = sourceModified;
    this.complete = complete;
  }

  /**
   * Descriptor of a store without any rows.
   *
   * @return the descriptor
   */
  public static StoreDescriptor empty() {
    return new StoreDescriptor(FORMAT_VERSION, 0, 0, true, -1, -1, false);
  }

  public int getFormatVersion() {
    return formatVersion;
  }

  public long getNodeCount() {
    return nodeCount;
  }

  public long getBaseRowCount() {
    return baseRowCount;
  }

  public boolean isPreorder() {
    return preorder;
  }

  public long getSourceSize() {
    return sourceSize;
  }

  public long getSourceModified() {
    return sourceModified;
  }

  public boolean isComplete() {
    return complete;
  }

  public StoreDescriptor withNodeCount(final long newNodeCount) {
    return new StoreDescriptor(formatVersion, newNodeCount, baseRowCount, preorder, sourceSize, sourceModified,
        complete);
  }

  /**
   * Copy describing the given source, marked complete.
   *
   * @param size the source size in bytes
   * @param modified the source modification time in milliseconds
   * @return the copy
   */
  public StoreDescriptor completedFor(final long size, final long modified) {
    return new StoreDescriptor(formatVersion, nodeCount, baseRowCount, preorder, size, modified, true);
  }

  /**
   * Read the descriptor of a storage.
   *
   * @param storage the storage
   * @return the descriptor, empty if the storage has none
   * @throws ArborIOException if the descriptor cannot be parsed
   */
  public static Optional<StoreDescriptor> read(final IOStorage storage) {
    if (!storage.exists(IOStorage.DESCRIPTOR_FILE)) {
      return Optional.empty();
    }
    final StorageFile file = storage.file(IOStorage.DESCRIPTOR_FILE);
    final ByteBuffer buffer = ByteBuffer.allocate((int) file.size());
    file.read(0, buffer);
    final String json = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);

    int formatVersion = -1;
    long nodeCount = 0;
    long baseRowCount = 0;
    boolean preorder = false;
    long sourceSize = -1;
    long sourceModified = -1;
    boolean complete = false;
    try (final JsonReader reader = new JsonReader(new StringReader(json))) {
      reader.beginObject();
      while (reader.hasNext()) {
        switch (reader.nextName()) {
          case "formatVersion" -> formatVersion = reader.nextInt();
          case "nodeCount" -> nodeCount = reader.nextLong();
          case "baseRowCount" -> baseRowCount = reader.nextLong();
          case "preorder" -> preorder = reader.nextBoolean();
          case "sourceSize" -> sourceSize = reader.nextLong();
          case "sourceModified" -> sourceModified = reader.nextLong();
          case "complete" -> complete = reader.nextBoolean();
          default -> reader.skipValue();
        }
      }
      reader.endObject();
    } catch (final IOException | IllegalStateException e) {
      throw new ArborIOException("Corrupt store descriptor: " + e.getMessage());
    }
    return Optional.of(new StoreDescriptor(formatVersion, nodeCount, baseRowCount, preorder, sourceSize,
        sourceModified, complete));
  }

  /**
   * Replace the descriptor of a storage.
   *
   * @param storage the storage
   */
  public void write(final IOStorage storage) {
    requireNonNull(storage);
    final StringWriter json = new StringWriter();
    try (final JsonWriter writer = new JsonWriter(json)) {
      writer.setIndent("  ");
      writer.beginObject();
      writer.name("formatVersion").value(formatVersion);
      writer.name("nodeCount").value(nodeCount);
      writer.name("baseRowCount").value(baseRowCount);
      writer.name("preorder").value(preorder);
      writer.name("sourceSize").value(sourceSize);
      writer.name("sourceModified").value(sourceModified);
      writer.name("complete").value(complete);
      writer.endObject();
    } catch (final IOException e) {
      throw new ArborIOException(e);
    }
    final StorageFile file = storage.file(IOStorage.DESCRIPTOR_FILE);
    file.truncate(0);
    file.write(0, ByteBuffer.wrap(json.toString().getBytes(StandardCharsets.UTF_8)));
    file.force();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("formatVersion", formatVersion)
                      .add("nodeCount", nodeCount)
                      .add("baseRowCount", baseRowCount)
                      .add("preorder", preorder)
                      .add("sourceSize", sourceSize)
                      .add("sourceModified", sourceModified)
                      .add("complete", complete)
                      .toString();
  }
}
