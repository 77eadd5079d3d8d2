package io.arbor.access;

import io.arbor.io.StorageType;
import io.arbor.service.ingest.IndexingStrategy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class ArborConfigurationTest {

  @TempDir
  Path directory;

  @Test
  public void testDefaults() {
    final ArborConfiguration configuration = ArborConfiguration.defaults();
    assertEquals(1000, configuration.bucketThreshold);
    assertEquals(10_000, configuration.batchSize);
    assertEquals(512, configuration.searchChunkSize);
    assertEquals(20, configuration.previewLength);
    assertEquals(StorageType.FILE_CHANNEL, configuration.storageType);
    assertEquals(IndexingStrategy.DEFERRED, configuration.indexingStrategy);
  }

  @Test
  public void testSerializeAndDeserialize() throws IOException {
    final ArborConfiguration configuration = ArborConfiguration.newBuilder()
                                                               .bucketThreshold(50)
                                                               .batchSize(7)
                                                               .searchChunkSize(3)
                                                               .previewLength(12)
                                                               .nodeCacheSize(0)
                                                               .storageType(StorageType.MEMORY)
                                                               .indexingStrategy(IndexingStrategy.PER_ROW)
                                                               .build();
    final Path file = directory.resolve("nested").resolve(ArborConfiguration.CONFIG_FILE);
    ArborConfiguration.serialize(configuration, file);

    final String json = Files.readString(file, StandardCharsets.UTF_8);
    assertTrue(json.contains("\"indexingStrategy\": \"per_row\""), json);

    final ArborConfiguration read = ArborConfiguration.deserialize(file);
    assertEquals(configuration.toString(), read.toString());
  }

  @Test
  public void testPartialFilesKeepDefaults() throws IOException {
    final Path file = directory.resolve(ArborConfiguration.CONFIG_FILE);
    Files.writeString(file, "{\"bucketThreshold\": 25, \"unknown\": [1, 2], \"previewLength\": null}");

    final ArborConfiguration configuration = ArborConfiguration.load(file);
    assertEquals(25, configuration.bucketThreshold);
    assertEquals(ArborConfiguration.DEFAULT_PREVIEW_LENGTH, configuration.previewLength);
    assertEquals(ArborConfiguration.DEFAULT_BATCH_SIZE, configuration.batchSize);
  }

  @Test
  public void testBrokenFilesFallBackToDefaults() throws IOException {
    final Path file = directory.resolve(ArborConfiguration.CONFIG_FILE);
    Files.writeString(file, "{\"bucketThreshold\": ");
    assertEquals(ArborConfiguration.defaults().toString(), ArborConfiguration.load(file).toString());

    Files.writeString(file, "{\"bucketThreshold\": 1}");
    assertEquals(ArborConfiguration.defaults().toString(), ArborConfiguration.load(file).toString());

    Files.writeString(file, "{\"storageType\": \"floppy\"}");
    assertEquals(ArborConfiguration.defaults().toString(), ArborConfiguration.load(file).toString());

    assertEquals(ArborConfiguration.defaults().toString(),
        ArborConfiguration.load(directory.resolve("missing.json")).toString());
  }

  @Test
  public void testValidation() {
    assertThrows(IllegalArgumentException.class, () -> ArborConfiguration.newBuilder().bucketThreshold(1));
    assertThrows(IllegalArgumentException.class, () -> ArborConfiguration.newBuilder().batchSize(0));
    assertThrows(IllegalArgumentException.class, () -> ArborConfiguration.newBuilder().searchChunkSize(0));
    assertThrows(IllegalArgumentException.class, () -> ArborConfiguration.newBuilder().previewLength(3));
    assertThrows(IllegalArgumentException.class, () -> ArborConfiguration.newBuilder().nodeCacheSize(-1));
  }

  @Test
  public void testToBuilder() {
    final ArborConfiguration configuration = ArborConfiguration.newBuilder().bucketThreshold(42).build();
    assertEquals(42, configuration.toBuilder().build().bucketThreshold);
    assertEquals(9, configuration.toBuilder().batchSize(9).build().batchSize);
  }
}
