package io.arbor.index.search;

import io.arbor.exception.ArborIOException;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageFiles;
import io.arbor.utils.LogWrapper;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.roaringbitmap.IntIterator;
import org.roaringbitmap.RoaringBitmap;
import org.slf4j.LoggerFactory;

import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * Builds the search index of a bulk load in one pass over its rows.
 *
 * <p>Keys and values are indexed directly. For paths only the segment a node adds to its parent's
 * path is tokenized; the path posting list of a token is then the union of the subtrees of all
 * nodes whose segment contains it, which needs the preorder extents of the tree.
 */
public final class SearchIndexBuilder {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(SearchIndexBuilder.class));

  private final Map<String, RoaringBitmap> keyPostings = new Object2ObjectOpenHashMap<>();

  private final Map<String, RoaringBitmap> valuePostings = new Object2ObjectOpenHashMap<>();

  private final Map<String, RoaringBitmap> segmentPostings = new Object2ObjectOpenHashMap<>();

  private int rowCount;

  private boolean built;

  /**
   * Add the next row. Rows have to be added in id order.
   *
   * @param id the node id
   * @param key the key
   * @param value the value, {@code null} for containers
   * @param pathSegment the part of the node's path that follows its parent's path
   */
  public void add(final int id, final String key, final @Nullable String value, final String pathSegment) {
    checkState(!built, "Index already built.");
    checkArgument(id == rowCount, "Rows must be added in id order, expected %s but got %s", rowCount, id);
    SearchTokens.forEachToken(SearchScores.normalize(key), token -> addPosting(keyPostings, token, id));
    if (value != null) {
      SearchTokens.forEachToken(SearchScores.normalize(value), token -> addPosting(valuePostings, token, id));
    }
    SearchTokens.forEachToken(SearchScores.normalize(pathSegment), token -> addPosting(segmentPostings, token, id));
    rowCount++;
  }

  private static void addPosting(final Map<String, RoaringBitmap> postings, final String token, final int id) {
    postings.computeIfAbsent(token, unused -> new RoaringBitmap()).add(id);
  }

  public int rowCount() {
    return rowCount;
  }

  /**
   * Write the dictionary and the posting lists.
   *
   * @param extents last id of the subtree of every row, {@code null} if the rows are not numbered
   *        in preorder, in which case no path postings are written and every row is a path
   *        candidate
   * @param storage the target storage
   */
  public void build(final int @Nullable [] extents, final IOStorage storage) {
    checkState(!built, "Index already built.");
    built = true;
    final long start = System.currentTimeMillis();

    final Set<String> distinct = new ObjectOpenHashSet<>(keyPostings.keySet());
    distinct.addAll(valuePostings.keySet());
    if (extents != null) {
      distinct.addAll(segmentPostings.keySet());
    }
    final String[] tokens = distinct.toArray(new String[0]);
    Arrays.sort(tokens);

    final long[] offsets = new long[tokens.length * 3];
    final int[] lengths = new int[tokens.length * 3];
    Arrays.fill(lengths, -1);
    try (final DataOutputStream postings = new DataOutputStream(
        StorageFiles.newAppendingStream(storage.file(IOStorage.POSTINGS_FILE)))) {
      long position = 0;
      for (int i = 0; i < tokens.length; i++) {
        final String token = tokens[i];
        position = writePostings(postings, position, keyPostings.get(token), i * 3, offsets, lengths);
        position = writePostings(postings, position, valuePostings.get(token), i * 3 + 1, offsets, lengths);
        if (extents != null) {
          position = writePostings(postings, position, subtrees(segmentPostings.get(token), extents), i * 3 + 2,
              offsets, lengths);
        }
      }
    } catch (final IOException e) {
      throw new ArborIOException("Cannot write the search postings", e);
    }

    try (final DataOutputStream dictionary = new DataOutputStream(
        StorageFiles.newAppendingStream(storage.file(IOStorage.DICTIONARY_FILE)))) {
      TokenDictionary.write(dictionary, tokens, offsets, lengths, rowCount, extents != null);
    } catch (final IOException e) {
      throw new ArborIOException("Cannot write the search dictionary", e);
    }

    LOGWRAPPER.debug("Search index over {} rows with {} tokens built [{} ms]", rowCount, tokens.length,
        System.currentTimeMillis() - start);
  }

  private static @Nullable RoaringBitmap subtrees(final @Nullable RoaringBitmap segments, final int[] extents) {
    if (segments == null) {
      return null;
    }
    final RoaringBitmap closure = new RoaringBitmap();
    final IntIterator ids = segments.getIntIterator();
    while (ids.hasNext()) {
      final int id = ids.next();
      closure.add((long) id, (long) extents[id] + 1);
    }
    return closure;
  }

  private static long writePostings(final DataOutputStream output, final long position,
      final @Nullable RoaringBitmap bitmap, final int slot, final long[] offsets, final int[] lengths)
      throws IOException {
    if (bitmap == null) {
      return position;
    }
    bitmap.runOptimize();
    final int length = bitmap.serializedSizeInBytes();
    bitmap.serialize(output);
    offsets[slot] = position;
    lengths[slot] = length;
    return position + length;
  }
}
