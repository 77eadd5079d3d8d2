package io.arbor.index.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.arbor.exception.ArborIOException;
import io.arbor.io.IOStorage;
import io.arbor.io.StorageFile;
import io.arbor.io.StorageFiles;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.roaringbitmap.RoaringBitmap;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Sorted token dictionary of the bulk built part of the search index. Every token points to up to
 * three serialized posting lists (key, value, path) in {@link IOStorage#POSTINGS_FILE}, which are
 * read on demand.
 *
 * <pre>
 * header: | version (4) | rowCount (4) | preorder (1) | tokenCount (4) |
 * entry:  | length (4) | utf-8 token | 3 x ( offset (8) | length (4) ) |
 * </pre>
 *
 * A posting length of {@code -1} marks an absent list.
 */
final class TokenDictionary {

  static final int FORMAT_VERSION = 1;

  private static final int FIELDS = 3;

  private static final int POSTINGS_CACHE_SIZE = 4096;

  private static final TokenDictionary EMPTY = new TokenDictionary(new String[0], new long[0], new int[0], 0, true,
      null);

  private final String[] tokens;

  private final long[] offsets;

  private final int[] lengths;

  private final int rowCount;

  private final boolean preorder;

  private final @Nullable StorageFile postingsFile;

  private final Cache<Long, RoaringBitmap> postingsCache;

  private TokenDictionary(final String[] tokens, final long[] offsets, final int[] lengths, final int rowCount,
      final boolean preorder, final @Nullable StorageFile postingsFile) {
    this.tokens = tokens;
    this.offsets = offsets;
    this.lengths = lengths;
    this.rowCount = rowCount;
    this.preorder = preorder;
    this.postingsFile = postingsFile;
    this.postingsCache = Caffeine.newBuilder().maximumSize(POSTINGS_CACHE_SIZE).build();
  }

  static TokenDictionary empty() {
    return EMPTY;
  }

  /**
   * Number of rows covered by the dictionary, which are the ids {@code 0 ... rowCount - 1}.
   */
  int rowCount() {
    return rowCount;
  }

  /**
   * Whether the covered rows are numbered in preorder, which is required for path postings.
   */
  boolean isPreorder() {
    return preorder;
  }

  int size() {
    return tokens.length;
  }

  String token(final int index) {
    return tokens[index];
  }

  /**
   * Indexes of the tokens a query term matches.
   *
   * @param term the term
   * @return the token indexes, ascending
   */
  IntList matching(final QueryTerm term) {
    final IntList result = new IntArrayList();
    switch (term.mode) {
      case EXACT -> {
        final int index = Arrays.binarySearch(tokens, term.text);
        if (index >= 0) {
          result.add(index);
        }
      }
      case PREFIX -> {
        final int found = Arrays.binarySearch(tokens, term.text);
        for (int i = found >= 0 ? found : -found - 1; i < tokens.length && tokens[i].startsWith(term.text); i++) {
          result.add(i);
        }
      }
      default -> {
        for (int i = 0; i < tokens.length; i++) {
          if (term.mode.matches(tokens[i], term.text)) {
            result.add(i);
          }
        }
      }
    }
    return result;
  }

  /**
   * Posting list of a token.
   *
   * @param index the token index
   * @param field the field
   * @return the posting list, or {@code null} if the token does not occur in the field. The bitmap
   *         is shared and must not be modified.
   */
  @Nullable RoaringBitmap postings(final int index, final MatchedField field) {
    final int slot = index * FIELDS + field.ordinal();
    final int length = lengths[slot];
    if (length < 0 || postingsFile == null) {
      return null;
    }
    final long offset = offsets[slot];
    return postingsCache.get(offset, unused -> readPostings(offset, length));
  }

  private RoaringBitmap readPostings(final long offset, final int length) {
    final ByteBuffer buffer = ByteBuffer.allocate(length);
    if (postingsFile.read(offset, buffer) < length) {
      throw new ArborIOException("Truncated posting list at " + offset);
    }
    buffer.flip();
    final RoaringBitmap bitmap = new RoaringBitmap();
    try {
      bitmap.deserialize(buffer);
    } catch (final IOException e) {
      throw new ArborIOException("Corrupt posting list at " + offset, e);
    }
    return bitmap;
  }

  /**
   * Load the dictionary of a storage.
   *
   * @param storage the storage
   * @return the dictionary, {@link #empty()} if the storage has none
   */
  static TokenDictionary load(final IOStorage storage) {
    if (!storage.exists(IOStorage.DICTIONARY_FILE)) {
      return EMPTY;
    }
    try (final DataInputStream input = new DataInputStream(
        StorageFiles.newInputStream(storage.file(IOStorage.DICTIONARY_FILE), 0))) {
      final int version = input.readInt();
      if (version != FORMAT_VERSION) {
        throw new ArborIOException("Unsupported search dictionary version " + version);
      }
      final int rowCount = input.readInt();
      final boolean preorder = input.readBoolean();
      final int tokenCount = input.readInt();
      final String[] tokens = new String[tokenCount];
      final long[] offsets = new long[tokenCount * FIELDS];
      final int[] lengths = new int[tokenCount * FIELDS];
      for (int i = 0; i < tokenCount; i++) {
        final byte[] bytes = new byte[input.readInt()];
        input.readFully(bytes);
        tokens[i] = new String(bytes, StandardCharsets.UTF_8);
        for (int field = 0; field < FIELDS; field++) {
          offsets[i * FIELDS + field] = input.readLong();
          lengths[i * FIELDS + field] = input.readInt();
        }
      }
      return new TokenDictionary(tokens, offsets, lengths, rowCount, preorder,
          storage.file(IOStorage.POSTINGS_FILE));
    } catch (final IOException e) {
      throw new ArborIOException("Cannot read the search dictionary", e);
    }
  }

  /**
   * Write a dictionary.
   *
   * @param output target stream
   * @param tokens sorted tokens
   * @param offsets posting offsets, three per token
   * @param lengths posting lengths, three per token, {@code -1} if absent
   * @param rowCount number of covered rows
   * @param preorder whether the rows are numbered in preorder
   */
  static void write(final DataOutputStream output, final String[] tokens, final long[] offsets, final int[] lengths,
      final int rowCount, final boolean preorder) throws IOException {
    output.writeInt(FORMAT_VERSION);
    output.writeInt(rowCount);
    output.writeBoolean(preorder);
    output.writeInt(tokens.length);
    for (int i = 0; i < tokens.length; i++) {
      final byte[] bytes = tokens[i].getBytes(StandardCharsets.UTF_8);
      output.writeInt(bytes.length);
      output.write(bytes);
      for (int field = 0; field < FIELDS; field++) {
        output.writeLong(offsets[i * FIELDS + field]);
        output.writeInt(lengths[i * FIELDS + field]);
      }
    }
  }
}
