package io.arbor.index.search;

import io.arbor.io.IOStorage;
import io.arbor.node.Node;
import io.arbor.store.NodeStore;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.roaringbitmap.FastAggregation;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Case-insensitive substring search over the key, value and path of every node of a store.
 *
 * <p>The bulk loaded rows are covered by a token dictionary with posting lists, which only narrows
 * the candidates; every candidate is verified against its stored fields, so the index never
 * decides a match on its own. Rows inserted one by one after the bulk load are kept in a pending
 * set and are candidates of every query.
 */
public final class SearchIndex {

  private static final Set<MatchedField> KEY = EnumSet.of(MatchedField.KEY);

  private static final Set<MatchedField> VALUE = EnumSet.of(MatchedField.VALUE);

  private static final Set<MatchedField> ALL_FIELDS = EnumSet.allOf(MatchedField.class);

  /** Number of score tiers of a cursor. */
  static final int TIER_COUNT = 5;

  private final NodeStore store;

  private volatile TokenDictionary dictionary = TokenDictionary.empty();

  /** Rows not covered by the dictionary. Guarded by {@code this}. */
  private final RoaringBitmap pending = new RoaringBitmap();

  private final AtomicLong candidateScans = new AtomicLong();

  public SearchIndex(final NodeStore store) {
    this.store = requireNonNull(store);
  }

  /**
   * Load the bulk built part of the index from a storage. Pending rows are kept.
   *
   * @param storage the storage
   */
  public void load(final IOStorage storage) {
    dictionary = TokenDictionary.load(storage);
  }

  /**
   * Synchronize a row inserted after the bulk load.
   *
   * @param id the id of the row
   */
  public synchronized void addPending(final long id) {
    checkArgument(id >= 0 && id < Integer.MAX_VALUE, "id out of range: %s", id);
    pending.add((int) id);
  }

  /**
   * Forget all rows.
   */
  public synchronized void reset() {
    dictionary = TokenDictionary.empty();
    pending.clear();
  }

  /**
   * Number of rows the index covers, which equals the number of nodes of the store.
   *
   * @return the row count
   */
  public synchronized long rowCount() {
    return (long) dictionary.rowCount() + pending.getLongCardinality();
  }

  /**
   * Check that the indexed rowset is exactly the node rowset of the store.
   *
   * @return {@code true} if both rowsets are equal
   */
  public synchronized boolean verifyConsistency() {
    final long size = store.size();
    final int baseRows = dictionary.rowCount();
    if (rowCount() != size) {
      return false;
    }
    if (pending.isEmpty()) {
      return true;
    }
    return pending.first() == baseRows && Integer.toUnsignedLong(pending.last()) == size - 1;
  }

  /**
   * Number of candidate sets computed so far. A cursor computes the candidates of a tier when it
   * reaches the tier, so opening a cursor does not change this count.
   *
   * @return the count
   */
  public long getCandidateScans() {
    return candidateScans.get();
  }

  /**
   * Start a search. Hits are produced lazily, ordered by score and then by document order; no
   * candidates are looked up before the first {@link SearchCursor#advance}.
   *
   * @param query the query, not blank
   * @return the cursor
   */
  public SearchCursor search(final String query) {
    final String normalized = normalizeQuery(query);
    return new SearchCursor(store, normalized, TIER_COUNT, tier -> tierCandidates(normalized, tier));
  }

  /**
   * First match after a node in document order, wrapping around at the end.
   *
   * @param query the query
   * @param afterId the node to start after, {@code -1} to start at the beginning
   * @return the match, empty if no node matches
   */
  public Optional<SearchHit> nextMatch(final String query, final long afterId) {
    final String normalized = normalizeQuery(query);
    final RoaringBitmap candidates = candidates(normalized, ALL_FIELDS, false);
    final int start = (int) Math.max(-1, Math.min(afterId, Integer.MAX_VALUE - 1)) + 1;
    for (long id = candidates.nextValue(start); id >= 0; id = nextValue(candidates, id)) {
      final SearchHit hit = verify(id, normalized);
      if (hit != null) {
        return Optional.of(hit);
      }
    }
    for (long id = candidates.nextValue(0); id >= 0 && id < start; id = nextValue(candidates, id)) {
      final SearchHit hit = verify(id, normalized);
      if (hit != null) {
        return Optional.of(hit);
      }
    }
    return Optional.empty();
  }

  /**
   * Last match before a node in document order, wrapping around at the beginning.
   *
   * @param query the query
   * @param beforeId the node to start before, {@code -1} to start at the end
   * @return the match, empty if no node matches
   */
  public Optional<SearchHit> prevMatch(final String query, final long beforeId) {
    final String normalized = normalizeQuery(query);
    final RoaringBitmap candidates = candidates(normalized, ALL_FIELDS, false);
    final int start = beforeId < 0 || beforeId > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) beforeId;
    for (long id = previousValue(candidates, start); id >= 0; id = previousValue(candidates, id)) {
      final SearchHit hit = verify(id, normalized);
      if (hit != null) {
        return Optional.of(hit);
      }
    }
    for (long id = previousValue(candidates, Integer.MAX_VALUE); id >= start; id = previousValue(candidates, id)) {
      final SearchHit hit = verify(id, normalized);
      if (hit != null) {
        return Optional.of(hit);
      }
    }
    return Optional.empty();
  }

  /**
   * Verify a single node against a query.
   *
   * @param nodeId the node
   * @param query the query
   * @return the hit, or {@code null} if the node does not match
   */
  public @Nullable SearchHit match(final long nodeId, final String query) {
    return verify(nodeId, normalizeQuery(query));
  }

  private static long nextValue(final RoaringBitmap bitmap, final long current) {
    return current >= Integer.MAX_VALUE ? -1 : bitmap.nextValue((int) current + 1);
  }

  private static long previousValue(final RoaringBitmap bitmap, final long current) {
    return current <= 0 ? -1 : bitmap.previousValue((int) current - 1);
  }

  private @Nullable SearchHit verify(final long id, final String normalizedQuery) {
    final Optional<Node> node = store.findNode(id);
    return node.map(value -> SearchScores.score(value, normalizedQuery)).orElse(null);
  }

  private static String normalizeQuery(final String query) {
    requireNonNull(query);
    checkArgument(!query.isBlank(), "Search query must not be blank.");
    return SearchScores.normalize(query);
  }

  /**
   * Candidates of a score tier, tier {@code 0} having the highest score.
   */
  private RoaringBitmap tierCandidates(final String normalizedQuery, final int tier) {
    return switch (tier) {
      case 0 -> candidates(normalizedQuery, KEY, true);
      case 1 -> candidates(normalizedQuery, VALUE, true);
      case 2 -> candidates(normalizedQuery, KEY, false);
      case 3 -> candidates(normalizedQuery, VALUE, false);
      case 4 -> candidates(normalizedQuery, ALL_FIELDS, false);
      default -> throw new IllegalArgumentException("No search tier " + tier);
    };
  }

  /**
   * Superset of the rows matching a query in one of the given fields.
   *
   * @param normalizedQuery the query
   * @param fields the fields
   * @param equality whether the field has to equal the query, which turns every term into an
   *        exact token match
   * @return the candidates, a fresh bitmap
   */
  private RoaringBitmap candidates(final String normalizedQuery, final Set<MatchedField> fields,
      final boolean equality) {
    candidateScans.incrementAndGet();
    final TokenDictionary dictionary = this.dictionary;
    final List<QueryTerm> terms = SearchTokens.queryTerms(normalizedQuery);
    RoaringBitmap result = null;
    if (terms.isEmpty()) {
      result = allBaseRows(dictionary);
    }
    for (final QueryTerm queryTerm : terms) {
      final QueryTerm term = equality ? new QueryTerm(queryTerm.text, QueryTerm.MatchMode.EXACT) : queryTerm;
      final RoaringBitmap termCandidates = termCandidates(dictionary, term, fields);
      result = result == null ? termCandidates : RoaringBitmap.and(result, termCandidates);
      if (result.isEmpty()) {
        break;
      }
    }
    synchronized (this) {
      result.or(pending);
    }
    return result;
  }

  private static RoaringBitmap termCandidates(final TokenDictionary dictionary, final QueryTerm term,
      final Set<MatchedField> fields) {
    if (fields.contains(MatchedField.PATH) && !dictionary.isPreorder()) {
      return allBaseRows(dictionary);
    }
    final List<RoaringBitmap> postings = new ArrayList<>();
    for (final int token : dictionary.matching(term)) {
      for (final MatchedField field : fields) {
        final RoaringBitmap bitmap = dictionary.postings(token, field);
        if (bitmap != null) {
          postings.add(bitmap);
        }
      }
    }
    if (postings.isEmpty()) {
      return new RoaringBitmap();
    }
    if (postings.size() == 1) {
      return postings.get(0).clone();
    }
    return FastAggregation.or(postings.iterator());
  }

  private static RoaringBitmap allBaseRows(final TokenDictionary dictionary) {
    final RoaringBitmap all = new RoaringBitmap();
    all.add(0L, (long) dictionary.rowCount());
    return all;
  }
}
