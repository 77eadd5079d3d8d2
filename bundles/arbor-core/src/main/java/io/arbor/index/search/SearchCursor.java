package io.arbor.index.search;

import io.arbor.node.Node;
import io.arbor.store.NodeStore;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.roaringbitmap.PeekableIntIterator;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntFunction;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Lazy result of a search. Candidates are verified in bounded steps; hits come out ordered by
 * score, ties in document order. A node is reported once, in the tier of its best score.
 *
 * <p>The candidates of a tier are looked up when the cursor reaches it, and that lookup ends the
 * current {@link #advance} call, so one call never does more than one lookup.
 */
public final class SearchCursor implements AutoCloseable {

  private final NodeStore store;

  private final String normalizedQuery;

  private final int tierCount;

  /** Candidates of a tier, tier {@code 0} having the highest score. */
  private final IntFunction<RoaringBitmap> tierCandidates;

  private int tier = -1;

  private @Nullable PeekableIntIterator candidates;

  private boolean closed;

  SearchCursor(final NodeStore store, final String normalizedQuery, final int tierCount,
      final IntFunction<RoaringBitmap> tierCandidates) {
    this.store = requireNonNull(store);
    this.normalizedQuery = requireNonNull(normalizedQuery);
    this.tierCount = tierCount;
    this.tierCandidates = requireNonNull(tierCandidates);
  }

  /**
   * Verify up to {@code maxCandidates} candidates and hand the hits to {@code sink}.
   *
   * @param maxCandidates the maximum number of candidates to examine
   * @param sink receives the hits in cursor order
   * @return the number of candidates examined, {@code 0} once the cursor is exhausted or if the
   *         call looked up the candidates of the next tier first
   */
  public int advance(final int maxCandidates, final Consumer<? super SearchHit> sink) {
    checkArgument(maxCandidates > 0, "maxCandidates must be > 0");
    int examined = 0;
    while (examined < maxCandidates && !isExhausted()) {
      if (candidates == null || !candidates.hasNext()) {
        nextTier();
        return examined;
      }
      final int id = candidates.next();
      examined++;
      final Optional<Node> node = store.findNode(id);
      if (node.isEmpty()) {
        continue;
      }
      final SearchHit hit = SearchScores.score(node.get(), normalizedQuery);
      if (hit != null && hit.getScore() == tierScore()) {
        sink.accept(hit);
      }
    }
    return examined;
  }

  /**
   * Collect all remaining hits.
   *
   * @return the hits in cursor order
   */
  public List<SearchHit> drain() {
    final List<SearchHit> hits = new ArrayList<>();
    while (!isExhausted()) {
      advance(Integer.MAX_VALUE, hits::add);
    }
    return hits;
  }

  public boolean isExhausted() {
    return closed || tier >= tierCount;
  }

  private int tierScore() {
    return SearchScores.KEY_EQUALS - tier;
  }

  private void nextTier() {
    tier++;
    candidates = tier < tierCount ? tierCandidates.apply(tier).getIntIterator() : null;
  }

  /**
   * Release the candidate sets. Idempotent.
   */
  @Override
  public void close() {
    closed = true;
    candidates = null;
  }
}
