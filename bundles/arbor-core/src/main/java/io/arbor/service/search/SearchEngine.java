package io.arbor.service.search;

import io.arbor.exception.PathException;
import io.arbor.index.search.MatchedField;
import io.arbor.index.search.SearchCursor;
import io.arbor.index.search.SearchHit;
import io.arbor.index.search.SearchIndex;
import io.arbor.index.search.SearchScores;
import io.arbor.node.Node;
import io.arbor.service.navigate.Navigator;
import io.arbor.service.path.PathResolver;
import io.arbor.service.path.Resolution;
import io.arbor.store.NodeStore;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Runs searches on a store and keeps the matches of the current one for cycling.
 *
 * <pre>
 * IDLE --search--> SEARCHING --exhausted--> MATCHES_FOUND | NO_MATCHES
 *   ^                  |                              |
 *   +------cancel------+-------------cancel-----------+
 * </pre>
 *
 * <p>Every search gets a new generation; results of older generations are dropped under the engine
 * lock, so a superseded task can never add matches to a newer search or call its listener.
 */
public final class SearchEngine implements AutoCloseable {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER = new LogWrapper(LoggerFactory.getLogger(SearchEngine.class));

  private final NodeStore store;

  private final SearchIndex searchIndex;

  private final PathResolver pathResolver;

  private final Navigator navigator;

  private final Executor executor;

  private final int chunkSize;

  private final Object lock = new Object();

  private SearchState state = SearchState.IDLE;

  private long generation;

  private @Nullable SearchTask current;

  private final List<SearchHit> matches = new ArrayList<>();

  private int selected = -1;

  private boolean closed;

  public SearchEngine(final NodeStore store, final PathResolver pathResolver, final Navigator navigator,
      final Executor executor, final int chunkSize) {
    checkArgument(chunkSize > 0, "chunkSize must be > 0");
    this.store = requireNonNull(store);
    this.searchIndex = store.searchIndex();
    this.pathResolver = requireNonNull(pathResolver);
    this.navigator = requireNonNull(navigator);
    this.executor = requireNonNull(executor);
    this.chunkSize = chunkSize;
  }

  /**
   * Start a search, cancelling the running one. Input starting with {@code .} is first tried as a
   * path expression; if it resolves, the target is the single match.
   *
   * <p>Only the task is queued here. Path resolution and all index work run on the executor.
   *
   * @param input the query or path expression, not blank
   * @param listener receives the matches of this search
   * @return the task
   */
  public SearchTask search(final String input, final SearchListener listener) {
    requireNonNull(input);
    requireNonNull(listener);
    checkArgument(!input.isBlank(), "Search input must not be blank.");

    synchronized (lock) {
      if (closed) {
        throw new IllegalStateException("The search engine is closed.");
      }
      stopCurrent();
      generation++;
      final SearchTask task = new SearchTask(this, generation, input, listener, executor, chunkSize);
      current = task;
      state = SearchState.SEARCHING;
      LOGWRAPPER.debug("Search #{} for '{}' started.", generation, input);
      executor.execute(task);
      return task;
    }
  }

  /**
   * Jump match of path input. Called on the executor without the engine lock.
   *
   * @return the hit, {@code null} if the input is no resolvable path
   */
  @Nullable SearchHit tryJump(final String input) {
    if (!input.startsWith(".")) {
      return null;
    }
    try {
      final Resolution resolution = pathResolver.resolve(input);
      return new SearchHit(resolution.getTarget().getId(), MatchedField.PATH, SearchScores.PATH_RESOLVED);
    } catch (final PathException e) {
      LOGWRAPPER.debug("'{}' is no resolvable path ({}), searching text.", input, e.getReason());
      return null;
    }
  }

  /**
   * Cursor of a text search. Called on the executor without the engine lock.
   */
  SearchCursor openCursor(final String input) {
    return searchIndex.search(input);
  }

  /**
   * Cancel the running search and drop the collected matches.
   */
  public void cancel() {
    synchronized (lock) {
      stopCurrent();
      generation++;
    }
  }

  private void stopCurrent() {
    if (current != null) {
      current.cancel();
      current = null;
    }
    matches.clear();
    selected = -1;
    state = SearchState.IDLE;
  }

  /**
   * Hand over a batch of a task.
   *
   * @return {@code false} if the task is stale and has to stop
   */
  boolean deliver(final SearchTask task, final List<SearchHit> batch) {
    synchronized (lock) {
      if (!isCurrent(task)) {
        return false;
      }
      matches.addAll(batch);
      task.getListener().onMatches(task, batch);
      return true;
    }
  }

  void complete(final SearchTask task) {
    synchronized (lock) {
      if (!isCurrent(task)) {
        return;
      }
      state = matches.isEmpty() ? SearchState.NO_MATCHES : SearchState.MATCHES_FOUND;
      current = null;
      LOGWRAPPER.debug("Search #{} for '{}' finished with {} matches.", task.getGeneration(), task.getQuery(),
          matches.size());
      task.getListener().onComplete(task, state);
      task.completion().complete(state);
    }
  }

  void fail(final SearchTask task, final RuntimeException failure) {
    synchronized (lock) {
      if (isCurrent(task)) {
        current = null;
        state = matches.isEmpty() ? SearchState.NO_MATCHES : SearchState.MATCHES_FOUND;
      }
    }
    task.completion().completeExceptionally(failure);
  }

  private boolean isCurrent(final SearchTask task) {
    return !closed && task == current && task.getGeneration() == generation && !task.isCancelled();
  }

  public SearchState getState() {
    synchronized (lock) {
      return state;
    }
  }

  /**
   * Matches collected so far by the current search.
   *
   * @return a copy of the matches in delivery order
   */
  public List<SearchHit> getMatches() {
    synchronized (lock) {
      return new ArrayList<>(matches);
    }
  }

  /**
   * Select the next collected match, wrapping to the first after the last.
   *
   * @return the selection, empty if there are no matches
   */
  public Optional<MatchSelection> next() {
    return select(1);
  }

  /**
   * Select the previous collected match, wrapping to the last before the first.
   *
   * @return the selection, empty if there are no matches
   */
  public Optional<MatchSelection> previous() {
    return select(-1);
  }

  private Optional<MatchSelection> select(final int direction) {
    final SearchHit hit;
    final int index;
    final int total;
    synchronized (lock) {
      if (matches.isEmpty()) {
        return Optional.empty();
      }
      total = matches.size();
      if (selected < 0) {
        selected = direction > 0 ? 0 : total - 1;
      } else {
        selected = Math.floorMod(selected + direction, total);
      }
      index = selected;
      hit = matches.get(index);
    }
    return Optional.of(selection(hit, index, total));
  }

  /**
   * Next match in document order after a node, wrapping around, without running a search.
   *
   * @param query the query
   * @param afterId the node to start after, {@code -1} for the beginning
   * @return the selection, empty if nothing matches
   */
  public Optional<MatchSelection> findNext(final String query, final long afterId) {
    return searchIndex.nextMatch(query, afterId).map(hit -> selection(hit, -1, -1));
  }

  /**
   * Previous match in document order before a node, wrapping around, without running a search.
   *
   * @param query the query
   * @param beforeId the node to start before, {@code -1} for the end
   * @return the selection, empty if nothing matches
   */
  public Optional<MatchSelection> findPrevious(final String query, final long beforeId) {
    return searchIndex.prevMatch(query, beforeId).map(hit -> selection(hit, -1, -1));
  }

  private MatchSelection selection(final SearchHit hit, final int index, final int total) {
    final Node node = store.getNode(hit.getNodeId());
    final List<Node> chain = navigator.reveal(node.getId());
    return new MatchSelection(hit, node, chain.subList(0, chain.size() - 1), index, total);
  }

  /**
   * Cancel the running search. The executor is owned by the caller.
   */
  @Override
  public void close() {
    synchronized (lock) {
      stopCurrent();
      generation++;
      closed = true;
    }
  }
}
