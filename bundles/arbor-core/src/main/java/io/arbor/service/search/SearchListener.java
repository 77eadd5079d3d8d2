package io.arbor.service.search;

import io.arbor.index.search.SearchHit;

import java.util.List;

/**
 * Receives the results of one search task. Callbacks run on the search executor and must not
 * block; they are never invoked for a task after it has been cancelled or superseded.
 */
public interface SearchListener {

  /**
   * A batch of matches, in cursor order.
   *
   * @param task the task
   * @param batch the matches
   */
  void onMatches(SearchTask task, List<SearchHit> batch);

  /**
   * The task finished.
   *
   * @param task the task
   * @param state {@link SearchState#MATCHES_FOUND} or {@link SearchState#NO_MATCHES}
   */
  default void onComplete(final SearchTask task, final SearchState state) {
  }
}
