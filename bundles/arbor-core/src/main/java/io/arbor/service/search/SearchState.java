package io.arbor.service.search;

/**
 * States of the {@link SearchEngine}.
 */
public enum SearchState {
  /** No search is running and no result set is held. */
  IDLE,

  /** A scan is running; matches are collected as they are delivered. */
  SEARCHING,

  /** The scan finished with at least one match. */
  MATCHES_FOUND,

  /** The scan finished without a match. */
  NO_MATCHES
}
