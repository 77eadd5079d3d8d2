package io.arbor.index.search;

/**
 * The field of a node a search query matched.
 */
public enum MatchedField {
  KEY,

  VALUE,

  PATH
}
