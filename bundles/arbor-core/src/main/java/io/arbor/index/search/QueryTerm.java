package io.arbor.index.search;

import static java.util.Objects.requireNonNull;

/**
 * A letter or digit run of a query together with the way it has to match dictionary tokens.
 */
final class QueryTerm {

  enum MatchMode {
    /** The run is a whole token. */
    EXACT,

    /** The run starts a token. */
    PREFIX,

    /** The run ends a token. */
    SUFFIX,

    /** The run occurs anywhere in a token. */
    CONTAINS;

    boolean matches(final String token, final String term) {
      return switch (this) {
        case EXACT -> token.equals(term);
        case PREFIX -> token.startsWith(term);
        case SUFFIX -> token.endsWith(term);
        case CONTAINS -> token.contains(term);
      };
    }
  }

  final String text;

  final MatchMode mode;

  QueryTerm(final String text, final MatchMode mode) {
    this.text = requireNonNull(text);
    this.mode = requireNonNull(mode);
  }

  static MatchMode mode(final boolean touchesStart, final boolean touchesEnd) {
    if (touchesStart && touchesEnd) {
      return MatchMode.CONTAINS;
    }
    if (touchesStart) {
      return MatchMode.SUFFIX;
    }
    if (touchesEnd) {
      return MatchMode.PREFIX;
    }
    return MatchMode.EXACT;
  }

  @Override
  public String toString() {
    return mode + "(" + text + ")";
  }
}
