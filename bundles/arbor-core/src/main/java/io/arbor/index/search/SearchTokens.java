package io.arbor.index.search;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Tokenization shared by the index builder and the query side: a token is a maximal run of
 * letters or digits of the normalized text.
 */
final class SearchTokens {

  private SearchTokens() {
    throw new AssertionError();
  }

  static void forEachToken(final String normalized, final Consumer<String> consumer) {
    final int length = normalized.length();
    int start = -1;
    for (int i = 0; i < length; i++) {
      if (Character.isLetterOrDigit(normalized.charAt(i))) {
        if (start < 0) {
          start = i;
        }
      } else if (start >= 0) {
        consumer.accept(normalized.substring(start, i));
        start = -1;
      }
    }
    if (start >= 0) {
      consumer.accept(normalized.substring(start));
    }
  }

  /**
   * Terms of a normalized query. A run touching the start of the query may be the tail of a
   * longer token, a run touching the end may be its head.
   *
   * @param normalizedQuery the query
   * @return the terms, empty if the query has no letters or digits
   */
  static List<QueryTerm> queryTerms(final String normalizedQuery) {
    final List<QueryTerm> terms = new ArrayList<>();
    final int length = normalizedQuery.length();
    int start = -1;
    for (int i = 0; i <= length; i++) {
      final boolean tokenChar = i < length && Character.isLetterOrDigit(normalizedQuery.charAt(i));
      if (tokenChar && start < 0) {
        start = i;
      } else if (!tokenChar && start >= 0) {
        terms.add(new QueryTerm(normalizedQuery.substring(start, i), QueryTerm.mode(start == 0, i == length)));
        start = -1;
      }
    }
    return terms;
  }
}
