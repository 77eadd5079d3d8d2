package io.arbor.index.search;

import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;

/**
 * Relevance of a node for a query. All comparisons are case-insensitive.
 *
 * <table>
 *   <caption>Scores</caption>
 *   <tr><td>5</td><td>key equals the query</td></tr>
 *   <tr><td>4</td><td>value equals the query</td></tr>
 *   <tr><td>3</td><td>key contains the query</td></tr>
 *   <tr><td>2</td><td>value contains the query</td></tr>
 *   <tr><td>1</td><td>only the path contains the query</td></tr>
 * </table>
 */
public final class SearchScores {

  /** Above every text score: the query is a path expression resolving to the node. */
  public static final int PATH_RESOLVED = 6;

  public static final int KEY_EQUALS = 5;

  public static final int VALUE_EQUALS = 4;

  public static final int KEY_CONTAINS = 3;

  public static final int VALUE_CONTAINS = 2;

  public static final int PATH_CONTAINS = 1;

  private SearchScores() {
    throw new AssertionError();
  }

  /**
   * Lower-case a field or query the way the index does.
   *
   * @param text the text
   * @return the lower-cased text
   */
  public static String normalize(final String text) {
    return text.toLowerCase(Locale.ROOT);
  }

  /**
   * Best match of a node.
   *
   * @param node the node
   * @param normalizedQuery the query, already {@link #normalize(String) normalized}
   * @return the hit, or {@code null} if no field contains the query
   */
  public static @Nullable SearchHit score(final Node node, final String normalizedQuery) {
    final String key = normalize(node.getKey());
    final String value = node.getValue() == null ? null : normalize(node.getValue());
    if (key.equals(normalizedQuery)) {
      return new SearchHit(node.getId(), MatchedField.KEY, KEY_EQUALS);
    }
    if (value != null && value.equals(normalizedQuery)) {
      return new SearchHit(node.getId(), MatchedField.VALUE, VALUE_EQUALS);
    }
    if (key.contains(normalizedQuery)) {
      return new SearchHit(node.getId(), MatchedField.KEY, KEY_CONTAINS);
    }
    if (value != null && value.contains(normalizedQuery)) {
      return new SearchHit(node.getId(), MatchedField.VALUE, VALUE_CONTAINS);
    }
    if (normalize(node.getPath()).contains(normalizedQuery)) {
      return new SearchHit(node.getId(), MatchedField.PATH, PATH_CONTAINS);
    }
    return null;
  }
}
