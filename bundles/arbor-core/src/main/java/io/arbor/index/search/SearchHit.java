package io.arbor.index.search;

import com.google.common.base.MoreObjects;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * A verified search match: the node, the field that produced its best score and the score.
 */
public final class SearchHit {

  private final long nodeId;

  private final MatchedField matchedField;

  private final int score;

  public SearchHit(final long nodeId, final MatchedField matchedField, final int score) {
    this.nodeId = nodeId;
    this.matchedField = requireNonNull(matchedField);
    this.score = score;
  }

  public long getNodeId() {
    return nodeId;
  }

  public MatchedField getMatchedField() {
    return matchedField;
  }

  public int getScore() {
    return score;
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SearchHit)) {
      return false;
    }
    final SearchHit hit = (SearchHit) other;
    return nodeId == hit.nodeId && score == hit.score && matchedField == hit.matchedField;
  }

  @Override
  public int hashCode() {
    return Objects.hash(nodeId, matchedField, score);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("nodeId", nodeId)
                      .add("matchedField", matchedField)
                      .add("score", score)
                      .toString();
  }
}
