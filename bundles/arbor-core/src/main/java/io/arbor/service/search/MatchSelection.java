package io.arbor.service.search;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.arbor.index.search.SearchHit;
import io.arbor.node.Node;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * A selected match with everything needed to show it: the node and the entries to expand, root
 * first and buckets included.
 */
public final class MatchSelection {

  private final SearchHit hit;

  private final Node node;

  private final List<Node> ancestorsToExpand;

  private final int index;

  private final int total;

  public MatchSelection(final SearchHit hit, final Node node, final List<Node> ancestorsToExpand, final int index,
      final int total) {
    this.hit = requireNonNull(hit);
    this.node = requireNonNull(node);
    this.ancestorsToExpand = ImmutableList.copyOf(ancestorsToExpand);
    this.index = index;
    this.total = total;
  }

  public SearchHit getHit() {
    return hit;
  }

  public Node getNode() {
    return node;
  }

  public List<Node> getAncestorsToExpand() {
    return ancestorsToExpand;
  }

  /**
   * Position of the match among the collected matches, {@code -1} for matches found by a
   * document order step.
   *
   * @return the index
   */
  public int getIndex() {
    return index;
  }

  /**
   * Number of matches collected when the match was selected.
   *
   * @return the total
   */
  public int getTotal() {
    return total;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("hit", hit)
                      .add("index", index)
                      .add("total", total)
                      .toString();
  }
}
