package io.arbor.service.path;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import io.arbor.node.Node;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Result of resolving a path expression: the target and the entries to expand, root first and
 * buckets included, so that the target becomes visible.
 */
public final class Resolution {

  private final Node target;

  private final List<Node> ancestorsToExpand;

  public Resolution(final Node target, final List<Node> ancestorsToExpand) {
    this.target = requireNonNull(target);
    this.ancestorsToExpand = ImmutableList.copyOf(ancestorsToExpand);
  }

  public Node getTarget() {
    return target;
  }

  public List<Node> getAncestorsToExpand() {
    return ancestorsToExpand;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("target", target)
                      .add("ancestorsToExpand", ancestorsToExpand.size())
                      .toString();
  }
}
