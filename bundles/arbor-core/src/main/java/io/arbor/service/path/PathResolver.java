package io.arbor.service.path;

import io.arbor.exception.PathException;
import io.arbor.node.Node;
import io.arbor.node.NodeKind;
import io.arbor.node.NodePaths;
import io.arbor.service.navigate.Navigator;
import io.arbor.settings.Fixed;
import io.arbor.store.NodeStore;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Resolves path expressions against a node store. Object members are looked up through the path
 * index, array elements by rank; nothing beyond the nodes on the path is read.
 */
public final class PathResolver {

  private final NodeStore store;

  private final Navigator navigator;

  public PathResolver(final NodeStore store, final Navigator navigator) {
    this.store = requireNonNull(store);
    this.navigator = requireNonNull(navigator);
  }

  /**
   * Resolve an expression.
   *
   * @param expression the expression
   * @return the target and the entries to expand to reveal it
   * @throws PathException if the expression is malformed or does not resolve, carrying the path of
   *         the deepest node reached
   */
  public Resolution resolve(final String expression) {
    return resolve(PathExpression.parse(expression));
  }

  public Resolution resolve(final PathExpression expression) {
    requireNonNull(expression);
    Node current = store.findNode(Fixed.ROOT_NODE_ID.getStandardProperty())
                        .orElseThrow(() -> new PathException(PathException.Reason.SEGMENT_NOT_FOUND, Fixed.ROOT_PATH,
                            "The document is empty."));
    for (final PathSegment segment : expression.getSegments()) {
      current = step(current, segment);
    }
    final List<Node> chain = navigator.reveal(current.getId());
    return new Resolution(current, chain.subList(0, chain.size() - 1));
  }

  private Node step(final Node current, final PathSegment segment) {
    switch (segment.getType()) {
      case KEY: {
        if (current.getKind() != NodeKind.OBJECT) {
          throw notFound(current, segment, "is a " + current.getKind().getName() + ", not an object");
        }
        final String childPath = NodePaths.childPath(current.getPath(), NodeKind.OBJECT, segment.getKey());
        final Optional<Node> child = store.findByPath(childPath);
        if (child.isEmpty() || child.get().getParentId() != current.getId()) {
          throw notFound(current, segment, "has no key " + segment.getSource());
        }
        return child.get();
      }
      case INDEX: {
        if (current.getKind() != NodeKind.ARRAY) {
          throw notFound(current, segment, "is a " + current.getKind().getName() + ", not an array");
        }
        final long count = current.getChildCount();
        final long index = segment.getIndex() < 0 ? count + segment.getIndex() : segment.getIndex();
        if (index < 0 || index >= count) {
          throw new PathException(PathException.Reason.INDEX_OUT_OF_RANGE, current.getPath(),
              "Index " + segment.getSource() + " is outside the " + count + " elements of " + current.getPath());
        }
        return store.getChildByRank(current.getId(), index)
                    .orElseThrow(() -> notFound(current, segment, "has no element " + segment.getSource()));
      }
      case SLICE:
        throw new PathException(PathException.Reason.UNSUPPORTED_SEGMENT, current.getPath(),
            "Slices such as " + segment.getSource() + " are not supported.");
      default:
        throw new AssertionError(segment.getType());
    }
  }

  private static PathException notFound(final Node current, final PathSegment segment, final String detail) {
    return new PathException(PathException.Reason.SEGMENT_NOT_FOUND, current.getPath(),
        "Cannot resolve " + segment.getSource() + ": " + current.getPath() + " " + detail + ".");
  }
}
