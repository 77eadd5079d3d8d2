package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.settings.Fixed;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable snapshot of one node of the stored tree. Containers carry no value; leaves carry the
 * serialized scalar.
 */
public final class Node {

  private final long id;

  private final long parentId;

  private final String key;

  private final NodeKind kind;

  private final @Nullable String value;

  private final int rank;

  private final String path;

  private final long childCount;

  public Node(final long id, final long parentId, final String key, final NodeKind kind, final @Nullable String value,
      final int rank, final String path, final long childCount) {
    this.id = id;
    this.parentId = parentId;
    this.key = requireNonNull(key);
    this.kind = requireNonNull(kind);
    this.value = value;
    this.rank = rank;
    this.path = requireNonNull(path);
    this.childCount = childCount;
  }

  public long getId() {
    return id;
  }

  public long getParentId() {
    return parentId;
  }

  public boolean hasParent() {
    return parentId != Fixed.NULL_NODE_ID.getStandardProperty();
  }

  public String getKey() {
    return key;
  }

  public NodeKind getKind() {
    return kind;
  }

  public @Nullable String getValue() {
    return value;
  }

  public int getRank() {
    return rank;
  }

  public String getPath() {
    return path;
  }

  public long getChildCount() {
    return childCount;
  }

  public boolean isBucket() {
    return kind == NodeKind.BUCKET;
  }

  /**
   * Copy of this node with another child count.
   *
   * @param newChildCount the child count
   * @return the copy
   */
  public Node withChildCount(final long newChildCount) {
    return new Node(id, parentId, key, kind, value, rank, path, newChildCount);
  }

  @Override
  public boolean equals(final Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Node)) {
      return false;
    }
    final Node node = (Node) other;
    return id == node.id && parentId == node.parentId && rank == node.rank && childCount == node.childCount
        && kind == node.kind && key.equals(node.key) && Objects.equals(value, node.value) && path.equals(node.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, parentId, key, kind, value, rank, path, childCount);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", id)
                      .add("parentId", parentId)
                      .add("key", key)
                      .add("kind", kind)
                      .add("value", value)
                      .add("rank", rank)
                      .add("path", path)
                      .add("childCount", childCount)
                      .toString();
  }
}
