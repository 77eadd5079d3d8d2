package io.arbor.index.bucket;

import com.google.common.base.MoreObjects;
import io.arbor.node.Node;
import io.arbor.node.NodeKind;

import static java.util.Objects.requireNonNull;

/**
 * A synthetic container standing for the children of a real parent at the positions
 * {@code start ... end} (inclusive). Buckets are never stored; they are interned by the
 * {@link BucketingEngine} so equal ranges always get the same id.
 */
public final class Bucket {

  private final long id;

  private final long parentId;

  private final long apparentParentId;

  private final long start;

  private final long end;

  private final int rank;

  Bucket(final long id, final long parentId, final long apparentParentId, final long start, final long end,
      final int rank) {
    this.id = id;
    this.parentId = parentId;
    this.apparentParentId = apparentParentId;
    this.start = start;
    this.end = end;
    this.rank = rank;
  }

  public long getId() {
    return id;
  }

  /**
   * The real node whose children the bucket groups.
   *
   * @return the id of the real parent
   */
  public long getParentId() {
    return parentId;
  }

  /**
   * The node the bucket is shown under: the real parent, or the enclosing bucket if buckets are
   * nested.
   *
   * @return the id of the apparent parent
   */
  public long getApparentParentId() {
    return apparentParentId;
  }

  public long getStart() {
    return start;
  }

  public long getEnd() {
    return end;
  }

  public long length() {
    return end - start + 1;
  }

  public int getRank() {
    return rank;
  }

  public boolean contains(final long position) {
    return position >= start && position <= end;
  }

  public String getLabel() {
    return label(start, end);
  }

  static String label(final long start, final long end) {
    return "[" + start + " … " + end + "]";
  }

  /**
   * Node view of the bucket. Its path is the path of the real parent.
   *
   * @param parentPath materialized path of the real parent
   * @return the node
   */
  public Node toNode(final String parentPath) {
    requireNonNull(parentPath);
    return new Node(id, apparentParentId, getLabel(), NodeKind.BUCKET, null, rank, parentPath, length());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("id", id)
                      .add("parentId", parentId)
                      .add("apparentParentId", apparentParentId)
                      .add("start", start)
                      .add("end", end)
                      .add("rank", rank)
                      .toString();
  }
}
