package io.arbor.service.navigate;

import io.arbor.exception.NodeNotFoundException;
import io.arbor.index.bucket.Bucket;
import io.arbor.index.bucket.BucketingEngine;
import io.arbor.node.Node;
import io.arbor.node.NodeKind;
import io.arbor.store.NodeStore;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Read-only view of the tree as the explorer presents it: children windows with buckets for large
 * parents, breadcrumbs, and the chain of entries to expand to reveal a node.
 */
public final class Navigator {

  /** Suffix of truncated previews. */
  public static final String ELLIPSIS = "...";

  private final NodeStore store;

  private final BucketingEngine bucketingEngine;

  private final int previewLength;

  public Navigator(final NodeStore store, final BucketingEngine bucketingEngine, final int previewLength) {
    checkArgument(previewLength > ELLIPSIS.length(), "previewLength must be > %s", ELLIPSIS.length());
    this.store = requireNonNull(store);
    this.bucketingEngine = requireNonNull(bucketingEngine);
    this.previewLength = previewLength;
  }

  /**
   * Window of the entries shown under a node or bucket.
   *
   * @param parentId a node id or a bucket id
   * @param offset position of the first entry
   * @param limit maximum number of entries
   * @return the entries, buckets if the parent has more children than the bucket threshold
   * @throws NodeNotFoundException if the parent is unknown
   */
  public List<ChildSummary> window(final long parentId, final long offset, final int limit) {
    checkArgument(offset >= 0, "offset must be >= 0");
    checkArgument(limit >= 0, "limit must be >= 0");
    if (BucketingEngine.isBucketId(parentId)) {
      final Bucket bucket = getBucket(parentId);
      return rangeWindow(bucket.getParentId(), bucket.getStart(), bucket.length(), parentId, offset, limit);
    }
    final Node parent = store.getNode(parentId);
    return rangeWindow(parentId, 0, parent.getChildCount(), parentId, offset, limit);
  }

  /**
   * Number of entries shown under a node or bucket.
   *
   * @param parentId a node id or a bucket id
   * @return the number of entries
   */
  public long entryCount(final long parentId) {
    final long length = BucketingEngine.isBucketId(parentId)
        ? getBucket(parentId).length()
        : store.getChildCount(parentId);
    if (bucketingEngine.needsBuckets(length)) {
      final long span = bucketingEngine.span(length);
      return (length + span - 1) / span;
    }
    return length;
  }

  private List<ChildSummary> rangeWindow(final long realParentId, final long start, final long length,
      final long apparentParentId, final long offset, final int limit) {
    if (offset >= length || limit == 0) {
      return Collections.emptyList();
    }
    final List<ChildSummary> window = new ArrayList<>();
    if (bucketingEngine.needsBuckets(length)) {
      final List<Bucket> buckets = bucketingEngine.buckets(realParentId, start, length, apparentParentId);
      final int end = (int) Math.min(buckets.size(), offset + limit);
      for (int i = (int) Math.min(offset, buckets.size()); i < end; i++) {
        final Bucket bucket = buckets.get(i);
        window.add(new ChildSummary(bucket.getId(), bucket.getLabel(), NodeKind.BUCKET, null,
            bucket.length(), bucket.getRank()));
      }
      return window;
    }
    final int count = (int) Math.min(limit, length - offset);
    for (final Node child : store.getChildren(realParentId, start + offset, count)) {
      window.add(summarize(child));
    }
    return window;
  }

  private ChildSummary summarize(final Node node) {
    final String preview = node.getKind().isContainer() ? null : preview(node.getValue(), previewLength);
    return new ChildSummary(node.getId(), node.getKey(), node.getKind(), preview, node.getChildCount(),
        node.getRank());
  }

  /**
   * Truncate a value for display.
   *
   * @param value the value
   * @param maxLength maximum length of the result, including the ellipsis
   * @return the value if it fits, otherwise its head followed by {@value #ELLIPSIS}
   */
  public static @Nullable String preview(final @Nullable String value, final int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
  }

  /**
   * Node view of a node or bucket id.
   *
   * @param id the id
   * @return the node
   * @throws NodeNotFoundException if the id is unknown
   */
  public Node node(final long id) {
    if (BucketingEngine.isBucketId(id)) {
      final Bucket bucket = getBucket(id);
      return bucket.toNode(store.getNode(bucket.getParentId()).getPath());
    }
    return store.getNode(id);
  }

  private Bucket getBucket(final long bucketId) {
    return bucketingEngine.getBucket(bucketId).orElseThrow(() -> NodeNotFoundException.forId(bucketId));
  }

  /**
   * Breadcrumbs of a node: the real nodes from the root down to the node. For a bucket, the
   * breadcrumbs of its real parent.
   *
   * @param id a node id or a bucket id
   * @return the lineage, root first
   */
  public List<Node> lineage(final long id) {
    Node current = BucketingEngine.isBucketId(id) ? store.getNode(getBucket(id).getParentId()) : store.getNode(id);
    final List<Node> lineage = new ArrayList<>();
    lineage.add(current);
    while (current.hasParent()) {
      current = store.getNode(current.getParentId());
      lineage.add(current);
    }
    Collections.reverse(lineage);
    return lineage;
  }

  /**
   * Entries to expand, in order, to make a node visible: the lineage of the node with the buckets
   * of every bucketed ancestor inserted before the child they contain. The last entry is the node
   * itself.
   *
   * @param id a node id
   * @return the chain, root first
   */
  public List<Node> reveal(final long id) {
    final List<Node> lineage = lineage(id);
    final List<Node> chain = new ArrayList<>(lineage.size());
    chain.add(lineage.get(0));
    for (int i = 1; i < lineage.size(); i++) {
      final Node parent = lineage.get(i - 1);
      final Node child = lineage.get(i);
      for (final Bucket bucket : bucketingEngine.bucketChain(parent.getId(), parent.getChildCount(),
          child.getRank())) {
        chain.add(bucket.toNode(parent.getPath()));
      }
      chain.add(child);
    }
    return chain;
  }
}
